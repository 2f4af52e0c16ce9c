package org.gentlyos.compiler.frontend.lowering.module;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.ImmutableNode;
import org.gentlyos.compiler.frontend.types.ConstraintTransforms;
import org.gentlyos.compiler.frontend.types.NameConventions;
import org.gentlyos.compiler.model.MoveField;
import org.gentlyos.compiler.model.MoveStruct;
import org.gentlyos.compiler.model.MoveTypes;

import java.util.List;

/**
 * A rule at module scope defines a linear resource struct named after the rule, with an
 * {@code id} and a {@code value} field.
 */
public class ResourceStructHandler implements IModuleLevelHandler {

    @Override
    public void handle(AstNode node, ModuleLevelDispatcher dispatcher) {
        String rule = ((ImmutableNode) node).rule();
        String name = NameConventions.toPascalCase(ConstraintTransforms.extractStructName(rule));
        dispatcher.context().addStruct(MoveStruct.resource(name, List.of(
                new MoveField("id", MoveTypes.UID),
                new MoveField("value", MoveTypes.U64))));
    }
}
