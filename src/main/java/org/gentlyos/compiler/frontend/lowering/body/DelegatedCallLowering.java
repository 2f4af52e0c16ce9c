package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.FieldEntry;
import org.gentlyos.compiler.frontend.ast.SpecificationNode;
import org.gentlyos.compiler.frontend.types.ExpressionConverter;
import org.gentlyos.compiler.frontend.types.NameConventions;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Lowers an entry-point block nested in a body to a call of that entry point, passing the
 * field values as arguments.
 */
public class DelegatedCallLowering implements IBodyLoweringHandler {

    private static final String DEFAULT_NAME = "spec";

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        SpecificationNode spec = (SpecificationNode) node;
        String name = spec.name() != null ? spec.name() : DEFAULT_NAME;
        List<AstNode> args = spec.fields().stream().map(FieldEntry::value).toList();
        out.add(new MoveStatement.Raw(NameConventions.toSnakeCase(name)
                + "(" + ExpressionConverter.joinArguments(args) + ");"));
    }
}
