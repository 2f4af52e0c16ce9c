package org.gentlyos.compiler.frontend.lowering.module;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.FlexibleNode;
import org.gentlyos.compiler.frontend.ast.IdentifierNode;
import org.gentlyos.compiler.frontend.ast.VariableNode;
import org.gentlyos.compiler.frontend.types.NameConventions;
import org.gentlyos.compiler.model.MoveField;
import org.gentlyos.compiler.model.MoveStruct;
import org.gentlyos.compiler.model.MoveTypes;

import java.util.ArrayList;
import java.util.List;

/**
 * A flexible block at module scope defines a droppable struct.
 * <p>
 * The {@code id} field always comes first. Variable bindings become fields typed from their
 * declaration or their value, bare identifiers become {@code u64} fields, and a struct with no
 * other field gets a default {@code value: u64}.
 */
public class FlexibleStructHandler implements IModuleLevelHandler {

    private static final String DEFAULT_NAME = "Data";

    @Override
    public void handle(AstNode node, ModuleLevelDispatcher dispatcher) {
        FlexibleNode flexible = (FlexibleNode) node;
        String name = flexible.name() != null ? flexible.name() : DEFAULT_NAME;
        dispatcher.context().addStruct(MoveStruct.flexible(NameConventions.toPascalCase(name), fieldsOf(flexible)));
    }

    private static List<MoveField> fieldsOf(FlexibleNode flexible) {
        List<MoveField> fields = new ArrayList<>();
        fields.add(new MoveField("id", MoveTypes.UID));
        for (AstNode entry : flexible.body()) {
            if (entry instanceof VariableNode variable) {
                fields.add(StrayBindingHandler.fieldOf(variable));
            } else if (entry instanceof IdentifierNode identifier) {
                fields.add(new MoveField(NameConventions.toSnakeCase(identifier.name()), MoveTypes.U64));
            }
        }
        if (fields.size() == 1) {
            fields.add(new MoveField("value", MoveTypes.U64));
        }
        return fields;
    }
}
