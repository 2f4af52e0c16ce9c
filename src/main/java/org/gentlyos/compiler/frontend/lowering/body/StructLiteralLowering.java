package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.FlexibleNode;
import org.gentlyos.compiler.frontend.ast.VariableNode;
import org.gentlyos.compiler.frontend.types.ExpressionConverter;
import org.gentlyos.compiler.frontend.types.NameConventions;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Lowers a flexible block inside a body to a struct literal bound to a local. Only variable
 * bindings contribute field assignments.
 */
public class StructLiteralLowering implements IBodyLoweringHandler {

    private static final String DEFAULT_NAME = "data";

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        FlexibleNode flexible = (FlexibleNode) node;
        String name = flexible.name() != null ? flexible.name() : DEFAULT_NAME;
        out.add(new MoveStatement.Raw("let " + NameConventions.toSnakeCase(name)
                + " = " + NameConventions.toPascalCase(name) + " {"));
        for (AstNode child : flexible.body()) {
            if (child instanceof VariableNode field) {
                out.add(new MoveStatement.Raw("    " + NameConventions.toSnakeCase(field.name())
                        + ": " + ExpressionConverter.toMoveExpression(field.value()) + ","));
            }
        }
        out.add(new MoveStatement.Raw("};"));
    }
}
