package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.BinaryOpNode;
import org.gentlyos.compiler.frontend.ast.PropertyNode;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

import static org.gentlyos.compiler.frontend.types.ExpressionConverter.toMoveExpression;

/**
 * Lowers a bare expression to an expression statement. At statement level an infix operation
 * is written without the enclosing parentheses that {@code toMoveExpression} adds.
 */
public class ExpressionStatementLowering implements IBodyLoweringHandler {

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        String code;
        if (node instanceof BinaryOpNode op) {
            code = toMoveExpression(op.left()) + " " + op.op() + " " + toMoveExpression(op.right());
        } else if (node instanceof PropertyNode property) {
            code = toMoveExpression(property.object()) + "." + property.property();
        } else {
            code = toMoveExpression(node);
        }
        out.add(new MoveStatement.Raw(code));
    }
}
