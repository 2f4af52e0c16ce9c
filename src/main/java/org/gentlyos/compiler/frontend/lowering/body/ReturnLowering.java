package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.GoalNode;
import org.gentlyos.compiler.frontend.ast.ReturnNode;
import org.gentlyos.compiler.frontend.types.ExpressionConverter;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Lowers goals and return expressions to a trailing return value.
 */
public class ReturnLowering implements IBodyLoweringHandler {

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        AstNode value = node instanceof GoalNode goal ? goal.expression() : ((ReturnNode) node).value();
        out.add(new MoveStatement.Return(ExpressionConverter.toMoveExpression(value)));
    }
}
