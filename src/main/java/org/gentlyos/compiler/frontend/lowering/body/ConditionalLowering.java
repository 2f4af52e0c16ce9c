package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.ConditionalNode;
import org.gentlyos.compiler.frontend.types.ExpressionConverter;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Lowers a single-branch conditional to {@code if (cond) { ... }}.
 */
public class ConditionalLowering implements IBodyLoweringHandler {

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        ConditionalNode conditional = (ConditionalNode) node;
        out.add(new MoveStatement.Raw("if (" + ExpressionConverter.toMoveExpression(conditional.condition()) + ") {"));
        lowerer.lowerNode(conditional.thenBranch(), out);
        out.add(new MoveStatement.Raw("}"));
    }
}
