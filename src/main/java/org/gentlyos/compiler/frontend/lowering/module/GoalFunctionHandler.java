package org.gentlyos.compiler.frontend.lowering.module;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.GoalNode;
import org.gentlyos.compiler.frontend.types.ExpressionConverter;
import org.gentlyos.compiler.frontend.types.MoveTypeMapper;
import org.gentlyos.compiler.model.MoveFunction;
import org.gentlyos.compiler.model.MoveStatement;
import org.gentlyos.compiler.model.MoveVisibility;

import java.util.List;

/**
 * A goal at module scope defines the public {@code output} function returning the goal
 * expression. Queued constraints stay queued for the next entry or internal function.
 */
public class GoalFunctionHandler implements IModuleLevelHandler {

    static final String FUNCTION_NAME = "output";

    @Override
    public void handle(AstNode node, ModuleLevelDispatcher dispatcher) {
        AstNode expression = ((GoalNode) node).expression();
        dispatcher.context().addFunction(new MoveFunction(
                FUNCTION_NAME,
                MoveVisibility.PUBLIC_PACKAGE,
                List.of(),
                MoveTypeMapper.inferType(expression),
                List.of(new MoveStatement.Return(ExpressionConverter.toMoveExpression(expression)))));
    }
}
