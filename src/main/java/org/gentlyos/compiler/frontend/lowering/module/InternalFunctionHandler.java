package org.gentlyos.compiler.frontend.lowering.module;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.FunctionNode;
import org.gentlyos.compiler.model.MoveVisibility;

/**
 * A function definition at module scope defines a module-private function.
 */
public class InternalFunctionHandler implements IModuleLevelHandler {

    @Override
    public void handle(AstNode node, ModuleLevelDispatcher dispatcher) {
        dispatcher.addFunctionWithPendingConstraints(FunctionSynthesizer.fromBody(
                dispatcher.context(), dispatcher.bodyLowerer(), (FunctionNode) node, MoveVisibility.INTERNAL));
    }
}
