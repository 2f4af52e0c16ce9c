package org.gentlyos.compiler.frontend.lowering.module;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.model.MoveFunction;
import org.gentlyos.compiler.model.MoveVisibility;

import java.util.List;

/**
 * Move has no top-level loops. A loop at module scope is wrapped in a {@code public entry}
 * function named {@code run} that takes only the context parameter.
 */
public class LoopEntryHandler implements IModuleLevelHandler {

    static final String FUNCTION_NAME = "run";

    @Override
    public void handle(AstNode node, ModuleLevelDispatcher dispatcher) {
        dispatcher.context().addFunction(new MoveFunction(
                FUNCTION_NAME,
                MoveVisibility.PUBLIC_ENTRY,
                List.of(dispatcher.context().contextParam()),
                null,
                dispatcher.bodyLowerer().lower(List.of(node))));
    }
}
