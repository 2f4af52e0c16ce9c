package org.gentlyos.compiler.frontend.lowering.module;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.SpecificationNode;
import org.gentlyos.compiler.model.MoveVisibility;

/**
 * A specification block at module scope defines a {@code public entry} function.
 */
public class EntryFunctionHandler implements IModuleLevelHandler {

    private static final String DEFAULT_NAME = "execute";

    @Override
    public void handle(AstNode node, ModuleLevelDispatcher dispatcher) {
        SpecificationNode spec = (SpecificationNode) node;
        String name = spec.name() != null ? spec.name() : DEFAULT_NAME;
        dispatcher.addFunctionWithPendingConstraints(FunctionSynthesizer.fromFields(
                dispatcher.context(), name, spec.fields(), MoveVisibility.PUBLIC_ENTRY));
    }
}
