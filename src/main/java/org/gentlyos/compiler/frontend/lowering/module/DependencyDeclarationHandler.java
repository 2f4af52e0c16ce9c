package org.gentlyos.compiler.frontend.lowering.module;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.FetchNode;
import org.gentlyos.compiler.frontend.lowering.body.BorrowLowering;

/**
 * A fetch at module scope declares a dependency when its source holds remote or stateful data.
 */
public class DependencyDeclarationHandler implements IModuleLevelHandler {

    @Override
    public void handle(AstNode node, ModuleLevelDispatcher dispatcher) {
        FetchNode fetch = (FetchNode) node;
        if (fetch.sourceKind().isModuleDependency()) {
            dispatcher.context().addDependency(BorrowLowering.dependencyRoot(fetch.source()));
        }
    }
}
