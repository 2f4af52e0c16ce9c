package org.gentlyos.compiler.frontend.lowering.module;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.ProgramNode;

/**
 * Move modules cannot nest, so a nested program is flattened into the current module.
 */
public class NestedProgramHandler implements IModuleLevelHandler {

    @Override
    public void handle(AstNode node, ModuleLevelDispatcher dispatcher) {
        dispatcher.walkAll(((ProgramNode) node).body());
    }
}
