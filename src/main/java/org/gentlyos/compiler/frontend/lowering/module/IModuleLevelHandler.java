package org.gentlyos.compiler.frontend.lowering.module;

import org.gentlyos.compiler.frontend.ast.AstNode;

/**
 * Handles one kind of construct at module scope, contributing structs, functions, dependencies
 * or queued constraints to the module being built.
 */
public interface IModuleLevelHandler {

    /**
     * Handles a module-level node.
     *
     * @param node       The node. Its class is the one the handler was registered for.
     * @param dispatcher The dispatcher, for recursion and access to the context and body lowerer.
     */
    void handle(AstNode node, ModuleLevelDispatcher dispatcher);
}
