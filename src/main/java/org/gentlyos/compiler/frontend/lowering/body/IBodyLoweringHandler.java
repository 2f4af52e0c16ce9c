package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Lowers one kind of AST node found inside a function, loop or conditional body into Move
 * statements.
 */
public interface IBodyLoweringHandler {

    /**
     * Appends the statements for a node to the output list.
     *
     * @param node    The node to lower. Its class is the one the handler was registered for.
     * @param lowerer The body lowerer, for recursive lowering and access to the context.
     * @param out     The statement list being built.
     */
    void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out);
}
