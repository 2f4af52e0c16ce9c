package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.IncompleteNode;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Lowers an incomplete marker to a TODO comment, preferring the comment over the hash.
 */
public class TodoLowering implements IBodyLoweringHandler {

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        IncompleteNode incomplete = (IncompleteNode) node;
        String message = incomplete.comment() != null ? incomplete.comment()
                : incomplete.hash() != null ? incomplete.hash()
                : "incomplete";
        out.add(new MoveStatement.Comment("TODO: " + message));
    }
}
