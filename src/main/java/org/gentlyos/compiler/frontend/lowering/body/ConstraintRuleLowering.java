package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.ImmutableNode;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Lowers a standalone rule inside a body to an assert.
 */
public class ConstraintRuleLowering implements IBodyLoweringHandler {

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        out.add(lowerer.context().assertFor(((ImmutableNode) node).rule()));
    }
}
