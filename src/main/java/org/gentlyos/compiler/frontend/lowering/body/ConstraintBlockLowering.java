package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.ConstraintNode;
import org.gentlyos.compiler.frontend.ast.ImmutableNode;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Lowers a constraint block inside a body. Each rule becomes an assert with a fresh error code;
 * any other entry is lowered as an ordinary statement.
 */
public class ConstraintBlockLowering implements IBodyLoweringHandler {

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        for (AstNode rule : ((ConstraintNode) node).rules()) {
            if (rule instanceof ImmutableNode immutable) {
                out.add(lowerer.context().assertFor(immutable.rule()));
            } else {
                lowerer.lowerNode(rule, out);
            }
        }
    }
}
