package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Body lowering for empty statements, source comments and bare list literals. This is
 * intentionally a no-op: none of them produce Move statements.
 */
public class IgnoredNodeLowering implements IBodyLoweringHandler {

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        // produces no statements
    }
}
