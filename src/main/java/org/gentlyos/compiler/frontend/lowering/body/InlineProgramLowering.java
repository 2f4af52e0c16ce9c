package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.ProgramNode;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Inlines the body of a nested program.
 */
public class InlineProgramLowering implements IBodyLoweringHandler {

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        lowerer.lowerInto(((ProgramNode) node).body(), out);
    }
}
