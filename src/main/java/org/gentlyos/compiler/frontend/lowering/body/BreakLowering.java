package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

public class BreakLowering implements IBodyLoweringHandler {

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        out.add(new MoveStatement.Raw("break"));
    }
}
