package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.FunctionNode;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Move has no nested functions, so a function defined inside a body is inlined after a marker
 * comment. Its parameters and return type are dropped.
 */
public class InlineFunctionLowering implements IBodyLoweringHandler {

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        FunctionNode function = (FunctionNode) node;
        out.add(new MoveStatement.Comment("inline: " + function.name()));
        lowerer.lowerInto(function.body(), out);
    }
}
