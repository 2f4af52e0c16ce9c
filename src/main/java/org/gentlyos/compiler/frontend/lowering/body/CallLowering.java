package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.CallNode;
import org.gentlyos.compiler.frontend.types.ExpressionConverter;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Lowers a call to a call statement.
 */
public class CallLowering implements IBodyLoweringHandler {

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        CallNode call = (CallNode) node;
        out.add(new MoveStatement.Raw(call.function() + "(" + ExpressionConverter.joinArguments(call.args()) + ");"));
    }
}
