package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.CheckpointNode;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.List;

/**
 * Lowers a checkpoint to an event emission carrying the hash as a byte string.
 */
public class EmitLowering implements IBodyLoweringHandler {

    @Override
    public void lower(AstNode node, BodyLowerer lowerer, List<MoveStatement> out) {
        String hash = ((CheckpointNode) node).hash();
        out.add(new MoveStatement.Emit(
                lowerer.context().eventTypeName(hash),
                List.of(new MoveStatement.EmitField("hash", "b\"" + hash + "\""))));
    }
}
