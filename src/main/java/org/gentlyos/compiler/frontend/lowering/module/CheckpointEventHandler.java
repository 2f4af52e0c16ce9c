package org.gentlyos.compiler.frontend.lowering.module;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.CheckpointNode;
import org.gentlyos.compiler.model.MoveField;
import org.gentlyos.compiler.model.MoveStruct;
import org.gentlyos.compiler.model.MoveTypes;

import java.util.List;

/**
 * A checkpoint at module scope defines the event type emitted for that hash.
 */
public class CheckpointEventHandler implements IModuleLevelHandler {

    @Override
    public void handle(AstNode node, ModuleLevelDispatcher dispatcher) {
        String hash = ((CheckpointNode) node).hash();
        dispatcher.context().addStruct(MoveStruct.event(
                dispatcher.context().eventTypeName(hash),
                List.of(new MoveField("hash", MoveTypes.BYTES))));
    }
}
