package org.gentlyos.compiler.frontend.lowering.module;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.IncompleteNode;
import org.gentlyos.compiler.model.MoveFunction;
import org.gentlyos.compiler.model.MoveStatement;
import org.gentlyos.compiler.model.MoveVisibility;

import java.util.List;

/**
 * An incomplete marker at module scope becomes an empty {@code todo} function holding the
 * marker comment. Only the comment is used here; the hash is ignored.
 */
public class TodoStubHandler implements IModuleLevelHandler {

    @Override
    public void handle(AstNode node, ModuleLevelDispatcher dispatcher) {
        String comment = ((IncompleteNode) node).comment();
        String message = comment != null ? comment : "incomplete";
        dispatcher.context().addFunction(new MoveFunction(
                "todo",
                MoveVisibility.INTERNAL,
                List.of(),
                null,
                List.of(new MoveStatement.Comment("TODO: " + message))));
    }
}
