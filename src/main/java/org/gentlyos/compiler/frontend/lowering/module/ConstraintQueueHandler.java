package org.gentlyos.compiler.frontend.lowering.module;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.ConstraintNode;
import org.gentlyos.compiler.frontend.ast.ImmutableNode;

/**
 * A constraint block at module scope queues its rules for the next entry or internal function.
 * Entries that are not rules are ignored.
 */
public class ConstraintQueueHandler implements IModuleLevelHandler {

    @Override
    public void handle(AstNode node, ModuleLevelDispatcher dispatcher) {
        for (AstNode rule : ((ConstraintNode) node).rules()) {
            if (rule instanceof ImmutableNode immutable) {
                dispatcher.context().enqueueConstraint(immutable.rule());
            }
        }
    }
}
