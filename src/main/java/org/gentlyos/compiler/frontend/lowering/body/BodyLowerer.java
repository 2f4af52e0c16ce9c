package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.diagnostics.Diagnostic;
import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.lowering.TranspileContext;
import org.gentlyos.compiler.model.MoveStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lowers the statements of a function, loop or conditional body into an ordered list of Move
 * statements by dispatching each node to its registered {@link IBodyLoweringHandler}.
 * Nested bodies recurse through the same registry.
 */
public class BodyLowerer {

    private final TranspileContext context;
    private final BodyLoweringRegistry registry;

    /**
     * @param context  The per-call transpile context.
     * @param registry The handler registry.
     */
    public BodyLowerer(TranspileContext context, BodyLoweringRegistry registry) {
        this.context = context;
        this.registry = registry;
    }

    /**
     * Lowers a list of body nodes into a fresh statement list.
     *
     * @param nodes The body nodes.
     * @return The lowered statements.
     */
    public List<MoveStatement> lower(List<AstNode> nodes) {
        List<MoveStatement> out = new ArrayList<>();
        lowerInto(nodes, out);
        return out;
    }

    /**
     * Lowers a list of body nodes, appending to an existing statement list.
     *
     * @param nodes The body nodes.
     * @param out   The statement list being built.
     */
    public void lowerInto(List<AstNode> nodes, List<MoveStatement> out) {
        for (AstNode node : nodes) {
            lowerNode(node, out);
        }
    }

    /**
     * Lowers a single node. A kind without a handler becomes a comment and is reported.
     *
     * @param node The node.
     * @param out  The statement list being built.
     */
    public void lowerNode(AstNode node, List<MoveStatement> out) {
        Optional<IBodyLoweringHandler> handler = registry.resolve(node.getClass());
        if (handler.isPresent()) {
            handler.get().lower(node, this, out);
            return;
        }
        String kind = node.getClass().getSimpleName();
        context.diagnostics().report(Diagnostic.Kind.UNSUPPORTED_NODE,
                "No body lowering for " + kind + " in module '" + context.moduleName() + "'");
        out.add(new MoveStatement.Comment("unsupported: " + kind));
    }

    public TranspileContext context() {
        return context;
    }
}
