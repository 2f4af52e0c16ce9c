package org.gentlyos.compiler.frontend.lowering.module;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.lowering.TranspileContext;
import org.gentlyos.compiler.frontend.lowering.body.BodyLowerer;
import org.gentlyos.compiler.model.MoveFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Walks the top-level constructs of a program and dispatches each one to its registered
 * {@link IModuleLevelHandler}. Constructs without a handler are skipped.
 */
public class ModuleLevelDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ModuleLevelDispatcher.class);

    private final TranspileContext context;
    private final ModuleHandlerRegistry registry;
    private final BodyLowerer bodyLowerer;

    /**
     * @param context     The per-call transpile context.
     * @param registry    The module-level handler registry.
     * @param bodyLowerer The lowerer used for function and loop bodies.
     */
    public ModuleLevelDispatcher(TranspileContext context, ModuleHandlerRegistry registry, BodyLowerer bodyLowerer) {
        this.context = context;
        this.registry = registry;
        this.bodyLowerer = bodyLowerer;
    }

    /**
     * Walks a list of module-level nodes in order.
     *
     * @param nodes The nodes.
     */
    public void walkAll(List<AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Dispatches one module-level node.
     *
     * @param node The node.
     */
    public void walk(AstNode node) {
        Optional<IModuleLevelHandler> handler = registry.resolve(node.getClass());
        if (handler.isPresent()) {
            handler.get().handle(node, this);
        } else {
            LOG.debug("Skipping {} at module scope of '{}'", node.getClass().getSimpleName(), context.moduleName());
        }
    }

    /**
     * Adds a function constructed from a CODIE function construct, first draining the pending
     * constraint queue into asserts at the front of its body.
     *
     * @param function The freshly built function.
     */
    public void addFunctionWithPendingConstraints(MoveFunction function) {
        context.addFunction(context.injectPendingConstraints(function));
    }

    public TranspileContext context() {
        return context;
    }

    public BodyLowerer bodyLowerer() {
        return bodyLowerer;
    }
}
