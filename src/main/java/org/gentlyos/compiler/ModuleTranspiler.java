package org.gentlyos.compiler;

import org.gentlyos.compiler.api.MoveModule;
import org.gentlyos.compiler.api.TranspileException;
import org.gentlyos.compiler.backend.render.MoveRenderer;
import org.gentlyos.compiler.config.TranspilerOptions;
import org.gentlyos.compiler.diagnostics.DiagnosticsEngine;
import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.ConditionalNode;
import org.gentlyos.compiler.frontend.ast.ProgramNode;
import org.gentlyos.compiler.frontend.lowering.TranspileContext;
import org.gentlyos.compiler.frontend.lowering.body.BodyLowerer;
import org.gentlyos.compiler.frontend.lowering.body.BodyLoweringRegistry;
import org.gentlyos.compiler.frontend.lowering.module.ModuleHandlerRegistry;
import org.gentlyos.compiler.frontend.lowering.module.ModuleLevelDispatcher;
import org.gentlyos.compiler.frontend.types.NameConventions;

import java.util.Objects;
import java.util.Optional;

/**
 * Turns one CODIE syntax tree into one Move module.
 * <p>
 * Each call to {@link #transpile(AstNode)} builds its own context, registries and diagnostics,
 * so a single instance can be shared between threads.
 */
public class ModuleTranspiler {

    static final String MISSING_MODULE_MESSAGE = "No module definition (pug) found in CODIE source";

    private final TranspilerOptions options;
    private final MoveRenderer renderer;

    public ModuleTranspiler(TranspilerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.renderer = new MoveRenderer(options);
    }

    /**
     * Transpiles a syntax tree.
     * <p>
     * The module is named after the first named program found in the tree. A program root has
     * its body walked at module scope; any other root is itself treated as a module-level
     * construct.
     *
     * @param root The root of the tree.
     * @return The generated module.
     * @throws TranspileException if the tree defines no named program.
     */
    public MoveModule transpile(AstNode root) {
        Objects.requireNonNull(root, "root");
        String moduleName = findModuleName(root)
                .map(NameConventions::toSnakeCase)
                .orElseThrow(() -> new TranspileException(MISSING_MODULE_MESSAGE));

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        TranspileContext context = new TranspileContext(options, diagnostics, moduleName);
        BodyLowerer bodyLowerer = new BodyLowerer(context, BodyLoweringRegistry.initializeWithDefaults());
        ModuleLevelDispatcher dispatcher =
                new ModuleLevelDispatcher(context, ModuleHandlerRegistry.initializeWithDefaults(), bodyLowerer);

        dispatcher.walk(root);
        context.discardPendingConstraints();

        String source = renderer.render(moduleName, context.structs(), context.functions(), context.dependencies());
        return new MoveModule(
                moduleName,
                source,
                context.structs(),
                context.functions(),
                context.dependencies(),
                root.vaultReferences(),
                diagnostics.getDiagnostics());
    }

    /**
     * Finds the name of the first program with a non-blank name, depth-first from the root.
     * <p>
     * Conditional branches are searched as well, although they are not children of the node.
     */
    static Optional<String> findModuleName(AstNode node) {
        if (node instanceof ProgramNode program && !program.name().isBlank()) {
            return Optional.of(program.name());
        }
        if (node instanceof ConditionalNode conditional) {
            return findModuleName(conditional.thenBranch());
        }
        for (AstNode child : node.getChildren()) {
            Optional<String> name = findModuleName(child);
            if (name.isPresent()) {
                return name;
            }
        }
        return Optional.empty();
    }
}
