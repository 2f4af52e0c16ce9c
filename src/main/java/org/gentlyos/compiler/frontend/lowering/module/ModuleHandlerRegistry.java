package org.gentlyos.compiler.frontend.lowering.module;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.CheckpointNode;
import org.gentlyos.compiler.frontend.ast.ConstraintNode;
import org.gentlyos.compiler.frontend.ast.FetchNode;
import org.gentlyos.compiler.frontend.ast.FlexibleNode;
import org.gentlyos.compiler.frontend.ast.ForeverLoopNode;
import org.gentlyos.compiler.frontend.ast.FunctionNode;
import org.gentlyos.compiler.frontend.ast.GoalNode;
import org.gentlyos.compiler.frontend.ast.ImmutableNode;
import org.gentlyos.compiler.frontend.ast.IncompleteNode;
import org.gentlyos.compiler.frontend.ast.LoopNode;
import org.gentlyos.compiler.frontend.ast.ProgramNode;
import org.gentlyos.compiler.frontend.ast.SpecificationNode;
import org.gentlyos.compiler.frontend.ast.TimesLoopNode;
import org.gentlyos.compiler.frontend.ast.VariableNode;
import org.gentlyos.compiler.frontend.ast.WhileLoopNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping AST node classes to module-level handlers.
 * Kinds without a handler are skipped at module scope.
 */
public final class ModuleHandlerRegistry {

    private final Map<Class<? extends AstNode>, IModuleLevelHandler> handlers = new HashMap<>();

    /**
     * Registers a handler for the given AST node class, replacing any earlier registration.
     *
     * @param nodeType The concrete AST node class.
     * @param handler  The handler instance.
     * @param <T>      Concrete AST type parameter.
     */
    public <T extends AstNode> void register(Class<T> nodeType, IModuleLevelHandler handler) {
        handlers.put(nodeType, handler);
    }

    /**
     * Resolves the handler for the given node class.
     *
     * @param nodeType The AST node class to look up.
     * @return Optional handler if registered.
     */
    public Optional<IModuleLevelHandler> resolve(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(handlers.get(nodeType));
    }

    /**
     * Creates a registry pre-populated with the default module-level handlers.
     *
     * @return A fully initialized registry.
     */
    public static ModuleHandlerRegistry initializeWithDefaults() {
        ModuleHandlerRegistry registry = new ModuleHandlerRegistry();

        // Structs
        registry.register(ImmutableNode.class, new ResourceStructHandler());
        registry.register(FlexibleNode.class, new FlexibleStructHandler());
        registry.register(CheckpointNode.class, new CheckpointEventHandler());
        registry.register(VariableNode.class, new StrayBindingHandler());

        // Functions
        registry.register(SpecificationNode.class, new EntryFunctionHandler());
        registry.register(FunctionNode.class, new InternalFunctionHandler());
        registry.register(GoalNode.class, new GoalFunctionHandler());
        registry.register(IncompleteNode.class, new TodoStubHandler());
        LoopEntryHandler loops = new LoopEntryHandler();
        registry.register(LoopNode.class, loops);
        registry.register(WhileLoopNode.class, loops);
        registry.register(TimesLoopNode.class, loops);
        registry.register(ForeverLoopNode.class, loops);

        // Module bookkeeping
        registry.register(ConstraintNode.class, new ConstraintQueueHandler());
        registry.register(FetchNode.class, new DependencyDeclarationHandler());
        registry.register(ProgramNode.class, new NestedProgramHandler());

        return registry;
    }
}
