package org.gentlyos.compiler.frontend.lowering.body;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.BinaryOpNode;
import org.gentlyos.compiler.frontend.ast.BreakNode;
import org.gentlyos.compiler.frontend.ast.CallNode;
import org.gentlyos.compiler.frontend.ast.CheckpointNode;
import org.gentlyos.compiler.frontend.ast.CommentNode;
import org.gentlyos.compiler.frontend.ast.ConditionalNode;
import org.gentlyos.compiler.frontend.ast.ConstraintNode;
import org.gentlyos.compiler.frontend.ast.EmptyNode;
import org.gentlyos.compiler.frontend.ast.FetchNode;
import org.gentlyos.compiler.frontend.ast.FlexibleNode;
import org.gentlyos.compiler.frontend.ast.ForeverLoopNode;
import org.gentlyos.compiler.frontend.ast.FunctionNode;
import org.gentlyos.compiler.frontend.ast.GoalNode;
import org.gentlyos.compiler.frontend.ast.IdentifierNode;
import org.gentlyos.compiler.frontend.ast.ImmutableNode;
import org.gentlyos.compiler.frontend.ast.IncompleteNode;
import org.gentlyos.compiler.frontend.ast.ListNode;
import org.gentlyos.compiler.frontend.ast.LiteralNode;
import org.gentlyos.compiler.frontend.ast.LoopNode;
import org.gentlyos.compiler.frontend.ast.ObjectNode;
import org.gentlyos.compiler.frontend.ast.ProgramNode;
import org.gentlyos.compiler.frontend.ast.PropertyNode;
import org.gentlyos.compiler.frontend.ast.ReturnNode;
import org.gentlyos.compiler.frontend.ast.SourceNode;
import org.gentlyos.compiler.frontend.ast.SpecificationNode;
import org.gentlyos.compiler.frontend.ast.TimesLoopNode;
import org.gentlyos.compiler.frontend.ast.VariableNode;
import org.gentlyos.compiler.frontend.ast.WhileLoopNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping AST node classes to body lowering handlers.
 * Follows the same pattern as {@link org.gentlyos.compiler.frontend.lowering.module.ModuleHandlerRegistry}.
 */
public final class BodyLoweringRegistry {

    private final Map<Class<? extends AstNode>, IBodyLoweringHandler> handlers = new HashMap<>();

    /**
     * Registers a handler for the given AST node class, replacing any earlier registration.
     *
     * @param nodeType The concrete AST node class.
     * @param handler  The handler instance.
     * @param <T>      Concrete AST type parameter.
     */
    public <T extends AstNode> void register(Class<T> nodeType, IBodyLoweringHandler handler) {
        handlers.put(nodeType, handler);
    }

    /**
     * Resolves the handler for the given node class.
     *
     * @param nodeType The AST node class to look up.
     * @return Optional handler if registered.
     */
    public Optional<IBodyLoweringHandler> resolve(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(handlers.get(nodeType));
    }

    /**
     * Lists the node kinds of the closed {@link AstNode} hierarchy that have no handler.
     *
     * @return The simple names of uncovered node classes, empty when every kind is handled.
     */
    public List<String> missingKinds() {
        List<String> missing = new ArrayList<>();
        for (Class<?> kind : AstNode.class.getPermittedSubclasses()) {
            if (!handlers.containsKey(kind)) {
                missing.add(kind.getSimpleName());
            }
        }
        return missing;
    }

    /**
     * Creates a registry covering every AST node kind.
     *
     * @return A fully initialized registry.
     */
    public static BodyLoweringRegistry initializeWithDefaults() {
        BodyLoweringRegistry registry = new BodyLoweringRegistry();

        registry.register(VariableNode.class, new LetLowering());
        registry.register(FetchNode.class, new BorrowLowering());
        registry.register(ConstraintNode.class, new ConstraintBlockLowering());
        registry.register(ImmutableNode.class, new ConstraintRuleLowering());
        registry.register(CheckpointNode.class, new EmitLowering());
        registry.register(GoalNode.class, new ReturnLowering());
        registry.register(ReturnNode.class, new ReturnLowering());

        LoopLowering loops = new LoopLowering();
        registry.register(LoopNode.class, loops);
        registry.register(WhileLoopNode.class, loops);
        registry.register(TimesLoopNode.class, loops);
        registry.register(ForeverLoopNode.class, loops);

        registry.register(ConditionalNode.class, new ConditionalLowering());
        registry.register(CallNode.class, new CallLowering());
        registry.register(SourceNode.class, new SourceReferenceLowering());
        registry.register(IncompleteNode.class, new TodoLowering());
        registry.register(FlexibleNode.class, new StructLiteralLowering());
        registry.register(SpecificationNode.class, new DelegatedCallLowering());
        registry.register(ProgramNode.class, new InlineProgramLowering());
        registry.register(FunctionNode.class, new InlineFunctionLowering());
        registry.register(BreakNode.class, new BreakLowering());

        ExpressionStatementLowering expressions = new ExpressionStatementLowering();
        registry.register(LiteralNode.class, expressions);
        registry.register(IdentifierNode.class, expressions);
        registry.register(BinaryOpNode.class, expressions);
        registry.register(PropertyNode.class, expressions);
        registry.register(ObjectNode.class, new ObjectLiteralLowering());

        IgnoredNodeLowering ignored = new IgnoredNodeLowering();
        registry.register(EmptyNode.class, ignored);
        registry.register(CommentNode.class, ignored);
        registry.register(ListNode.class, ignored);

        return registry;
    }
}
