package org.gentlyos.compiler.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A node of the CODIE abstract syntax tree as produced by the external parser.
 *
 * <p>The set of node kinds is closed: every kind is a record listed in the {@code permits}
 * clause. The transpiler dispatches on the concrete record class through its handler
 * registries instead of asking the nodes to translate themselves.
 */
public sealed interface AstNode permits
        ProgramNode, FetchNode, LoopNode, WhileLoopNode, ForeverLoopNode, TimesLoopNode,
        FunctionNode, VariableNode, IncompleteNode, ConstraintNode, SpecificationNode,
        ImmutableNode, FlexibleNode, GoalNode, CheckpointNode, ConditionalNode, ReturnNode,
        BreakNode, SourceNode, LiteralNode, IdentifierNode, BinaryOpNode, CallNode,
        ObjectNode, ListNode, PropertyNode, CommentNode, EmptyNode {

    /**
     * Returns the statement-level children of this node, i.e. the body of a block construct.
     * Expression operands are not children in this sense.
     *
     * @return The child nodes, never null.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }

    /**
     * Checks whether this node, or any statement nested inside it, touches a source that
     * requires privileged access (a vault).
     *
     * @return {@code true} if privileged access is required.
     */
    default boolean requiresPrivilegedAccess() {
        for (AstNode child : getChildren()) {
            if (child.requiresPrivilegedAccess()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Collects the paths of all vault references in this subtree, in walk order.
     *
     * @return The vault paths, possibly empty.
     */
    default List<String> vaultReferences() {
        List<String> refs = new ArrayList<>();
        collectVaultReferences(this, refs);
        return refs;
    }

    private static void collectVaultReferences(AstNode node, List<String> refs) {
        if (node instanceof FetchNode fetch && fetch.sourceKind() == SourceKind.VAULT) {
            refs.add(fetch.source());
        } else if (node instanceof SourceNode source && source.kind() == SourceKind.VAULT) {
            refs.add(source.path());
        }
        for (AstNode child : node.getChildren()) {
            collectVaultReferences(child, refs);
        }
    }
}
