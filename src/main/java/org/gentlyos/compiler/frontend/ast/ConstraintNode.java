package org.gentlyos.compiler.frontend.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Declarative constraint block ({@code fence}). Rules are normally {@link ImmutableNode}s.
 */
public record ConstraintNode(List<AstNode> rules) implements AstNode {

    public ConstraintNode {
        rules = List.copyOf(rules);
    }

    /**
     * Creates a block of plain-text rules.
     */
    public static ConstraintNode ofRules(String... rules) {
        return new ConstraintNode(Arrays.stream(rules)
                .<AstNode>map(ImmutableNode::new)
                .toList());
    }

    @Override
    public List<AstNode> getChildren() {
        return rules;
    }
}
