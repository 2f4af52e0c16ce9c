package org.gentlyos.compiler.frontend.ast;

import java.util.List;
import java.util.Objects;

/**
 * Conditional loop ({@code spin WHILE condition}).
 */
public record WhileLoopNode(AstNode condition, List<AstNode> body) implements AstNode {

    public WhileLoopNode {
        Objects.requireNonNull(condition, "condition");
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
