package org.gentlyos.compiler.frontend.ast;

import java.util.Objects;

/**
 * Single-branch conditional ({@code ? condition -> action}).
 */
public record ConditionalNode(AstNode condition, AstNode thenBranch) implements AstNode {

    public ConditionalNode {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(thenBranch, "thenBranch");
    }
}
