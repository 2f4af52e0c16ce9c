package org.gentlyos.compiler.frontend.ast;

import java.util.Objects;

/**
 * Immutable rule ({@code bone RULE}), e.g. {@code AuthToken} or {@code NOT: store passwords plain}.
 */
public record ImmutableNode(String rule) implements AstNode {

    public ImmutableNode {
        Objects.requireNonNull(rule, "rule");
    }
}
