package org.gentlyos.compiler.frontend.ast;

import java.util.Objects;

/**
 * Return expression ({@code -> value}).
 */
public record ReturnNode(AstNode value) implements AstNode {

    public ReturnNode {
        Objects.requireNonNull(value, "value");
    }
}
