package org.gentlyos.compiler.frontend.ast;

import java.util.Objects;

/**
 * Infix operation. The operator is kept as written.
 */
public record BinaryOpNode(AstNode left, String op, AstNode right) implements AstNode {

    public BinaryOpNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(right, "right");
    }
}
