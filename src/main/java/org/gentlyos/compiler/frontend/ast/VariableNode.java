package org.gentlyos.compiler.frontend.ast;

import java.util.Objects;

/**
 * Variable binding ({@code elf name <- value}).
 *
 * @param name     The bound name.
 * @param typeHint The declared type, or null when the binding is untyped.
 * @param value    The bound expression.
 */
public record VariableNode(String name, CodieType typeHint, AstNode value) implements AstNode {

    public VariableNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    public static VariableNode untyped(String name, AstNode value) {
        return new VariableNode(name, null, value);
    }
}
