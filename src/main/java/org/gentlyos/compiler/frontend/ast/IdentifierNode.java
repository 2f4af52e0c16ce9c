package org.gentlyos.compiler.frontend.ast;

import java.util.Objects;

/**
 * Identifier reference. Inside a specification block an identifier value names a type.
 */
public record IdentifierNode(String name) implements AstNode {

    public IdentifierNode {
        Objects.requireNonNull(name, "name");
    }
}
