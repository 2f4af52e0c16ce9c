package org.gentlyos.compiler.frontend.ast;

import java.util.Objects;

/**
 * Property access ({@code obj.prop}).
 */
public record PropertyNode(AstNode object, String property) implements AstNode {

    public PropertyNode {
        Objects.requireNonNull(object, "object");
        Objects.requireNonNull(property, "property");
    }
}
