package org.gentlyos.compiler.frontend.ast;

import java.util.Objects;

/**
 * Literal value.
 */
public record LiteralNode(CodieLiteral literal) implements AstNode {

    public LiteralNode {
        Objects.requireNonNull(literal, "literal");
    }

    public static LiteralNode ofString(String value) {
        return new LiteralNode(new CodieLiteral.StringValue(value));
    }

    public static LiteralNode ofNumber(double value) {
        return new LiteralNode(new CodieLiteral.NumberValue(value));
    }

    public static LiteralNode ofBool(boolean value) {
        return new LiteralNode(new CodieLiteral.BoolValue(value));
    }

    public static LiteralNode ofNull() {
        return new LiteralNode(new CodieLiteral.NullValue());
    }
}
