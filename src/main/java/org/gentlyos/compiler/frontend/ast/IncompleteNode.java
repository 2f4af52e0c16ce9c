package org.gentlyos.compiler.frontend.ast;

/**
 * Incomplete marker ({@code turk} or {@code turk(#hash)}). Both components may be null.
 */
public record IncompleteNode(String hash, String comment) implements AstNode {

    public static IncompleteNode withComment(String comment) {
        return new IncompleteNode(null, comment);
    }
}
