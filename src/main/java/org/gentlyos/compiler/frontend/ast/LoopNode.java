package org.gentlyos.compiler.frontend.ast;

import java.util.List;
import java.util.Objects;

/**
 * Bounded iteration over a collection ({@code spin item IN collection}).
 */
public record LoopNode(String iterator, AstNode collection, List<AstNode> body) implements AstNode {

    public LoopNode {
        Objects.requireNonNull(iterator, "iterator");
        Objects.requireNonNull(collection, "collection");
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
