package org.gentlyos.compiler.frontend.ast;

import java.util.List;

/**
 * Flexible block ({@code blob}).
 *
 * @param name Optional block name, may be null.
 * @param body The entries of the block.
 */
public record FlexibleNode(String name, List<AstNode> body) implements AstNode {

    public FlexibleNode {
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
