package org.gentlyos.compiler.frontend.ast;

import java.util.List;

/**
 * Unconditional loop ({@code spin FOREVER}).
 */
public record ForeverLoopNode(List<AstNode> body) implements AstNode {

    public ForeverLoopNode {
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
