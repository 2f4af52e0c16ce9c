package org.gentlyos.compiler.frontend.ast;

import java.util.List;

/**
 * List literal ({@code [item, ...]}).
 */
public record ListNode(List<AstNode> items) implements AstNode {

    public ListNode {
        items = List.copyOf(items);
    }
}
