package org.gentlyos.compiler.frontend.ast;

import java.util.List;

/**
 * Counted loop ({@code spin N TIMES}).
 *
 * @param count The iteration count as an unsigned 64-bit value; read it with
 *              {@link Long#toUnsignedString(long)}.
 * @param body  The loop body.
 */
public record TimesLoopNode(long count, List<AstNode> body) implements AstNode {

    public TimesLoopNode {
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
