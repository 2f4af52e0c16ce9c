package org.gentlyos.compiler.frontend.ast;

import java.util.List;
import java.util.Objects;

/**
 * Function call.
 */
public record CallNode(String function, List<AstNode> args) implements AstNode {

    public CallNode {
        Objects.requireNonNull(function, "function");
        args = List.copyOf(args);
    }
}
