package org.gentlyos.compiler.frontend.ast;

import java.util.Objects;

/**
 * Goal/output ({@code biz -> result}).
 *
 * @param expression The produced expression.
 * @param anchorHash Optional checkpoint hash attached to the goal, may be null.
 */
public record GoalNode(AstNode expression, String anchorHash) implements AstNode {

    public GoalNode {
        Objects.requireNonNull(expression, "expression");
    }

    public GoalNode(AstNode expression) {
        this(expression, null);
    }
}
