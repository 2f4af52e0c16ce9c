package org.gentlyos.compiler.frontend.ast;

/**
 * Placeholder for an empty statement.
 */
public record EmptyNode() implements AstNode {
}
