package org.gentlyos.compiler.frontend.ast;

/**
 * Loop break.
 */
public record BreakNode() implements AstNode {
}
