package org.gentlyos.compiler.frontend.ast;

/**
 * Source comment preserved by the parser.
 */
public record CommentNode(String text) implements AstNode {
}
