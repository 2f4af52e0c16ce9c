package org.gentlyos.compiler.frontend.ast;

import java.util.List;
import java.util.Objects;

/**
 * Module definition ({@code pug NAME}).
 *
 * @param name The program name, used as the Move module name.
 * @param hash Optional content hash of the program, may be null.
 * @param body The top-level constructs of the program.
 */
public record ProgramNode(String name, String hash, List<AstNode> body) implements AstNode {

    public ProgramNode {
        Objects.requireNonNull(name, "name");
        body = List.copyOf(body);
    }

    public ProgramNode(String name, List<AstNode> body) {
        this(name, null, body);
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
