package org.gentlyos.compiler.frontend.ast;

import java.util.List;
import java.util.Objects;

/**
 * Bare reference to an external source ({@code @path} or {@code $path}).
 *
 * @param kind The kind of source.
 * @param path The path without its sigil.
 * @param args Call arguments attached to the reference.
 */
public record SourceNode(SourceKind kind, String path, List<AstNode> args) implements AstNode {

    public SourceNode {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(path, "path");
        args = List.copyOf(args);
    }

    @Override
    public boolean requiresPrivilegedAccess() {
        return kind.requiresPrivilegedAccess();
    }
}
