package org.gentlyos.compiler.frontend.ast;

import java.util.Objects;

/**
 * Read from an external source ({@code bark target <- source}).
 *
 * @param target     The local name receiving the value.
 * @param source     The source path as written, including its {@code @} or {@code $} sigil.
 * @param sourceKind The kind of source the path denotes.
 */
public record FetchNode(String target, String source, SourceKind sourceKind) implements AstNode {

    public FetchNode {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sourceKind, "sourceKind");
    }

    /**
     * Creates a fetch whose source kind is derived from the path.
     */
    public static FetchNode of(String target, String source) {
        return new FetchNode(target, source, SourceKind.fromPath(source));
    }

    @Override
    public boolean requiresPrivilegedAccess() {
        return sourceKind.requiresPrivilegedAccess();
    }
}
