package org.gentlyos.compiler.frontend.ast;

import java.util.Objects;

/**
 * Checkpoint ({@code anchor #hash}).
 */
public record CheckpointNode(String hash) implements AstNode {

    public CheckpointNode {
        Objects.requireNonNull(hash, "hash");
    }
}
