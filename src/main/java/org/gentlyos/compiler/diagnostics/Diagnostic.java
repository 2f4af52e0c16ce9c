package org.gentlyos.compiler.diagnostics;

import java.util.Objects;

/**
 * A problem found while transpiling. Diagnostics never abort a transpilation; they record
 * where the output was degraded.
 *
 * @param kind    What kind of degradation happened.
 * @param message Human-readable description.
 */
public record Diagnostic(Kind kind, String message) {

    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    /**
     * Categories of degraded input.
     */
    public enum Kind {
        /** A module-level variable binding had no struct to attach to and was dropped. */
        STRAY_BINDING,
        /** Constraints were still queued when the module ended and were discarded. */
        DISCARDED_CONSTRAINTS,
        /** A body node kind had no lowering and became a comment. */
        UNSUPPORTED_NODE
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
