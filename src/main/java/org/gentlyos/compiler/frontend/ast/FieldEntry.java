package org.gentlyos.compiler.frontend.ast;

import java.util.Objects;

/**
 * A key/value pair inside a specification block or an object literal.
 */
public record FieldEntry(String key, AstNode value) {

    public FieldEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }
}
