package org.gentlyos.compiler.model;

import java.util.Objects;

/**
 * A struct field.
 *
 * @param name     The field name (snake_case).
 * @param typeName The Move type of the field.
 */
public record MoveField(String name, String typeName) {

    public MoveField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(typeName, "typeName");
    }
}
