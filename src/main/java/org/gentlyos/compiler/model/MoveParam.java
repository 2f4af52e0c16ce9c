package org.gentlyos.compiler.model;

import java.util.Objects;

/**
 * A function parameter.
 *
 * @param name     The parameter name.
 * @param typeName The Move type.
 * @param isRef    Whether the parameter is passed by reference.
 * @param isMutRef Whether the parameter is passed by mutable reference.
 */
public record MoveParam(String name, String typeName, boolean isRef, boolean isMutRef) {

    public MoveParam {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(typeName, "typeName");
    }

    public static MoveParam byValue(String name, String typeName) {
        return new MoveParam(name, typeName, false, false);
    }

    public static MoveParam mutableRef(String name, String typeName) {
        return new MoveParam(name, typeName, true, true);
    }
}
