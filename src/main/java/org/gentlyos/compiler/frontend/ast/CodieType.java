package org.gentlyos.compiler.frontend.ast;

import java.util.Locale;
import java.util.Objects;

/**
 * A declared CODIE type annotation.
 */
public sealed interface CodieType {

    /**
     * The built-in scalar types.
     */
    enum Primitive implements CodieType {
        TEXT, NUMBER, BOOL, UUID, HASH, ANY
    }

    /**
     * Homogeneous list, {@code list(T)}.
     */
    record ListOf(CodieType element) implements CodieType {
        public ListOf {
            Objects.requireNonNull(element, "element");
        }
    }

    /**
     * Key/value map, {@code map(K, V)}.
     */
    record MapOf(CodieType key, CodieType value) implements CodieType {
        public MapOf {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * A user-defined or otherwise unrecognized type name, kept as written.
     */
    record Custom(String name) implements CodieType {
        public Custom {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Resolves a type name as written in CODIE source. Matching is case-insensitive;
     * unknown names become {@link Custom}.
     *
     * @param name The type name.
     * @return The matching type.
     */
    static CodieType fromName(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "text", "string" -> Primitive.TEXT;
            case "number", "int", "float" -> Primitive.NUMBER;
            case "bool", "boolean" -> Primitive.BOOL;
            case "uuid" -> Primitive.UUID;
            case "hash" -> Primitive.HASH;
            case "any" -> Primitive.ANY;
            default -> new Custom(name);
        };
    }
}
