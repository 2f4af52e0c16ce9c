package org.gentlyos.compiler.frontend.types;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.CodieLiteral;
import org.gentlyos.compiler.frontend.ast.CodieType;
import org.gentlyos.compiler.frontend.ast.IdentifierNode;
import org.gentlyos.compiler.frontend.ast.ListNode;
import org.gentlyos.compiler.frontend.ast.LiteralNode;
import org.gentlyos.compiler.frontend.ast.ObjectNode;
import org.gentlyos.compiler.model.MoveTypes;

import java.util.Locale;

/**
 * Maps declared CODIE types to Move types and infers Move types from untyped expressions.
 */
public final class MoveTypeMapper {

    private MoveTypeMapper() {
    }

    /**
     * Maps a declared CODIE type to a Move type.
     * <p>
     * Move has no native map, so maps become byte vectors. Custom names are matched
     * case-insensitively against a few well-known aliases and passed through otherwise.
     *
     * @param type The declared type.
     * @return The Move type name.
     */
    public static String mapDeclaredType(CodieType type) {
        if (type instanceof CodieType.Primitive primitive) {
            return switch (primitive) {
                case NUMBER -> MoveTypes.U64;
                case BOOL -> MoveTypes.BOOL;
                case TEXT, UUID, HASH, ANY -> MoveTypes.BYTES;
            };
        }
        if (type instanceof CodieType.ListOf list) {
            return MoveTypes.vectorOf(mapDeclaredType(list.element()));
        }
        if (type instanceof CodieType.MapOf) {
            return MoveTypes.BYTES;
        }
        String name = ((CodieType.Custom) type).name();
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "address", "addr", "who" -> MoveTypes.ADDRESS;
            case "id", "uid", "object" -> MoveTypes.OBJECT_ID;
            case "coin", "token", "money" -> MoveTypes.COIN;
            case "bytes", "data", "raw" -> MoveTypes.BYTES;
            default -> name;
        };
    }

    /**
     * Infers a Move type for an untyped expression. Literals map by kind, identifiers by
     * naming convention; everything else defaults to {@code u64}.
     *
     * @param expression The expression.
     * @return The inferred Move type name.
     */
    public static String inferType(AstNode expression) {
        if (expression instanceof LiteralNode literal) {
            CodieLiteral value = literal.literal();
            if (value instanceof CodieLiteral.NumberValue) {
                return MoveTypes.U64;
            }
            if (value instanceof CodieLiteral.BoolValue) {
                return MoveTypes.BOOL;
            }
            return MoveTypes.BYTES;
        }
        if (expression instanceof ObjectNode || expression instanceof ListNode) {
            return MoveTypes.BYTES;
        }
        if (expression instanceof IdentifierNode identifier) {
            return inferFromName(identifier.name());
        }
        return MoveTypes.U64;
    }

    /**
     * Guesses a Move type from an identifier name. The first matching rule wins:
     * {@code addr}/{@code sender}/{@code recipient} give {@code address}, {@code id} gives
     * {@code ID}, {@code amount}/{@code count}/{@code value} give {@code u64} and
     * {@code flag}/{@code is_}/{@code has_} give {@code bool}. Unmatched names are {@code u64}.
     *
     * @param name The identifier as written.
     * @return The inferred Move type name.
     */
    public static String inferFromName(String name) {
        if (name.contains("addr") || name.contains("sender") || name.contains("recipient")) {
            return MoveTypes.ADDRESS;
        }
        if (name.contains("id")) {
            return MoveTypes.OBJECT_ID;
        }
        if (name.contains("amount") || name.contains("count") || name.contains("value")) {
            return MoveTypes.U64;
        }
        if (name.contains("flag") || name.contains("is_") || name.contains("has_")) {
            return MoveTypes.BOOL;
        }
        return MoveTypes.U64;
    }
}
