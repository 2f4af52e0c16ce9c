package org.gentlyos.compiler.frontend.types;

import org.gentlyos.compiler.frontend.ast.AstNode;
import org.gentlyos.compiler.frontend.ast.BinaryOpNode;
import org.gentlyos.compiler.frontend.ast.CallNode;
import org.gentlyos.compiler.frontend.ast.CodieLiteral;
import org.gentlyos.compiler.frontend.ast.FieldEntry;
import org.gentlyos.compiler.frontend.ast.IdentifierNode;
import org.gentlyos.compiler.frontend.ast.ListNode;
import org.gentlyos.compiler.frontend.ast.LiteralNode;
import org.gentlyos.compiler.frontend.ast.ObjectNode;
import org.gentlyos.compiler.frontend.ast.PropertyNode;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts CODIE expressions to Move expression text.
 */
public final class ExpressionConverter {

    /** Placeholder for expression kinds that have no Move form. */
    public static final String UNSUPPORTED_EXPRESSION = "/* <expr> */";

    private static final String U64_MAX = "18446744073709551615";
    private static final double TWO_POW_64 = 18446744073709551616.0;

    private ExpressionConverter() {
    }

    /**
     * Converts an expression to Move source text.
     *
     * @param expression The expression.
     * @return The Move expression.
     */
    public static String toMoveExpression(AstNode expression) {
        if (expression instanceof LiteralNode literal) {
            return formatLiteral(literal.literal());
        }
        if (expression instanceof IdentifierNode identifier) {
            return NameConventions.toSnakeCase(identifier.name());
        }
        if (expression instanceof CallNode call) {
            return call.function() + "(" + joinArguments(call.args()) + ")";
        }
        if (expression instanceof BinaryOpNode op) {
            return "(" + toMoveExpression(op.left()) + " " + op.op() + " " + toMoveExpression(op.right()) + ")";
        }
        if (expression instanceof PropertyNode property) {
            return toMoveExpression(property.object()) + "." + property.property();
        }
        if (expression instanceof ObjectNode object) {
            if (object.fields().isEmpty()) {
                return "{}";
            }
            return object.fields().stream()
                    .map(ExpressionConverter::formatField)
                    .collect(Collectors.joining(", ", "{ ", " }"));
        }
        if (expression instanceof ListNode list) {
            return "vector[" + joinArguments(list.items()) + "]";
        }
        return UNSUPPORTED_EXPRESSION;
    }

    /**
     * Converts expressions and joins them with {@code ", "}, as in an argument list.
     *
     * @param expressions The expressions.
     * @return The joined Move expressions.
     */
    public static String joinArguments(List<AstNode> expressions) {
        return expressions.stream()
                .map(ExpressionConverter::toMoveExpression)
                .collect(Collectors.joining(", "));
    }

    /**
     * Formats a literal as a Move value. Numbers become unsigned 64-bit integers,
     * strings become byte-string literals and null becomes an empty byte vector.
     *
     * @param literal The literal.
     * @return The Move value.
     */
    public static String formatLiteral(CodieLiteral literal) {
        if (literal instanceof CodieLiteral.NumberValue number) {
            return toU64(number.value());
        }
        if (literal instanceof CodieLiteral.BoolValue bool) {
            return Boolean.toString(bool.value());
        }
        if (literal instanceof CodieLiteral.StringValue string) {
            return "b\"" + string.value() + "\"";
        }
        return "vector::empty<u8>()";
    }

    private static String formatField(FieldEntry field) {
        return field.key() + ": " + toMoveExpression(field.value());
    }

    /**
     * Truncates toward zero and saturates to the u64 range. NaN and negatives become 0.
     */
    static String toU64(double value) {
        if (Double.isNaN(value) || value <= 0) {
            return "0";
        }
        if (value >= TWO_POW_64) {
            return U64_MAX;
        }
        if (value < Long.MAX_VALUE) {
            return Long.toString((long) value);
        }
        return new BigDecimal(value).toBigInteger().toString();
    }
}
