package org.gentlyos.compiler.frontend.types;

import org.gentlyos.compiler.config.NegatedConstraintPolicy;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Turns CODIE rule text into struct names and Move assert conditions.
 */
public final class ConstraintTransforms {

    /** Name used when a rule yields no usable words. */
    public static final String DEFAULT_STRUCT_NAME = "Resource";

    private static final List<String> NEGATION_MARKERS = List.of("NOT:", "not:", "NOT ");
    private static final List<String> COMPARISON_OPERATORS = List.of(">", "<", "==", "!=");

    private ConstraintTransforms() {
    }

    /**
     * Strips a leading negation marker ({@code NOT:}, {@code not:} or {@code NOT }).
     *
     * @param rule The rule text.
     * @return The trimmed remainder if the rule was negated, otherwise empty.
     */
    public static Optional<String> stripNegation(String rule) {
        for (String marker : NEGATION_MARKERS) {
            if (rule.startsWith(marker)) {
                return Optional.of(rule.substring(marker.length()).trim());
            }
        }
        return Optional.empty();
    }

    /**
     * Derives a struct name from a rule. A single capitalized word is used verbatim; otherwise
     * the first three words are joined with underscores.
     * <p>
     * {@code "AuthToken"} gives {@code AuthToken}, {@code "NOT: store passwords plain"} gives
     * {@code store_passwords_plain} and an empty rule gives {@value #DEFAULT_STRUCT_NAME}.
     *
     * @param rule The rule text.
     * @return The raw struct name, not yet case-converted.
     */
    public static String extractStructName(String rule) {
        String cleaned = stripNegation(rule).orElse(rule).trim();
        if (!cleaned.isEmpty() && Character.isUpperCase(cleaned.charAt(0)) && cleaned.indexOf(' ') < 0) {
            return cleaned;
        }
        String[] words = cleaned.isEmpty() ? new String[0] : cleaned.split("\\s+");
        if (words.length == 0) {
            return DEFAULT_STRUCT_NAME;
        }
        return String.join("_", Arrays.asList(words).subList(0, Math.min(3, words.length)));
    }

    /**
     * Converts a rule to an assert condition using the documenting policy for negated rules.
     *
     * @param rule The rule text.
     * @return The Move condition.
     * @see #constraintToCondition(String, NegatedConstraintPolicy)
     */
    public static String constraintToCondition(String rule) {
        return constraintToCondition(rule, NegatedConstraintPolicy.DOCUMENT);
    }

    /**
     * Converts a rule to an assert condition.
     * <ul>
     *   <li>A negated rule becomes {@code true} annotated with the rule under
     *       {@link NegatedConstraintPolicy#DOCUMENT}, or {@code !(rule)} under
     *       {@link NegatedConstraintPolicy#ENFORCE}.</li>
     *   <li>A rule containing a comparison operator is used verbatim.</li>
     *   <li>Any other rule becomes {@code true} annotated with the rule.</li>
     * </ul>
     *
     * @param rule   The rule text.
     * @param policy How negated rules are treated.
     * @return The Move condition.
     */
    public static String constraintToCondition(String rule, NegatedConstraintPolicy policy) {
        Optional<String> negated = stripNegation(rule);
        if (negated.isPresent()) {
            if (policy == NegatedConstraintPolicy.ENFORCE) {
                return "!(" + negated.get() + ")";
            }
            return "true /* NOT: " + negated.get() + " */";
        }
        if (COMPARISON_OPERATORS.stream().anyMatch(rule::contains)) {
            return rule;
        }
        return "true /* constraint: " + rule + " */";
    }
}
