package org.gentlyos.compiler.config;

/**
 * How {@code NOT:} constraint rules are turned into assert conditions.
 */
public enum NegatedConstraintPolicy {
    /**
     * Emit an always-true condition and keep the prohibition only as an inline comment
     * next to it. Nothing is enforced at runtime.
     */
    DOCUMENT,
    /**
     * Emit a live negated check, e.g. {@code !(balance < 0)}.
     */
    ENFORCE
}
