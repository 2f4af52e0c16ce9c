package org.gentlyos.compiler.model;

/**
 * Move struct abilities. Together they decide whether a value is linear or may be
 * copied and dropped.
 */
public enum MoveAbility {
    /** Stored on-chain under a unique identity. */
    KEY("key"),
    /** Can be stored inside other structs. */
    STORE("store"),
    /** Can be copied. Never granted to resources. */
    COPY("copy"),
    /** Can be implicitly destroyed. Never granted to resources. */
    DROP("drop");

    private final String keyword;

    MoveAbility(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the Move source keyword for this ability.
     */
    public String keyword() {
        return keyword;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
