package org.gentlyos.compiler.frontend.ast;

/**
 * Kinds of external sources a CODIE program can read from.
 */
public enum SourceKind {
    /** {@code @database/...} */
    DATABASE,
    /** {@code @api/...} */
    API,
    /** {@code @storage/...} */
    STORAGE,
    /** {@code $vault/...}, requires privileged access. */
    VAULT,
    /** {@code @foam/...} */
    FOAM,
    /** {@code @btc/...} */
    BTC,
    /** {@code @llm/...} */
    LLM,
    /** {@code @network/...} */
    NETWORK,
    /** Anything else. */
    CUSTOM;

    /**
     * Classifies a source path. A {@code $} sigil always denotes the vault; otherwise the first
     * path segment after an optional {@code @} selects the kind.
     *
     * @param path The source path as written.
     * @return The source kind.
     */
    public static SourceKind fromPath(String path) {
        if (path.startsWith("$")) {
            return VAULT;
        }
        String stripped = path.startsWith("@") ? path.substring(1) : path;
        int slash = stripped.indexOf('/');
        String first = slash < 0 ? stripped : stripped.substring(0, slash);
        return switch (first) {
            case "database", "db" -> DATABASE;
            case "api" -> API;
            case "storage" -> STORAGE;
            case "vault" -> VAULT;
            case "foam" -> FOAM;
            case "btc", "bitcoin" -> BTC;
            case "llm" -> LLM;
            case "network" -> NETWORK;
            default -> CUSTOM;
        };
    }

    /**
     * Returns whether reading this source needs an explicit access grant.
     */
    public boolean requiresPrivilegedAccess() {
        return this == VAULT;
    }

    /**
     * Returns whether this source holds remote or stateful data that the module depends on.
     */
    public boolean isModuleDependency() {
        return this == API || this == DATABASE || this == FOAM;
    }

    /**
     * Returns whether values read from this source are borrowed mutably.
     */
    public boolean isMutableStorage() {
        return this == DATABASE || this == STORAGE;
    }
}
