package org.gentlyos.compiler.config;

import com.typesafe.config.Config;

import java.util.List;
import java.util.Objects;

/**
 * Immutable settings for the CODIE to Move transpiler, read from the {@code codie-move}
 * path of a Typesafe {@link Config}.
 *
 * @param contextParamName      Name of the implicit transaction context parameter.
 * @param contextParamType      Type of the implicit transaction context parameter.
 * @param baseImports           Imports emitted into every module, in order.
 * @param eventImport           Import emitted when the module defines event-like structs.
 * @param eventNamePrefix       Prefix of generated checkpoint event type names.
 * @param eventHashPrefixLength Number of hash characters appended to the event name prefix.
 * @param negatedConstraints    Treatment of {@code NOT:} constraint rules.
 */
public record TranspilerOptions(
        String contextParamName,
        String contextParamType,
        List<String> baseImports,
        String eventImport,
        String eventNamePrefix,
        int eventHashPrefixLength,
        NegatedConstraintPolicy negatedConstraints
) {

    /** Configuration path holding the transpiler settings. */
    public static final String CONFIG_PATH = "codie-move";

    public TranspilerOptions {
        Objects.requireNonNull(contextParamName, "contextParamName");
        Objects.requireNonNull(contextParamType, "contextParamType");
        baseImports = List.copyOf(baseImports);
        Objects.requireNonNull(eventImport, "eventImport");
        Objects.requireNonNull(eventNamePrefix, "eventNamePrefix");
        if (eventHashPrefixLength <= 0) {
            throw new IllegalArgumentException(
                    "event-hash-prefix-length must be positive, was " + eventHashPrefixLength);
        }
        Objects.requireNonNull(negatedConstraints, "negatedConstraints");
    }

    /**
     * Reads the options from the {@code codie-move} path of a resolved configuration.
     *
     * @param root The resolved root configuration.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a setting is missing or has the wrong type.
     */
    public static TranspilerOptions fromConfig(Config root) {
        Config config = root.getConfig(CONFIG_PATH);
        return new TranspilerOptions(
                config.getString("context-param.name"),
                config.getString("context-param.type"),
                config.getStringList("base-imports"),
                config.getString("event-import"),
                config.getString("event-name-prefix"),
                config.getInt("event-hash-prefix-length"),
                config.getEnum(NegatedConstraintPolicy.class, "negated-constraints"));
    }

    /**
     * Returns the options from the classpath defaults, with system property overrides applied.
     */
    public static TranspilerOptions defaults() {
        return fromConfig(ConfigLoader.loadDefaults());
    }
}
