package org.gentlyos.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Loads the transpiler configuration.
 * <p>
 * Composes HOCON configuration from these sources, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dcodie-move.negated-constraints=ENFORCE})</li>
 *   <li>An explicit configuration file or inline HOCON text, when given</li>
 *   <li>Default reference configuration ({@code reference.conf} on the classpath)</li>
 * </ol>
 * <p>
 * Uses {@link ConfigFactory#defaultReferenceUnresolved()} so that substitutions are resolved
 * only after all layers are composed.
 */
public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads configuration from classpath defaults only.
     *
     * @return the fully resolved {@link Config}.
     */
    public static Config loadDefaults() {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * Loads configuration from a file, merged over the classpath defaults.
     *
     * @param configFile the configuration file to load.
     * @return the fully resolved {@link Config}.
     * @throws IllegalArgumentException            if the file does not exist.
     * @throws com.typesafe.config.ConfigException if the file cannot be parsed or resolved.
     */
    public static Config loadFromFile(File configFile) {
        if (!configFile.exists()) {
            throw new IllegalArgumentException(
                    "Configuration file not found: " + configFile.getAbsolutePath());
        }
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * Parses inline HOCON text and merges it over the classpath defaults. System properties
     * are not consulted, so the result depends on the text alone.
     *
     * @param hocon the configuration text.
     * @return the fully resolved {@link Config}.
     * @throws com.typesafe.config.ConfigException if the text cannot be parsed or resolved.
     */
    public static Config parse(String hocon) {
        return ConfigFactory.parseString(hocon)
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }
}
