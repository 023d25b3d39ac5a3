package org.pascalvm.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Loads the HOCON configuration of the code generator.
 * <p>
 * Sources are layered with the following precedence (highest to lowest):
 * <ol>
 *   <li>Java system properties ({@code -Dpascalvm.codegen.trace-instructions=true})</li>
 *   <li>Environment variables</li>
 *   <li>An optional user configuration file</li>
 *   <li>Default reference configuration ({@code reference.conf} on the classpath)</li>
 * </ol>
 * Substitutions are resolved only after all layers are composed, so user overrides
 * propagate to values that reference them.
 */
public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a file, merged with classpath defaults.
     *
     * @param configFile the configuration file to load.
     * @return the fully resolved {@link Config}.
     * @throws IllegalArgumentException if the file does not exist.
     * @throws com.typesafe.config.ConfigException if the file cannot be parsed or resolved.
     */
    public static Config loadFromFile(final File configFile) {
        if (!configFile.exists()) {
            throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
        }
        return layered(ConfigFactory.parseFile(configFile));
    }

    /**
     * Loads configuration from classpath defaults only (no user config file).
     *
     * @return the fully resolved {@link Config}.
     */
    public static Config loadDefaults() {
        return layered(ConfigFactory.empty());
    }

    private static Config layered(final Config userLayer) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(userLayer)
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
