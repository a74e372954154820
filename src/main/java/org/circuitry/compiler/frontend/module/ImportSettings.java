package org.circuitry.compiler.frontend.module;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Filesystem conventions used to locate imported packages, read from the
 * {@code circuitry.compiler.imports} block of the configuration.
 *
 * @param sourceDirectory        The directory under a package root that holds source files.
 * @param sourceExtension        The suffix of source files, stripped before matching package names.
 * @param importsDirectory       The directory under a package root that holds external packages.
 * @param searchImportsDirectory Whether packages are also looked up in {@code importsDirectory}.
 * @param scopeSeparator         The separator between program name and local name in qualified names.
 */
public record ImportSettings(
        String sourceDirectory,
        String sourceExtension,
        String importsDirectory,
        boolean searchImportsDirectory,
        String scopeSeparator
) {

    static final String CONFIG_PATH = "circuitry.compiler.imports";

    /**
     * Reads the settings from a config that contains the {@code circuitry.compiler.imports} block.
     * @param config The root configuration.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException If a setting is missing or has the wrong type.
     */
    public static ImportSettings fromConfig(Config config) {
        Config imports = config.getConfig(CONFIG_PATH);
        return new ImportSettings(
                imports.getString("source-directory"),
                imports.getString("source-extension"),
                imports.getString("imports-directory"),
                imports.getBoolean("search-imports-directory"),
                imports.getString("scope-separator"));
    }

    /**
     * Loads the settings from the default configuration ({@code application.conf},
     * system properties and {@code reference.conf}).
     * @return The settings.
     */
    public static ImportSettings defaults() {
        return fromConfig(ConfigFactory.load());
    }
}
