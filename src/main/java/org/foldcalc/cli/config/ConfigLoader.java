package org.foldcalc.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Map;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Configuration file picked up from the working directory when no file is given. */
    public static final String CONFIG_FILE_NAME = "foldcalc.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. CLI overrides ({@code -Dkey=value} passed to the command)
     * 3. Java System Properties
     * 4. Configuration File (the given file, else foldcalc.conf in the working directory)
     * 5. Default values (from reference.conf on the classpath)
     *
     * @param configFile An explicit configuration file, or {@code null}.
     * @param overrides Key/value overrides from the command line, or {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if an explicitly given file does not exist.
     * @throws com.typesafe.config.ConfigException if a source cannot be parsed or resolved.
     */
    public static Config load(final File configFile, final Map<String, String> overrides) {
        final Config envConfig = ConfigFactory.systemEnvironment();

        final Config cliConfig = overrides != null && !overrides.isEmpty()
            ? ConfigFactory.parseMap(overrides, "command line overrides")
            : ConfigFactory.empty();

        final Config systemConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            final File cwdConfigFile = new File(CONFIG_FILE_NAME);
            if (cwdConfigFile.isFile()) {
                LOG.info("Loading configuration from file: {}", cwdConfigFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdConfigFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Using defaults.", CONFIG_FILE_NAME);
                fileConfig = ConfigFactory.empty();
            }
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
            .withFallback(cliConfig)
            .withFallback(systemConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
