package org.calcmark.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** The configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "calcmark.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. System Properties (e.g., -Dcalculator.result-variable=result)
     * 3. Configuration File (the explicit file, else calcmark.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitConfigFile A file named on the command line, or {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if a configuration source cannot be parsed,
     *         or if the explicit file does not exist.
     */
    public static Config load(final File explicitConfigFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config cliConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (explicitConfigFile != null) {
            LOG.info("Using configuration file specified via --config: {}", explicitConfigFile.getAbsolutePath());
            // Unlike the working-directory file, an explicit file must exist.
            fileConfig = ConfigFactory.parseFile(explicitConfigFile, ConfigParseOptions.defaults().setAllowMissing(false));
        } else {
            final File configFile = new File(CONFIG_FILE_NAME);
            if (configFile.exists() && !configFile.isDirectory()) {
                LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(configFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Using defaults.", configFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // Chain the configs together. The one provided first wins.
        return envConfig
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
