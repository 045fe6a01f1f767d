package org.faultline.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration from its sources, highest precedence first:
 * <ol>
 *     <li>Environment variables</li>
 *     <li>Java system properties ({@code -Dkey=value})</li>
 *     <li>{@code faultline.conf} in the working directory</li>
 *     <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "faultline.conf";

    private ConfigLoader() {}

    /**
     * Loads the configuration, reading {@code faultline.conf} from the working directory if present.
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration with an explicit configuration file.
     * @param configFile The file layered between system properties and defaults; skipped if missing.
     * @return The resolved configuration.
     */
    public static Config load(final File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config sysConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found. Using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
                .withFallback(sysConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }
}
