package org.termconf.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration. Sources are merged with the following precedence:
 * <ol>
 *     <li>System properties ({@code -Dkey=value})</li>
 *     <li>Environment variables</li>
 *     <li>The configuration file, if one is given and exists</li>
 *     <li>Defaults from {@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** The configuration file looked up in the working directory when none is given. */
    public static final String CONFIG_FILE_NAME = "termconf.conf";

    private ConfigLoader() {}

    /**
     * Loads the configuration using {@value #CONFIG_FILE_NAME} from the working directory, if present.
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration.
     * @param configFile The configuration file; skipped if {@code null}, missing or a directory.
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException If the file cannot be parsed or the result cannot be resolved.
     */
    public static Config load(File configFile) {
        final Config fileConfig;
        if (configFile != null && configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found. Using defaults.", configFile == null ? "" : configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }
}
