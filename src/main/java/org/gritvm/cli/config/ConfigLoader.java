package org.gritvm.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigOriginFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Builds the application configuration. Sources, highest precedence first:
 * <ol>
 *   <li>environment variables</li>
 *   <li>Java system properties ({@code -Dgritvm.runtime.max-steps=...})</li>
 *   <li>a configuration file, either given explicitly or {@value #CONFIG_FILE_NAME} in the working directory</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * The configuration file picked up from the working directory when no file is given.
     */
    public static final String CONFIG_FILE_NAME = "gritvm.conf";

    private ConfigLoader() {
    }

    /**
     * Loads the configuration with {@value #CONFIG_FILE_NAME} from the working directory, if there is one.
     *
     * @return the resolved configuration.
     */
    public static Config load() {
        File implicitFile = new File(CONFIG_FILE_NAME);
        if (!implicitFile.isFile()) {
            LOG.debug("No {} in the working directory, using defaults.", CONFIG_FILE_NAME);
            return merge(ConfigFactory.empty());
        }
        return merge(parse(implicitFile));
    }

    /**
     * Loads the configuration from a file the user asked for.
     *
     * @param configFile The configuration file. Must exist.
     * @return the resolved configuration.
     * @throws ConfigException.IO if the file does not exist or is a directory.
     */
    public static Config load(final File configFile) {
        if (!configFile.isFile()) {
            throw new ConfigException.IO(ConfigOriginFactory.newFile(configFile.getPath()),
                "Configuration file not found: " + configFile.getAbsolutePath());
        }
        return merge(parse(configFile));
    }

    private static Config parse(final File configFile) {
        LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
        return ConfigFactory.parseFile(configFile);
    }

    private static Config merge(final Config fileConfig) {
        return ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }
}
