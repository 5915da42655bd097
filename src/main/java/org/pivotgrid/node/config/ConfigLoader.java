package org.pivotgrid.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration. Sources, highest precedence first:
 * <ol>
 *   <li>environment variables</li>
 *   <li>system properties ({@code -Dkey=value})</li>
 *   <li>the configuration file, {@code pivotgrid.conf} in the working directory by default</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Name of the configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "pivotgrid.conf";

    private ConfigLoader() {
        // utility class
    }

    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * @param configFile the configuration file; skipped if it does not exist
     * @return the merged and resolved configuration
     */
    public static Config load(final File configFile) {
        // environment variables also feed ${?VAR} substitutions such as PIVOTGRID_PORT
        final Config environment = ConfigFactory.systemEnvironment();
        final Config properties = ConfigFactory.systemProperties();

        final Config file;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from {}", configFile.getAbsolutePath());
            file = ConfigFactory.parseFile(configFile);
        } else {
            LOG.info("No configuration file at '{}', using defaults", configFile.getPath());
            file = ConfigFactory.empty();
        }

        return environment
            .withFallback(properties)
            .withFallback(file)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }
}
