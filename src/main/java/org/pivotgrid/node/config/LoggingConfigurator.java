package org.pivotgrid.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback at runtime.
 *
 * <pre>
 * logging {
 *   format = "JSON"           # PLAIN or JSON, PLAIN if absent
 *   default-level = "INFO"
 *   levels {
 *     "org.pivotgrid.pivot.compiler" = "DEBUG"
 *   }
 * }
 * </pre>
 *
 * The format is published as the {@code pivotgrid.logging.format} property, which
 * {@code logback.xml} uses to pick its appender.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    /** Property naming the Logback appender in use. */
    public static final String FORMAT_PROPERTY = "pivotgrid.logging.format";

    private static volatile boolean configured = false;

    private LoggingConfigurator() {
        // utility class
    }

    /**
     * Applies the logging settings once; later calls are ignored until {@link #reset()}.
     */
    public static synchronized void configure(final Config config) {
        if (configured) {
            return;
        }
        configured = true;
        if (!config.hasPath("logging")) {
            LOGGER.debug("No logging block, keeping Logback defaults.");
            return;
        }

        final Config logging = config.getConfig("logging");
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (logging.hasPath("format")) {
            final String appender = "JSON".equalsIgnoreCase(logging.getString("format")) ? "STDOUT" : "STDOUT_PLAIN";
            if (!appender.equals(System.getProperty(FORMAT_PROPERTY, "STDOUT_PLAIN"))) {
                System.setProperty(FORMAT_PROPERTY, appender);
                reloadLogback(context);
            }
            context.putProperty(FORMAT_PROPERTY, appender);
        }

        if (logging.hasPath("default-level")) {
            final Level level = Level.toLevel(logging.getString("default-level"), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }

        if (logging.hasPath("levels")) {
            for (final Map.Entry<String, ConfigValue> entry : logging.getObject("levels").entrySet()) {
                final String levelName = String.valueOf(entry.getValue().unwrapped());
                final Level level = Level.toLevel(levelName, null);
                if (level == null) {
                    LOGGER.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, entry.getKey());
                    continue;
                }
                context.getLogger(entry.getKey()).setLevel(level);
            }
        }
        LOGGER.debug("Logging configuration applied.");
    }

    private static void reloadLogback(final LoggerContext context) {
        final URL logbackXml = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (logbackXml == null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(logbackXml);
        } catch (final JoranException e) {
            LOGGER.warn("Failed to reload {}: {}", logbackXml, e.getMessage());
        }
    }

    /**
     * Allows {@link #configure(Config)} to run again. Intended for tests.
     */
    public static synchronized void reset() {
        configured = false;
    }
}
