package org.larkfront.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} section of the larkfront configuration to Logback.
 *
 * <pre>
 * logging {
 *   format = "PLAIN"          # "PLAIN" or "JSON"; PLAIN when absent
 *   default-level = "WARN"    # root logger
 *   levels {
 *     "org.larkfront.compiler.frontend.parser.Parser" = "DEBUG"
 *   }
 * }
 * </pre>
 *
 * Only the first call of {@link #configure(Config)} has an effect until {@link #reset()} is called.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    /** Context and system property read by logback.xml to pick the root appender. */
    public static final String FORMAT_PROPERTY = "larkfront.logging.format";
    private static final String PLAIN_APPENDER = "STDOUT_PLAIN";
    private static final String JSON_APPENDER = "STDOUT";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {}

    /**
     * Selects the appender and sets the logger levels.
     * @param config The resolved application configuration.
     */
    public static void configure(final Config config) {
        if (loggingConfigured) {
            return;
        }
        loggingConfigured = true;

        if (!config.hasPath("logging")) {
            LOGGER.debug("No logging section, keeping logback.xml as loaded.");
            return;
        }

        final Config logging = config.getConfig("logging");
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try {
            // Reloading logback.xml resets all levels, so the appender is chosen first.
            selectAppender(logging, context);
        } catch (final Exception e) {
            LOGGER.error("Could not reload logback.xml, keeping the current appender.", e);
        }
        if (logging.hasPath("default-level")) {
            final Level level = Level.toLevel(logging.getString("default-level"), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
        if (logging.hasPath("levels")) {
            applyLoggerLevels(logging.getConfig("levels"), context);
        }
    }

    private static void selectAppender(final Config logging, final LoggerContext context) throws Exception {
        final String format = logging.hasPath("format") ? logging.getString("format") : "PLAIN";
        final String appender = "JSON".equalsIgnoreCase(format) ? JSON_APPENDER : PLAIN_APPENDER;

        System.setProperty(FORMAT_PROPERTY, appender);
        final URL logbackXml = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (logbackXml != null) {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(logbackXml);
        }
        context.putProperty(FORMAT_PROPERTY, appender);
        LOGGER.debug("Log appender: {}", appender);
    }

    private static void applyLoggerLevels(final Config levels, final LoggerContext context) {
        for (final Map.Entry<String, ConfigValue> entry : levels.root().entrySet()) {
            final String levelName = String.valueOf(entry.getValue().unwrapped());
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown level '{}' for logger '{}'", levelName, entry.getKey());
                continue;
            }
            context.getLogger(entry.getKey()).setLevel(level);
        }
    }

    /**
     * Allows the next {@link #configure(Config)} call to take effect again. Used by tests.
     */
    public static void reset() {
        loggingConfigured = false;
    }
}
