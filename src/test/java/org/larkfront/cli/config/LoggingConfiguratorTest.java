package org.larkfront.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private static final String PARSER_LOGGER = "org.larkfront.compiler.frontend.parser.Parser";

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.WARN);
        context.getLogger(PARSER_LOGGER).setLevel(null);
    }

    @Test
    void configure_withPlainFormat_shouldSelectPlainAppender() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "INFO"
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        assertEquals("STDOUT_PLAIN", context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));

        final ch.qos.logback.classic.Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        final Appender<?> plainAppender = rootLogger.getAppender("STDOUT_PLAIN");
        assertNotNull(plainAppender, "Root logger should use the STDOUT_PLAIN appender");
        assertTrue(plainAppender instanceof ConsoleAppender, "STDOUT_PLAIN appender should be ConsoleAppender");
        assertNull(rootLogger.getAppender("STDOUT"), "JSON appender should not be attached");
        assertEquals(Level.INFO, rootLogger.getLevel());
    }

    @Test
    void configure_withJsonFormat_shouldSelectJsonAppender() {
        final Config config = ConfigFactory.parseString("logging { format = \"JSON\" }");

        LoggingConfigurator.configure(config);

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        assertEquals("STDOUT", context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertNotNull(context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDOUT"));
    }

    @Test
    void configure_withoutFormat_shouldDefaultToPlainAppender() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = \"WARN\" }"));

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        assertEquals("STDOUT_PLAIN", context.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
    }

    @Test
    void configure_withSpecificLevels_shouldApplyThem() {
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "ERROR"
              levels {
                "org.larkfront.compiler.frontend.parser.Parser" = "DEBUG"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger(PARSER_LOGGER).getLevel());
    }

    @Test
    void configure_isIdempotent() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { format = \"PLAIN\", default-level = \"INFO\" }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { format = \"PLAIN\", default-level = \"ERROR\" }"));

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        assertEquals(Level.INFO, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_withoutLoggingSection_shouldKeepDefaults() {
        assertDoesNotThrow(() -> LoggingConfigurator.configure(ConfigFactory.parseString("cli { echo-input = false }")));
    }
}
