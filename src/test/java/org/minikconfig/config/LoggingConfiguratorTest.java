package org.minikconfig.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
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

    private static final String SAMPLE_LOGGER = "org.minikconfig.sample";

    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        originalRootLevel = context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context().getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context().getLogger(SAMPLE_LOGGER).setLevel(null);
    }

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    @Test
    void configure_withPlainFormat_shouldSetPlainAppenderProperty() {
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
        assertEquals("STDOUT_PLAIN", context().getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertEquals("STDOUT_PLAIN", System.getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertEquals(Level.INFO, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_withSpecificLevels_shouldApplyThem() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "ERROR"
              levels {
                "org.minikconfig.sample" = "DEBUG"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.ERROR, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context().getLogger(SAMPLE_LOGGER).getLevel());
    }

    @Test
    void configure_calledTwice_shouldOnlyApplyFirstConfiguration() {
        // Given
        final Config first = ConfigFactory.parseString("logging { default-level = \"WARN\" }");
        final Config second = ConfigFactory.parseString("logging { default-level = \"TRACE\" }");

        // When
        LoggingConfigurator.configure(first);
        LoggingConfigurator.configure(second);

        // Then
        assertEquals(Level.WARN, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_withoutLoggingSection_shouldLeaveLevelsUntouched() {
        // Given
        final Level before = context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel();

        // When
        LoggingConfigurator.configure(ConfigFactory.parseString("minikconfig { strict = true }"));

        // Then
        assertEquals(before, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
