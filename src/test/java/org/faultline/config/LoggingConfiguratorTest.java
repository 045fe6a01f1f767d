package org.faultline.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.faultline.junit.extensions.logging.ExpectLog;
import org.faultline.junit.extensions.logging.LogLevel;
import org.faultline.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("faultline.test.alpha").setLevel(null);
        context.getLogger("faultline.test.beta").setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void configure_shouldApplyDefaultAndSpecificLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "faultline.test.alpha" = "DEBUG"
                "faultline.test.beta" = "TRACE"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger("faultline.test.alpha").getLevel());
        assertEquals(Level.TRACE, context.getLogger("faultline.test.beta").getLevel());
    }

    @Test
    void configure_shouldOnlyTakeEffectOnce() {
        // Given
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"faultline.test.alpha\" = \"INFO\" }"));

        // When
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"faultline.test.alpha\" = \"ERROR\" }"));

        // Then
        assertEquals(Level.INFO, context.getLogger("faultline.test.alpha").getLevel());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*LoggingConfigurator", messagePattern = "Ignoring unknown level 'LOUD'.*")
    void configure_shouldSkipUnknownLevels() {
        // Given
        final Config config = ConfigFactory.parseString(
                "logging.levels { \"faultline.test.alpha\" = \"LOUD\", \"faultline.test.beta\" = \"WARN\" }");

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertNull(context.getLogger("faultline.test.alpha").getLevel());
        assertEquals(Level.WARN, context.getLogger("faultline.test.beta").getLevel());
    }

    @Test
    void configure_withoutLoggingBlock_shouldLeaveLevelsUntouched() {
        // When
        LoggingConfigurator.configure(ConfigFactory.empty());

        // Then
        assertEquals(originalRootLevel, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
