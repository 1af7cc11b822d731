package org.calcmark.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LoggingConfigurator}, applying levels to the live Logback context.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private LoggerContext context;
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("org.calcmark.test").setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void configure_shouldApplyDefaultAndSpecificLevels() {
        // Arrange
        Config config = ConfigFactory.parseString(
                "logging { default-level = \"ERROR\", levels { \"org.calcmark.test\" = \"DEBUG\" } }");

        // Act
        LoggingConfigurator.configure(config);

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger("org.calcmark.test").getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void configure_shouldBeIdempotent() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"ERROR\""));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"TRACE\""));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void configure_withoutLoggingBlockShouldKeepLevels() {
        Level before = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();

        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(before);
    }
}
