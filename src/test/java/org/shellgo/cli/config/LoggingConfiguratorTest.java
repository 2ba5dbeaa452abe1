package org.shellgo.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests applying the {@code logging} section to Logback.
 */
@Tag("unit")
public class LoggingConfiguratorTest {

    private static final String BUILD_LOGGER = "org.shellgo.compiler.backend.build";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void restoreLevels() {
        context.getLogger(BUILD_LOGGER).setLevel(null);
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.INFO);
    }

    @Test
    void appliesDefaultAndPerLoggerLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging { default-level = WARN, levels { \"" + BUILD_LOGGER + "\" = DEBUG } }"));

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
        assertThat(context.getLogger(BUILD_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void missingSectionLeavesLevelsAlone() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.INFO);
        assertThat(context.getLogger(BUILD_LOGGER).getLevel()).isNull();
    }
}
