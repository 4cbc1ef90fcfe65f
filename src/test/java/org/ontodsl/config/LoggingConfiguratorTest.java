package org.ontodsl.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

public class LoggingConfiguratorTest {

    private static final String LOGGER_NAME = "org.ontodsl.config.test";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    @AfterEach
    void restore() {
        context.getLogger(LOGGER_NAME).setLevel(null);
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.WARN);
    }

    @Test
    @Tag("unit")
    void testLevelsAreApplied() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging { default-level = \"ERROR\", levels { \"" + LOGGER_NAME + "\" = \"DEBUG\" } }"));

        assertThat(context.getLogger(LOGGER_NAME).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    @Tag("unit")
    void testMissingSectionChangesNothing() {
        Level before = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();

        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(before);
    }
}
