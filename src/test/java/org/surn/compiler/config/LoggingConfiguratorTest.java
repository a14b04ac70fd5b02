package org.surn.compiler.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        originalRootLevel = context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() throws JoranException {
        System.clearProperty(LoggingConfigurator.FORMAT_PROPERTY);
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context());
        context().reset();
        configurator.doConfigure(getClass().getClassLoader().getResource("logback-test.xml"));
        context().getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        LoggingConfigurator.reset();
    }

    @Test
    void configure_withLevels_shouldApplyRootAndSpecificLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "ERROR"
              levels {
                "org.surn.compiler.frontend" = "DEBUG"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertThat(LoggingConfigurator.isConfigured()).isTrue();
        assertThat(context().getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT_PLAIN");
        assertThat(context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context().getLogger("org.surn.compiler.frontend").getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void configure_calledTwice_shouldOnlyApplyFirstConfiguration() {
        // Given
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = \"ERROR\" }"));

        // When
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = \"TRACE\" }"));

        // Then
        assertThat(context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void configure_withoutLoggingSection_shouldMarkConfigured() {
        // When
        LoggingConfigurator.configure(ConfigFactory.empty());

        // Then
        assertThat(LoggingConfigurator.isConfigured()).isTrue();
    }

    @Test
    void configure_withJsonFormat_shouldSwitchRootAppenderToJsonEncoder() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "JSON"
              default-level = "INFO"
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        final ch.qos.logback.classic.Logger root = context().getLogger(Logger.ROOT_LOGGER_NAME);
        assertThat(context().getProperty(LoggingConfigurator.FORMAT_PROPERTY)).isEqualTo("STDOUT");
        assertThat(root.getAppender("STDOUT_PLAIN")).isNull();
        assertThat(root.getAppender("STDOUT")).isInstanceOfSatisfying(ConsoleAppender.class,
            appender -> assertThat(appender.getEncoder()).isInstanceOf(JsonEncoder.class));
        assertThat(root.getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void configure_withPlainFormat_shouldUsePatternEncoder() {
        // Given
        final Config config = ConfigFactory.parseString("logging { format = \"PLAIN\" }");

        // When
        LoggingConfigurator.configure(config);

        // Then
        final ch.qos.logback.classic.Logger root = context().getLogger(Logger.ROOT_LOGGER_NAME);
        assertThat(root.getAppender("STDOUT")).isNull();
        assertThat(root.getAppender("STDOUT_PLAIN")).isInstanceOfSatisfying(ConsoleAppender.class,
            appender -> assertThat(appender.getEncoder()).isInstanceOf(PatternLayoutEncoder.class));
    }

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }
}
