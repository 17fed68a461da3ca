package io.buildeval.standalone.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.util.ContextInitializer;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.joran.spi.JoranException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("LogbackConfigurator")
class LogbackConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private final Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

    @AfterEach
    void restoreTestConfiguration() throws JoranException {
        context.reset();
        new ContextInitializer(context).autoConfig();
    }

    @SuppressWarnings("unchecked")
    private ConsoleAppender<ILoggingEvent> stderrAppender() {
        Appender<ILoggingEvent> appender = root.getAppender(LogbackConfigurator.APPENDER_NAME);
        assertThat(appender).isInstanceOf(ConsoleAppender.class);
        return (ConsoleAppender<ILoggingEvent>) appender;
    }

    @Test
    @DisplayName("json format installs the JSON encoder on standard error")
    void jsonFormat() {
        LogbackConfigurator.configure("JSON", "debug");

        ConsoleAppender<ILoggingEvent> appender = stderrAppender();
        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
        assertThat(appender.getTarget()).isEqualTo("System.err");
        assertThat(appender.isStarted()).isTrue();
        assertThat(appender.getEncoder()).isInstanceOf(JsonEncoder.class);
    }

    @Test
    @DisplayName("text format uses the human-readable pattern")
    void textFormat() {
        LogbackConfigurator.configure("text", "INFO");

        assertThat(root.getLevel()).isEqualTo(Level.INFO);
        assertThat(stderrAppender().getEncoder())
                .isInstanceOfSatisfying(PatternLayoutEncoder.class, encoder ->
                        assertThat(encoder.getPattern()).isEqualTo(LogbackConfigurator.TEXT_PATTERN));
    }

    @Test
    @DisplayName("previous appenders are replaced and an unknown level falls back to WARN")
    void replacesAppenders() {
        LogbackConfigurator.configure("text", "INFO");
        LogbackConfigurator.configure("text", "loud");

        assertThat(root.getLevel()).isEqualTo(Level.WARN);
        assertThat(root.getAppender("STDOUT")).isNull();
        List<String> names = new ArrayList<>();
        root.iteratorForAppenders().forEachRemaining(a -> names.add(a.getName()));
        assertThat(names).containsExactly(LogbackConfigurator.APPENDER_NAME);
    }

    @Test
    @DisplayName("schema validator debug output stays hidden at a debug root level")
    void schemaValidatorQuiet() {
        LogbackConfigurator.configure("text", "DEBUG");

        Logger validator = context.getLogger(LogbackConfigurator.SCHEMA_VALIDATOR_LOGGER);
        assertThat(validator.getLevel()).isEqualTo(Level.WARN);
        assertThat(validator.isDebugEnabled()).isFalse();
        assertThat(context.getLogger("io.buildeval.core").isDebugEnabled()).isTrue();
    }
}
