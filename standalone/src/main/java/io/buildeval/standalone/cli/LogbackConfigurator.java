package io.buildeval.standalone.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import org.slf4j.LoggerFactory;

/**
 * Routes the evaluator's log output for one command-line run.
 *
 * <p>
 * Standard output is reserved for the evaluation document, so every log event
 * goes to standard error. {@code json} selects Logback's {@link JsonEncoder}
 * for machine consumers; any other format prints one line per event.
 */
public final class LogbackConfigurator {

    /** Line layout used when the format is not {@code json}. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    static final String APPENDER_NAME = "STDERR";

    /** Logger of the toolset schema validator, which traces every keyword. */
    static final String SCHEMA_VALIDATOR_LOGGER = "com.networknt.schema";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Installs a single standard-error appender on the root logger.
     *
     * @param format {@code json} or {@code text}; compared ignoring case
     * @param level root level name; WARN when it is not a Logback level
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);

        rootLogger.setLevel(Level.toLevel(level, Level.WARN));
        rootLogger.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder(format, context));
        appender.start();
        rootLogger.addAppender(appender);

        // schema validation only runs for toolset files; its debug output buries the evaluator's
        context.getLogger(SCHEMA_VALIDATOR_LOGGER).setLevel(Level.WARN);
    }

    private static Encoder<ILoggingEvent> encoder(String format, LoggerContext context) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}
