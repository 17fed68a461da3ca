package io.buildeval.core.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.buildeval.core.construction.ElementLocation;
import io.buildeval.core.spi.EvaluationListener;
import io.buildeval.core.spi.EvaluationListener.MessageEvent;
import io.buildeval.core.spi.EvaluationListener.WarningEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.LoggerFactory;

@DisplayName("ListenerNotifier")
class ListenerNotifierTest {

    private static final ElementLocation LOCATION = new ElementLocation("/work/app.proj", 4, 3);

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(ListenerNotifier.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        appender.stop();
    }

    @Test
    @DisplayName("warnings are logged and delivered")
    void warning() {
        var listener = mock(EvaluationListener.class);

        new ListenerNotifier(listener).warning("MSB4011", "imported twice", LOCATION);

        var captor = ArgumentCaptor.forClass(WarningEvent.class);
        verify(listener).onWarning(captor.capture());
        assertThat(captor.getValue().code()).isEqualTo("MSB4011");
        assertThat(captor.getValue().location()).isEqualTo(LOCATION);
        assertThat(appender.list).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage()).contains("MSB4011").contains("imported twice");
        });
    }

    @Test
    @DisplayName("messages are delivered")
    void message() {
        var listener = mock(EvaluationListener.class);

        new ListenerNotifier(listener).message("global wins");

        verify(listener).onMessage(new MessageEvent("global wins"));
    }

    @Test
    @DisplayName("a throwing listener is logged with its stack trace and does not propagate")
    void throwingListener() {
        var listener = mock(EvaluationListener.class);
        doThrow(new IllegalStateException("listener bug")).when(listener).onMessage(any());

        assertThatCode(() -> new ListenerNotifier(listener).message("hello")).doesNotThrowAnyException();

        assertThat(appender.list).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage()).isEqualTo("Listener.onMessage failed");
            assertThat(event.getThrowableProxy().getMessage()).isEqualTo("listener bug");
        });
    }

    @Test
    @DisplayName("the no-op listener is never called")
    void noOpListener() {
        assertThatCode(() -> new ListenerNotifier(null).message("ignored")).doesNotThrowAnyException();
        assertThat(appender.list).isEmpty();
    }
}
