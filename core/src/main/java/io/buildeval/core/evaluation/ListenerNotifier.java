package io.buildeval.core.evaluation;

import io.buildeval.core.construction.ElementLocation;
import io.buildeval.core.spi.EvaluationListener;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers events to an {@link EvaluationListener}; a failing listener never
 * fails the evaluation.
 */
final class ListenerNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(ListenerNotifier.class);

    private final EvaluationListener listener;

    ListenerNotifier(EvaluationListener listener) {
        this.listener = listener != null ? listener : EvaluationListener.NONE;
    }

    void notify(String method, Consumer<EvaluationListener> call) {
        if (listener == EvaluationListener.NONE) {
            return;
        }
        try {
            call.accept(listener);
        } catch (RuntimeException e) {
            LOG.warn("Listener.{} failed", method, e);
        }
    }

    void warning(String code, String message, ElementLocation location) {
        if (code == null) {
            LOG.warn("{} at={}", message, location);
        } else {
            LOG.warn("{}: {} at={}", code, message, location);
        }
        notify("onWarning", l -> l.onWarning(new EvaluationListener.WarningEvent(code, message, location)));
    }

    void message(String text) {
        LOG.debug(text);
        notify("onMessage", l -> l.onMessage(new EvaluationListener.MessageEvent(text)));
    }
}
