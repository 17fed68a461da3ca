package io.buildeval.core.evaluation.condition;

import io.buildeval.core.construction.ElementLocation;
import io.buildeval.core.error.ConditionEvaluationException;
import io.buildeval.core.error.ProjectEvaluationException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates condition strings.
 *
 * <p>
 * Parsed conditions are cached per expression and parser options. An entry is
 * dropped again whenever parsing or evaluating it fails, so the next evaluation
 * of the same text starts from an unparsed state. Thread-safe; the cache may be
 * shared by concurrent evaluations.
 */
public final class ConditionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionEvaluator.class);

    private record CacheKey(String expression, ParserOptions options) {}

    private final Map<CacheKey, ConditionNode> parsed = new ConcurrentHashMap<>();

    /**
     * Evaluates {@code condition}. A blank condition is {@code true}.
     *
     * @throws ConditionEvaluationException when the condition is malformed or
     *     does not evaluate to a boolean
     */
    public boolean evaluate(String condition, ParserOptions options, ConditionState state, ElementLocation location) {
        Objects.requireNonNull(state, "state must not be null");
        if (condition == null || condition.isBlank()) {
            return true;
        }
        CacheKey key = new CacheKey(condition, options);
        ConditionNode node = parsed.get(key);
        try {
            if (node == null) {
                node = ConditionParser.parse(condition, options);
                parsed.put(key, node);
            }
            boolean result = node.evaluate(state);
            LOG.trace("Condition evaluated: condition={}, result={}", condition, result);
            return result;
        } catch (ConditionParser.ParseFailure e) {
            parsed.remove(key);
            throw new ConditionEvaluationException(
                    "The condition \"" + condition + "\" is invalid: " + e.getMessage() + ".",
                    condition,
                    e.reason(),
                    e.position(),
                    location);
        } catch (ConditionNode.Failure e) {
            parsed.remove(key);
            throw new ConditionEvaluationException(
                    "The condition \"" + condition + "\" is invalid: " + e.getMessage() + ".",
                    condition,
                    e.reason(),
                    0,
                    location);
        } catch (RuntimeException e) {
            parsed.remove(key);
            throw e;
        }
    }

    /**
     * Evaluates a condition only to describe it in a log, for example why an
     * import was skipped. Failures are logged at debug level and reported as an
     * empty result.
     */
    public Optional<Boolean> evaluateForLogging(
            String condition, ParserOptions options, ConditionState state, ElementLocation location) {
        try {
            return Optional.of(evaluate(condition, options, state, location));
        } catch (ProjectEvaluationException e) {
            LOG.debug("Condition could not be re-evaluated for logging: condition={}, error={}", condition, e.getMessage());
            return Optional.empty();
        }
    }

    /** Number of parsed conditions held in the cache. */
    public int cachedConditionCount() {
        return parsed.size();
    }

    /**
     * Returns {@code true} if {@code condition} is currently held in parsed
     * form.
     */
    public boolean isCached(String condition, ParserOptions options) {
        return parsed.containsKey(new CacheKey(condition, options));
    }
}
