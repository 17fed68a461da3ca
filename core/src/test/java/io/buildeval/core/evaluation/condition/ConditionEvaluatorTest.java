package io.buildeval.core.evaluation.condition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.buildeval.core.construction.ElementLocation;
import io.buildeval.core.error.ConditionEvaluationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ConditionEvaluator")
class ConditionEvaluatorTest {

    private static final Pattern PROPERTY = Pattern.compile("\\$\\(([^)]*)\\)");
    private static final ElementLocation LOCATION = new ElementLocation("/p/app.proj", 3, 5);

    @TempDir
    Path dir;

    private ConditionEvaluator evaluator;
    private final Map<String, String> properties = new HashMap<>();
    private ConditionedProperties conditioned;

    @BeforeEach
    void setUp() {
        evaluator = new ConditionEvaluator();
        conditioned = null;
    }

    private boolean eval(String condition) {
        return evaluator.evaluate(condition, ParserOptions.ALL, new MapState(), LOCATION);
    }

    /** Expands {@code $(name)} from {@link #properties}; unknown names expand to empty. */
    private final class MapState implements ConditionState {
        @Override
        public String expand(String text) {
            Matcher m = PROPERTY.matcher(text);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                m.appendReplacement(sb, Matcher.quoteReplacement(properties.getOrDefault(m.group(1).trim(), "")));
            }
            m.appendTail(sb);
            return sb.toString();
        }

        @Override
        public Path evaluationDirectory() {
            return dir;
        }

        @Override
        public ConditionedProperties conditionedProperties() {
            return conditioned;
        }
    }

    // --- Comparisons ---

    @Nested
    @DisplayName("comparisons")
    class Comparisons {

        @ParameterizedTest(name = "{0} is {1}")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "1 == 1.0|true",
            "0x10 == 16|true",
            "'1.0' == '1.0.0'|false",
            "'1.2.3' < '1.10'|true",
            "2 > 10|false",
            "2 <= 2|true",
            "'true' == 'on'|true",
            "'yes' != 'no'|true",
            "'ABC' == 'abc'|true",
            "'abc' != 'abd'|true",
            "'' == ''|true"
        })
        void compares(String condition, boolean expected) {
            assertThat(eval(condition)).isEqualTo(expected);
        }

        @Test
        @DisplayName("properties are expanded before comparing")
        void expandsProperties() {
            properties.put("Configuration", "debug");

            assertThat(eval("'$(Configuration)' == 'Debug'")).isTrue();
            assertThat(eval("'$(Platform)' == ''")).isTrue();
        }

        @Test
        @DisplayName("escaped values are compared unescaped")
        void comparesUnescaped() {
            properties.put("Name", "a%3Bb");

            assertThat(eval("'$(Name)' == 'a;b'")).isTrue();
        }

        @Test
        @DisplayName("ordering non-numbers fails")
        void orderingNonNumbers() {
            assertThatThrownBy(() -> eval("'abc' < 'def'"))
                    .isInstanceOfSatisfying(ConditionEvaluationException.class, e -> {
                        assertThat(e.reason()).isEqualTo("ComparisonOnNonNumericExpression");
                        assertThat(e.errorCode()).isEqualTo("MSB4092");
                        assertThat(e.location()).isEqualTo(LOCATION);
                    });
        }
    }

    // --- Boolean logic ---

    @Nested
    @DisplayName("boolean operators")
    class Logic {

        @ParameterizedTest(name = "{0} is {1}")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "true|true",
            "!false|true",
            "'!off'|true",
            "true and false or true|true",
            "(true or false) and false|false",
            "!(true and false)|true",
            "NO|false"
        })
        void evaluates(String condition, boolean expected) {
            assertThat(eval(condition)).isEqualTo(expected);
        }

        @Test
        @DisplayName("a blank condition is true")
        void blankIsTrue() {
            assertThat(eval("")).isTrue();
            assertThat(eval("   ")).isTrue();
            assertThat(evaluator.cachedConditionCount()).isZero();
        }

        @Test
        @DisplayName("a non-boolean operand fails")
        void nonBoolean() {
            assertThatThrownBy(() -> eval("'abc'"))
                    .isInstanceOfSatisfying(
                            ConditionEvaluationException.class,
                            e -> assertThat(e.reason()).isEqualTo("ConditionNotBoolean"));
        }
    }

    // --- Functions ---

    @Nested
    @DisplayName("functions")
    class Functions {

        @Test
        @DisplayName("Exists resolves relative paths against the evaluation directory")
        void exists() throws IOException {
            Files.createDirectories(dir.resolve("sub"));
            Files.writeString(dir.resolve("sub/a.props"), "<Project/>");

            assertThat(eval("Exists('sub')")).isTrue();
            assertThat(eval("Exists('sub\\a.props')")).isTrue();
            assertThat(eval("Exists('missing.props')")).isFalse();
            assertThat(eval("Exists('')")).isFalse();
        }

        @Test
        @DisplayName("HasTrailingSlash accepts both separators")
        void hasTrailingSlash() {
            properties.put("OutDir", "bin\\");

            assertThat(eval("HasTrailingSlash('$(OutDir)')")).isTrue();
            assertThat(eval("HasTrailingSlash('bin/')")).isTrue();
            assertThat(eval("HasTrailingSlash('bin')")).isFalse();
        }

        @Test
        @DisplayName("unknown functions and wrong arity fail")
        void undefined() {
            assertThatThrownBy(() -> eval("Foo('x')"))
                    .isInstanceOfSatisfying(
                            ConditionEvaluationException.class,
                            e -> assertThat(e.reason()).isEqualTo("UndefinedFunctionCall"));
            assertThatThrownBy(() -> eval("Exists('a', 'b')"))
                    .isInstanceOfSatisfying(
                            ConditionEvaluationException.class,
                            e -> assertThat(e.reason()).isEqualTo("IncorrectNumberOfFunctionArguments"));
        }
    }

    // --- Cache ---

    @Nested
    @DisplayName("parse cache")
    class Cache {

        @Test
        @DisplayName("keeps successfully evaluated conditions per parser options")
        void keepsValid() {
            eval("'$(A)' == ''");

            assertThat(evaluator.isCached("'$(A)' == ''", ParserOptions.ALL)).isTrue();
            assertThat(evaluator.isCached("'$(A)' == ''", ParserOptions.PROPERTIES)).isFalse();
        }

        @Test
        @DisplayName("drops a condition whose evaluation failed")
        void dropsFailed() {
            properties.put("A", "abc");

            assertThatThrownBy(() -> eval("$(A)")).isInstanceOf(ConditionEvaluationException.class);
            assertThat(evaluator.isCached("$(A)", ParserOptions.ALL)).isFalse();

            properties.put("A", "true");
            assertThat(eval("$(A)")).isTrue();
            assertThat(evaluator.isCached("$(A)", ParserOptions.ALL)).isTrue();
        }

        @Test
        @DisplayName("parse errors carry the expression and position")
        void parseError() {
            assertThatThrownBy(() -> eval("1==0xFG"))
                    .isInstanceOfSatisfying(ConditionEvaluationException.class, e -> {
                        assertThat(e.expression()).isEqualTo("1==0xFG");
                        assertThat(e.position()).isEqualTo(7);
                        assertThat(e.getMessage()).contains("1==0xFG");
                    });
            assertThat(evaluator.cachedConditionCount()).isZero();
        }

        @Test
        @DisplayName("evaluateForLogging reports failures as empty")
        void forLogging() {
            assertThat(evaluator.evaluateForLogging("'a' <", ParserOptions.ALL, new MapState(), LOCATION))
                    .isEmpty();
            assertThat(evaluator.evaluateForLogging("true", ParserOptions.ALL, new MapState(), LOCATION))
                    .contains(true);
        }
    }

    @Test
    @DisplayName("equality comparisons record the values properties are compared against")
    void recordsConditionedProperties() {
        conditioned = new ConditionedProperties();

        eval("'$(Configuration)|$(Platform)' == 'Debug|AnyCPU'");
        eval("'$(Configuration)|$(Platform)' == 'Release|AnyCPU'");
        eval("'$(Configuration)' == 'debug'");

        assertThat(conditioned.asMap())
                .containsEntry("Configuration", List.of("Debug", "Release"))
                .containsEntry("platform", List.of("AnyCPU"));
    }
}
