package io.buildeval.core.evaluation.condition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ConditionParser")
class ConditionParserTest {

    @Nested
    @DisplayName("error positions")
    class Positions {

        static Stream<Arguments> malformed() {
            return Stream.of(
                    Arguments.of("1==1.1.", 7),
                    Arguments.of("1==0xFG", 7),
                    Arguments.of("1==-0xF", 6),
                    Arguments.of("1234=5678", 6),
                    Arguments.of(" ", 2),
                    Arguments.of(" (", 3),
                    Arguments.of(" false or  ", 12),
                    Arguments.of(" \"foo", 2),
                    Arguments.of(" 'foo", 2),
                    Arguments.of(" @(foo", 2),
                    Arguments.of(" $(foo", 2),
                    Arguments.of("$(a b)", 4));
        }

        @ParameterizedTest(name = "[{0}] fails at {1}")
        @MethodSource("malformed")
        void reportsOneBasedPosition(String expression, int position) {
            assertThatThrownBy(() -> ConditionParser.parse(expression, ParserOptions.ALL))
                    .isInstanceOfSatisfying(
                            ConditionParser.ParseFailure.class,
                            f -> assertThat(f.position()).isEqualTo(position));
        }

        @Test
        @DisplayName("item lists are rejected where only properties are allowed")
        void itemListNotAllowed() {
            assertThatThrownBy(() -> ConditionParser.parse(" @(foo)", ParserOptions.PROPERTIES))
                    .isInstanceOfSatisfying(ConditionParser.ParseFailure.class, f -> {
                        assertThat(f.reason()).isEqualTo("ItemListNotAllowed");
                        assertThat(f.position()).isEqualTo(2);
                    });
        }

        @Test
        @DisplayName("a single '=' is an ill-formed equals")
        void illFormedEquals() {
            assertThatThrownBy(() -> ConditionParser.parse("1234=5678", ParserOptions.ALL))
                    .isInstanceOfSatisfying(
                            ConditionParser.ParseFailure.class,
                            f -> assertThat(f.reason()).isEqualTo("IllFormedEquals"));
        }

        @Test
        @DisplayName("an unterminated quote names the quote as the problem")
        void illFormedQuote() {
            assertThatThrownBy(() -> ConditionParser.parse("'abc", ParserOptions.ALL))
                    .isInstanceOfSatisfying(
                            ConditionParser.ParseFailure.class,
                            f -> assertThat(f.reason()).isEqualTo("IllFormedQuotedString"));
        }
    }

    @Nested
    @DisplayName("accepted input")
    class Accepted {

        @ParameterizedTest
        @ValueSource(strings = {
            "true",
            "'$(Configuration)' == 'Debug'",
            "$(A) != ''",
            "!false",
            "(true or false) and !(false)",
            "1 < 2 and 0x10 >= 16",
            "Exists('$(MSBuildThisFileDirectory)x.props')",
            "HasTrailingSlash($(OutDir))",
            "'@(Compile)' != ''",
            "'%(Identity)' == 'a'"
        })
        void parses(String expression) {
            assertThatCode(() -> ConditionParser.parse(expression, ParserOptions.ALL)).doesNotThrowAnyException();
        }
    }
}
