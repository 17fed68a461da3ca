package io.buildeval.core.evaluation;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ExpressionShredder")
class ExpressionShredderTest {

    @Nested
    @DisplayName("splitSemiColonSeparatedList")
    class Split {

        @Test
        @DisplayName("drops empty entries")
        void dropsEmptyEntries() {
            assertThat(ExpressionShredder.splitSemiColonSeparatedList("a;;b")).containsExactly("a", "b");
        }

        @Test
        @DisplayName("empty input gives an empty list")
        void emptyInput() {
            assertThat(ExpressionShredder.splitSemiColonSeparatedList("")).isEmpty();
            assertThat(ExpressionShredder.splitSemiColonSeparatedList(" ; ")).isEmpty();
        }

        @Test
        @DisplayName("does not split inside an item vector separator")
        void keepsVectorSeparator() {
            assertThat(ExpressionShredder.splitSemiColonSeparatedList("@(foo,';')")).containsExactly("@(foo,';')");
        }

        @Test
        @DisplayName("does not split inside a transform")
        void keepsTransform() {
            assertThat(ExpressionShredder.splitSemiColonSeparatedList("x; @(foo->'%(a);%(b)') ;y"))
                    .containsExactly("x", "@(foo->'%(a);%(b)')", "y");
        }

        @Test
        @DisplayName("trims entries")
        void trims() {
            assertThat(ExpressionShredder.splitSemiColonSeparatedList("  a ;\tb  ")).containsExactly("a", "b");
        }
    }

    @Nested
    @DisplayName("getReferencedItemExpressions")
    class Vectors {

        @Test
        @DisplayName("captures transform, separator and position")
        void capturesParts() {
            var captures = ExpressionShredder.getReferencedItemExpressions("x @(Compile->'%(Filename)', ',') y");

            assertThat(captures).hasSize(1);
            var vector = captures.get(0);
            assertThat(vector.index()).isEqualTo(2);
            assertThat(vector.value()).isEqualTo("@(Compile->'%(Filename)', ',')");
            assertThat(vector.itemType()).isEqualTo("Compile");
            assertThat(vector.separator()).isEqualTo(",");
            assertThat(vector.captures()).hasSize(1);
            assertThat(vector.captures().get(0).value()).isEqualTo("%(Filename)");
            assertThat(vector.captures().get(0).isFunction()).isFalse();
        }

        @Test
        @DisplayName("captures item functions with their arguments")
        void capturesFunctions() {
            var vector = ExpressionShredder.getReferencedItemExpressions("@(Foo->WithMetadataValue('a', 'b')->Distinct())")
                    .get(0);

            assertThat(vector.itemType()).isEqualTo("Foo");
            assertThat(vector.captures()).hasSize(2);
            assertThat(vector.captures().get(0).functionName()).isEqualTo("WithMetadataValue");
            assertThat(vector.captures().get(0).functionArguments()).isEqualTo("'a', 'b'");
            assertThat(vector.captures().get(1).functionName()).isEqualTo("Distinct");
            assertThat(vector.captures().get(1).functionArguments()).isNull();
        }

        @Test
        @DisplayName("an arrow directly after the name is not part of the name")
        void arrowAfterHyphen() {
            var vector = ExpressionShredder.getReferencedItemExpressions("@(my-items->'%(x)')").get(0);

            assertThat(vector.itemType()).isEqualTo("my-items");
        }

        @ParameterizedTest
        @ValueSource(strings = {"@(", "@(foo", "@(1foo)", "@(foo->)", "@(foo, bar)", "@(foo->'x)", "plain"})
        @DisplayName("malformed vectors are skipped")
        void malformed(String expression) {
            assertThat(ExpressionShredder.getReferencedItemExpressions(expression)).isEmpty();
        }
    }

    @Nested
    @DisplayName("getReferencedItemNamesAndMetadata agrees with a regular expression")
    class Oracle {

        private static final String NAME = "[A-Za-z_][A-Za-z_0-9\\-]*";
        private static final Pattern VECTOR = Pattern.compile(
                "@\\(\\s*(" + NAME + ")\\s*((?:->\\s*'[^']*'\\s*)*)(,\\s*'[^']*')?\\s*\\)");
        private static final Pattern TRANSFORM = Pattern.compile("->\\s*'[^']*'");
        private static final Pattern METADATA = Pattern.compile(
                "%\\(\\s*(?:(" + NAME + ")\\s*\\.\\s*)?(" + NAME + ")\\s*\\)");

        @ParameterizedTest
        @ValueSource(strings = {
            "@(foo)",
            "@( foo )",
            "@(foo->'%(bar)')",
            "@(foo, ';')",
            "@(foo->'x', '%(sep)')",
            "%(m)",
            "%(a.m)",
            "%( a . m )",
            "@(",
            "@(foo",
            "@(1foo)",
            "%(",
            "%(1)",
            "x@(a);@(b)y",
            "@(a->'%(x)');%(y)",
            "@@(a)",
            "%(a.b.c)",
            "@(a-b)",
            "@(foo->'a'->'b')",
            "@(a->'@(b)')",
            "@(foo@(bar)",
            "text only",
            "",
            "@(a)%(b)@(c, '-')",
            "%(x)@(y->'%(z)')",
            "@(a);  @(b->'%(c)')",
            "%(%(a))",
            "@(a, '%(b)'"
        })
        void matchesOracle(String expression) {
            var pair = ExpressionShredder.getReferencedItemNamesAndMetadata(expression);

            assertThat(new ArrayList<>(pair.items())).as("items of %s", expression).containsExactlyElementsOf(oracleItems(expression));
            assertThat(new ArrayList<>(pair.metadata().keySet()))
                    .as("metadata of %s", expression)
                    .containsExactlyElementsOf(oracleMetadata(expression));
        }

        private List<String> oracleItems(String expression) {
            Set<String> items = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
            Matcher m = VECTOR.matcher(expression);
            while (m.find()) {
                items.add(m.group(1));
            }
            return new ArrayList<>(items);
        }

        private List<String> oracleMetadata(String expression) {
            StringBuilder withoutTransforms = new StringBuilder();
            Matcher vectors = VECTOR.matcher(expression);
            int copied = 0;
            while (vectors.find()) {
                withoutTransforms.append(expression, copied, vectors.start());
                withoutTransforms.append(TRANSFORM.matcher(vectors.group()).replaceAll(""));
                copied = vectors.end();
            }
            withoutTransforms.append(expression.substring(copied));

            Set<String> metadata = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
            Matcher m = METADATA.matcher(withoutTransforms);
            while (m.find()) {
                metadata.add(m.group(1) == null ? m.group(2) : m.group(1) + "." + m.group(2));
            }
            return new ArrayList<>(metadata);
        }
    }

    @Test
    @DisplayName("metadata outside transforms is detected; metadata inside is not")
    void metadataOutsideTransform() {
        assertThat(ExpressionShredder.containsMetadataExpressionOutsideTransform("%(Identity)")).isTrue();
        assertThat(ExpressionShredder.containsMetadataExpressionOutsideTransform("@(i->'%(Identity)')")).isFalse();
        assertThat(ExpressionShredder.containsMetadataExpressionOutsideTransform("plain")).isFalse();
    }
}
