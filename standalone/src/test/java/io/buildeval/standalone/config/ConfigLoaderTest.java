package io.buildeval.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConfigLoader}: YAML fixtures from the classpath, environment overrides and
 * command-line arguments, applied in that order.
 */
@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    private static String fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource("config/" + name).toURI())
                .toString();
    }

    private static CliConfig load(Map<String, String> env, String... args) {
        return ConfigLoader.load(args, env::get);
    }

    @Nested
    @DisplayName("YAML file")
    class YamlFile {

        @Test
        @DisplayName("minimal config has the project and every default")
        void minimalConfig() throws Exception {
            CliConfig config = load(Map.of(), "--config", fixture("minimal-config.yaml"));

            assertThat(config.project()).isEqualTo("app.proj");
            assertThat(config.toolsetFile()).isNull();
            assertThat(config.toolsVersion()).isNull();
            assertThat(config.globalProperties()).isEmpty();
            assertThat(config.sdkRoots()).isEmpty();
            assertThat(config.loadSettings()).isEmpty();
            assertThat(config.warnOnUninitializedProperty()).isFalse();
            assertThat(config.caseSensitiveItemNames()).isFalse();
            assertThat(config.propertyTracking()).isZero();
            assertThat(config.logImports()).isFalse();
            assertThat(config.includeEnvironment()).isFalse();
            assertThat(config.prettyPrint()).isTrue();
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }

        @Test
        @DisplayName("full config populates every field")
        void fullConfig() throws Exception {
            CliConfig config = load(Map.of(), "--config", fixture("full-config.yaml"));

            assertThat(config.project()).isEqualTo("src/app.proj");
            assertThat(config.toolsetFile()).isEqualTo("toolsets.yaml");
            assertThat(config.toolsVersion()).isEqualTo("15.0");
            assertThat(config.globalProperties())
                    .containsExactly(Map.entry("Configuration", "Release"), Map.entry("Platform", "x64"));
            assertThat(config.sdkRoots()).containsExactly("/opt/sdks", "/usr/local/sdks");
            assertThat(config.loadSettings())
                    .containsExactly("ignore-missing-imports", "RECORD_DUPLICATE_BUT_NOT_CIRCULAR_IMPORTS");
            assertThat(config.warnOnUninitializedProperty()).isTrue();
            assertThat(config.caseSensitiveItemNames()).isTrue();
            assertThat(config.propertyTracking()).isEqualTo(3);
            assertThat(config.logImports()).isTrue();
            assertThat(config.includeEnvironment()).isTrue();
            assertThat(config.prettyPrint()).isFalse();
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }

        @Test
        @DisplayName("an empty file contributes nothing")
        void emptyFile(@TempDir Path dir) throws IOException {
            Path empty = Files.writeString(dir.resolve("empty.yaml"), "");

            CliConfig config = load(Map.of(), "--config", empty.toString(), "app.proj");

            assertThat(config.project()).isEqualTo("app.proj");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }

        @Test
        @DisplayName("a missing file is reported with its path")
        void missingFile(@TempDir Path dir) {
            Path missing = dir.resolve("nope.yaml");

            assertThatThrownBy(() -> load(Map.of(), "--config", missing.toString()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration file not found")
                    .hasMessageContaining("nope.yaml");
        }

        @Test
        @DisplayName("malformed YAML is reported with the parser error as cause")
        void malformedYaml() throws Exception {
            String path = fixture("malformed-config.yaml");

            assertThatThrownBy(() -> load(Map.of(), "--config", path))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML configuration")
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("--config without a value is rejected")
        void configWithoutValue() {
            assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"app.proj", "--config"}))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("--config");
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"app.proj"})).isNull();
        }
    }

    @Nested
    @DisplayName("Environment overrides")
    class EnvironmentOverrides {

        @Test
        @DisplayName("environment variables override the file")
        void envOverridesFile() throws Exception {
            var env = Map.of(
                    "BUILDEVAL_PROJECT", " other.proj ",
                    "BUILDEVAL_TOOLS_VERSION", "Current",
                    "BUILDEVAL_LOG_LEVEL", "INFO",
                    "BUILDEVAL_PROPERTY_TRACKING", "15",
                    "BUILDEVAL_CASE_SENSITIVE_ITEM_NAMES", "false");

            CliConfig config = load(env, "--config", fixture("full-config.yaml"));

            assertThat(config.project()).isEqualTo("other.proj");
            assertThat(config.toolsVersion()).isEqualTo("Current");
            assertThat(config.loggingLevel()).isEqualTo("INFO");
            assertThat(config.propertyTracking()).isEqualTo(15);
            assertThat(config.caseSensitiveItemNames()).isFalse();
            assertThat(config.loggingFormat()).isEqualTo("json");
        }

        @Test
        @DisplayName("blank variables count as unset")
        void blankIgnored() {
            CliConfig config = load(Map.of("BUILDEVAL_LOG_LEVEL", "   "), "app.proj");

            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }

        @Test
        @DisplayName("SDK roots are split on the path separator")
        void sdkRootsSplit() {
            String roots = "/a" + File.pathSeparator + File.pathSeparator + " /b ";

            CliConfig config = load(Map.of("BUILDEVAL_SDK_ROOTS", roots), "app.proj");

            assertThat(config.sdkRoots()).containsExactly("/a", "/b");
        }

        @Test
        @DisplayName("a non-numeric property tracking value is rejected")
        void invalidInteger() {
            assertThatThrownBy(() -> load(Map.of("BUILDEVAL_PROPERTY_TRACKING", "all"), "app.proj"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("BUILDEVAL_PROPERTY_TRACKING")
                    .hasMessageContaining("'all'")
                    .hasCauseInstanceOf(NumberFormatException.class);
        }
    }

    @Nested
    @DisplayName("Command-line arguments")
    class Arguments {

        @Test
        @DisplayName("arguments override both the file and the environment")
        void argsOverrideAll() throws Exception {
            CliConfig config = load(
                    Map.of("BUILDEVAL_PROJECT", "env.proj"),
                    "--config", fixture("full-config.yaml"),
                    "--project", "cli.proj",
                    "--tools-version", "Legacy",
                    "--compact");

            assertThat(config.project()).isEqualTo("cli.proj");
            assertThat(config.toolsVersion()).isEqualTo("Legacy");
            assertThat(config.prettyPrint()).isFalse();
        }

        @Test
        @DisplayName("a bare argument names the project")
        void bareProject() {
            assertThat(load(Map.of(), "app.proj").project()).isEqualTo("app.proj");
        }

        @Test
        @DisplayName("global properties accept both spellings and several pairs")
        void globalProperties() {
            CliConfig config = load(Map.of(),
                    "app.proj",
                    "-p:Configuration=Release;Platform=x64",
                    "/p:Empty=",
                    "--property", "Flag=a=b");

            assertThat(config.globalProperties()).containsExactly(
                    Map.entry("Configuration", "Release"),
                    Map.entry("Platform", "x64"),
                    Map.entry("Empty", ""),
                    Map.entry("Flag", "a=b"));
        }

        @Test
        @DisplayName("switches and repeated options accumulate")
        void switches() {
            CliConfig config = load(Map.of(),
                    "--project", "app.proj",
                    "--toolset", "toolsets.yaml",
                    "--sdk-root", "/one",
                    "--sdk-root", "/two",
                    "--load-setting", "IgnoreMissingImports",
                    "--log-imports",
                    "--warn-uninitialized",
                    "--include-environment");

            assertThat(config.toolsetFile()).isEqualTo("toolsets.yaml");
            assertThat(config.sdkRoots()).containsExactly("/one", "/two");
            assertThat(config.loadSettings()).containsExactly("IgnoreMissingImports");
            assertThat(config.logImports()).isTrue();
            assertThat(config.warnOnUninitializedProperty()).isTrue();
            assertThat(config.includeEnvironment()).isTrue();
        }

        @Test
        @DisplayName("a property without a name is rejected")
        void propertyWithoutName() {
            assertThatThrownBy(() -> load(Map.of(), "app.proj", "-p:=value"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Name=Value");
        }

        @Test
        @DisplayName("an unknown option is rejected")
        void unknownOption() {
            assertThatThrownBy(() -> load(Map.of(), "app.proj", "--verbose"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Unknown option: --verbose");
        }

        @Test
        @DisplayName("an option missing its value is rejected")
        void missingValue() {
            assertThatThrownBy(() -> load(Map.of(), "app.proj", "--sdk-root"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("--sdk-root requires a value");
        }

        @Test
        @DisplayName("a configuration without a project is rejected")
        void noProject() {
            assertThatThrownBy(() -> load(Map.of(), "--log-imports"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("No project file configured");
        }
    }
}
