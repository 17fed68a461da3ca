package io.buildeval.standalone.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.buildeval.core.error.ImportNotFoundException;
import io.buildeval.core.evaluation.EvaluatedProject;
import io.buildeval.core.evaluation.EvaluationSettings;
import io.buildeval.core.evaluation.ItemNameCaseSensitivity;
import io.buildeval.core.evaluation.LoadSetting;
import io.buildeval.core.evaluation.PropertyTracking;
import io.buildeval.standalone.config.CliConfig;
import io.buildeval.standalone.config.ConfigLoadException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

@DisplayName("EvaluateCommand")
class EvaluateCommandTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path dir;

    private Path project;

    @BeforeEach
    void setUp() throws IOException {
        write("common.props", """
                <Project>
                  <PropertyGroup>
                    <Shared>one</Shared>
                  </PropertyGroup>
                </Project>
                """);
        project = write("app.proj", """
                <Project DefaultTargets="Build" InitialTargets="Init">
                  <Import Project="common.props" />
                  <PropertyGroup>
                    <Out>bin/$(Configuration)</Out>
                  </PropertyGroup>
                  <ItemGroup>
                    <Compile Include="a.cs">
                      <Kind>source</Kind>
                    </Compile>
                  </ItemGroup>
                  <Target Name="Init" />
                  <Target Name="Build" />
                </Project>
                """);
    }

    private Path write(String relative, String content) throws IOException {
        Path file = dir.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    private CliConfig.Builder config(Path projectFile) {
        return CliConfig.builder().project(projectFile.toString());
    }

    private JsonNode run(CliConfig config) throws IOException {
        return run(config, Map.of());
    }

    private JsonNode run(CliConfig config, Map<String, String> environment) throws IOException {
        var buffer = new ByteArrayOutputStream();
        try (var out = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            new EvaluateCommand(config, environment).run(out);
        }
        return MAPPER.readTree(buffer.toString(StandardCharsets.UTF_8));
    }

    private static List<String> texts(JsonNode array) {
        List<String> result = new ArrayList<>();
        array.forEach(node -> result.add(node.asText()));
        return result;
    }

    // --- Output ---

    @Nested
    @DisplayName("JSON output")
    class Output {

        @Test
        @DisplayName("carries properties, items, imports and targets")
        void fullDocument() throws IOException {
            JsonNode json = run(config(project).globalProperty("Configuration", "Release").build());

            assertThat(json.get("project").asText()).endsWith("app.proj");
            assertThat(json.get("toolsVersion").asText()).isEqualTo("Current");
            assertThat(json.at("/globalProperties/Configuration").asText()).isEqualTo("Release");
            assertThat(json.at("/properties/Out").asText()).isEqualTo("bin/Release");
            assertThat(json.at("/properties/Shared").asText()).isEqualTo("one");

            assertThat(json.get("items")).hasSize(1);
            assertThat(json.at("/items/0/itemType").asText()).isEqualTo("Compile");
            assertThat(json.at("/items/0/include").asText()).isEqualTo("a.cs");
            assertThat(json.at("/items/0/metadata/Kind").asText()).isEqualTo("source");

            assertThat(json.get("imports")).hasSize(1);
            assertThat(json.at("/imports/0/file").asText()).endsWith("common.props");
            assertThat(json.at("/imports/0/importedBy").asText()).contains("app.proj(2,");
            assertThat(json.at("/imports/0/sdk").isMissingNode()).isTrue();

            assertThat(texts(json.get("targets"))).containsExactlyInAnyOrder("Init", "Build");
            assertThat(texts(json.get("defaultTargets"))).containsExactly("Build");
            assertThat(texts(json.get("initialTargets"))).containsExactly("Init");
            assertThat(json.get("warnings")).isEmpty();
        }

        @Test
        @DisplayName("environment properties are left out unless requested")
        void environmentProperties() throws IOException {
            var env = Map.of("BUILDEVAL_TEST_VAR", "from-env");

            JsonNode without = run(config(project).build(), env);
            JsonNode with = run(config(project).includeEnvironment(true).build(), env);

            assertThat(without.get("properties").has("BUILDEVAL_TEST_VAR")).isFalse();
            assertThat(with.at("/properties/BUILDEVAL_TEST_VAR").asText()).isEqualTo("from-env");
        }

        @Test
        @DisplayName("warnings raised during evaluation are listed with code and location")
        void warnings() throws IOException {
            Path late = write("late.proj", """
                    <Project>
                      <PropertyGroup>
                        <A>$(B)</A>
                        <B>x</B>
                      </PropertyGroup>
                    </Project>
                    """);

            JsonNode json = run(config(late).warnOnUninitializedProperty(true).build());

            assertThat(json.get("warnings")).hasSize(1);
            assertThat(json.at("/warnings/0/code").asText()).isEqualTo("MSB4211");
            assertThat(json.at("/warnings/0/message").asText()).contains("\"B\"");
            assertThat(json.at("/warnings/0/location").asText()).contains("late.proj(4,");
        }

        @Test
        @DisplayName("compact output is a single line")
        void compact() {
            var buffer = new ByteArrayOutputStream();
            try (var out = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
                new EvaluateCommand(config(project).prettyPrint(false).build(), Map.of()).run(out);
            }

            assertThat(buffer.toString(StandardCharsets.UTF_8).strip()).doesNotContain("\n");
        }

        @Test
        @DisplayName("the evaluated project is returned to the caller")
        void returnsResult() {
            EvaluatedProject result = new EvaluateCommand(config(project).build(), Map.of())
                    .run(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));

            assertThat(result.getPropertyValue("Shared")).isEqualTo("one");
        }
    }

    // --- Toolsets, SDKs and load settings ---

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("a toolset file supplies toolset properties and the selected tools version")
        void toolsetFile() throws IOException {
            Path toolsets = write("toolsets.yaml", """
                    defaultToolsVersion: Current
                    toolsets:
                      - toolsVersion: Current
                        toolsPath: /opt/build/bin
                        properties:
                          Flavor: current
                      - toolsVersion: "15.0"
                        toolsPath: /opt/build/15/bin
                        properties:
                          Flavor: legacy
                    """);

            JsonNode current = run(config(project).toolsetFile(toolsets.toString()).build());
            JsonNode legacy = run(config(project).toolsetFile(toolsets.toString()).toolsVersion("15.0").build());

            assertThat(current.at("/properties/Flavor").asText()).isEqualTo("current");
            assertThat(legacy.get("toolsVersion").asText()).isEqualTo("15.0");
            assertThat(legacy.at("/properties/Flavor").asText()).isEqualTo("legacy");
        }

        @Test
        @DisplayName("SDK roots make project SDKs resolvable")
        void sdkRoots() throws IOException {
            write("sdks/My.Sdk/Sdk/Sdk.props", """
                    <Project>
                      <PropertyGroup><FromSdk>yes</FromSdk></PropertyGroup>
                    </Project>
                    """);
            write("sdks/My.Sdk/Sdk/Sdk.targets", "<Project />");
            Path sdkProject = write("sdk.proj", "<Project Sdk=\"My.Sdk\" />");

            JsonNode json = run(config(sdkProject).sdkRoot(dir.resolve("sdks").toString()).build());

            assertThat(json.at("/properties/FromSdk").asText()).isEqualTo("yes");
            assertThat(json.get("imports")).hasSize(2);
            assertThat(json.at("/imports/0/sdk").asText()).isEqualTo("My.Sdk");
        }

        @Test
        @DisplayName("a missing import fails unless missing imports are ignored")
        void missingImport() throws IOException {
            Path broken = write("broken.proj", """
                    <Project>
                      <Import Project="missing.props" />
                    </Project>
                    """);
            PrintStream out = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);

            assertThatThrownBy(() -> new EvaluateCommand(config(broken).build(), Map.of()).run(out))
                    .isInstanceOf(ImportNotFoundException.class)
                    .hasMessageContaining("missing.props");

            JsonNode json = run(config(broken).loadSetting("ignore-missing-imports").build());
            assertThat(json.get("imports")).isEmpty();
        }

        @Test
        @DisplayName("CLI switches map onto evaluation settings")
        void settings() {
            EvaluationSettings settings = EvaluateCommand.settings(config(project)
                    .warnOnUninitializedProperty(true)
                    .caseSensitiveItemNames(true)
                    .propertyTracking(5)
                    .logImports(true)
                    .loadSetting("RejectCircularImports")
                    .build());

            assertThat(settings.warnOnUninitializedProperty()).isTrue();
            assertThat(settings.itemNameCaseSensitivity()).isEqualTo(ItemNameCaseSensitivity.CASE_SENSITIVE);
            assertThat(settings.propertyTracking()).containsExactlyInAnyOrder(
                    PropertyTracking.PROPERTY_REASSIGNMENT, PropertyTracking.ENVIRONMENT_VARIABLE_READ);
            assertThat(settings.logImports()).isTrue();
            assertThat(settings.loadSettings()).containsExactly(LoadSetting.REJECT_CIRCULAR_IMPORTS);
        }

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {"IGNORE_MISSING_IMPORTS", "ignore-missing-imports", "IgnoreMissingImports", " ignore_missing_imports "})
        @DisplayName("load setting names are accepted in several spellings")
        void loadSettingSpellings(String name) {
            assertThat(EvaluateCommand.loadSetting(name)).isEqualTo(LoadSetting.IGNORE_MISSING_IMPORTS);
        }

        @Test
        @DisplayName("an unknown load setting is a configuration error")
        void unknownLoadSetting() {
            assertThatThrownBy(() -> EvaluateCommand.loadSetting("bogus"))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Unknown load setting: bogus")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }
    }

    // --- Logging ---

    @Nested
    @DisplayName("Logging")
    class Logging {

        private Logger logger;
        private ListAppender<ILoggingEvent> appender;

        @BeforeEach
        void attachAppender() {
            logger = (Logger) LoggerFactory.getLogger(EvaluateCommand.class);
            appender = new ListAppender<>();
            appender.start();
            logger.addAppender(appender);
        }

        @AfterEach
        void detachAppender() {
            logger.detachAppender(appender);
            appender.stop();
        }

        @Test
        @DisplayName("a completed run logs the project and warning count at INFO")
        void summaryLine() throws IOException {
            run(config(project).build());

            assertThat(appender.list)
                    .filteredOn(e -> e.getLevel() == Level.INFO)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .singleElement()
                    .satisfies(message -> assertThat(message)
                            .startsWith("Evaluation written")
                            .contains("app.proj")
                            .contains("warnings=0"));
        }
    }
}
