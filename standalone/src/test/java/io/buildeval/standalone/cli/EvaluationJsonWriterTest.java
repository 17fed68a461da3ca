package io.buildeval.standalone.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.buildeval.core.construction.ElementLocation;
import io.buildeval.core.engine.ProjectCollection;
import io.buildeval.core.evaluation.EvaluatedProject;
import io.buildeval.core.evaluation.EvaluationSettings;
import io.buildeval.core.sdk.DefaultSdkResolverService;
import io.buildeval.core.sdk.SdkResolverRegistry;
import io.buildeval.core.spi.EvaluationListener;
import io.buildeval.core.spi.EvaluationListener.WarningEvent;
import io.buildeval.core.toolset.ToolsetRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("EvaluationJsonWriter")
class EvaluationJsonWriterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path dir;

    private EvaluatedProject evaluated;

    @BeforeEach
    void setUp() throws IOException {
        Path project = Files.writeString(dir.resolve("app.proj"), """
                <Project>
                  <PropertyGroup>
                    <Name>app</Name>
                  </PropertyGroup>
                  <ItemGroup>
                    <None Include="readme.txt" />
                  </ItemGroup>
                </Project>
                """);
        var collection = new ProjectCollection(
                ToolsetRegistry.withCurrentToolset(),
                new DefaultSdkResolverService(new SdkResolverRegistry()),
                EvaluationListener.NONE,
                EvaluationSettings.DEFAULT,
                Map.of("HOME_DIR", "/home/user"));
        evaluated = collection.loadProject(project).evaluated();
    }

    @Test
    @DisplayName("items without metadata have no metadata object")
    void itemWithoutMetadata() {
        JsonNode json = new EvaluationJsonWriter(false, true).toJson(evaluated, List.of());

        assertThat(json.at("/items/0/itemType").asText()).isEqualTo("None");
        assertThat(json.at("/items/0/include").asText()).isEqualTo("readme.txt");
        assertThat(json.at("/items/0").has("metadata")).isFalse();
        assertThat(json.get("targets")).isEmpty();
        assertThat(json.get("defaultTargets")).isEmpty();
    }

    @Test
    @DisplayName("reserved properties are written, environment properties only on request")
    void propertySelection() {
        JsonNode without = new EvaluationJsonWriter(false, true).toJson(evaluated, List.of());
        JsonNode with = new EvaluationJsonWriter(true, true).toJson(evaluated, List.of());

        assertThat(without.at("/properties/Name").asText()).isEqualTo("app");
        assertThat(without.at("/properties/MSBuildProjectFile").asText()).isEqualTo("app.proj");
        assertThat(without.get("properties").has("HOME_DIR")).isFalse();
        assertThat(with.at("/properties/HOME_DIR").asText()).isEqualTo("/home/user");
    }

    @Test
    @DisplayName("warnings omit code and location when they have none")
    void warnings() {
        var warnings = List.of(
                new WarningEvent("MSB4011", "imported twice", new ElementLocation("/work/app.proj", 3, 5)),
                new WarningEvent(null, "resolver note", null));

        JsonNode json = new EvaluationJsonWriter(false, true).toJson(evaluated, warnings);

        assertThat(json.get("warnings")).hasSize(2);
        assertThat(json.at("/warnings/0/code").asText()).isEqualTo("MSB4011");
        assertThat(json.at("/warnings/0/location").asText()).isEqualTo("/work/app.proj(3,5)");
        assertThat(json.at("/warnings/1").has("code")).isFalse();
        assertThat(json.at("/warnings/1").has("location")).isFalse();
        assertThat(json.at("/warnings/1/message").asText()).isEqualTo("resolver note");
    }

    @Test
    @DisplayName("pretty and compact renderings carry the same document")
    void prettyAndCompact() throws IOException {
        String pretty = new EvaluationJsonWriter(false, true).write(evaluated, List.of());
        String compact = new EvaluationJsonWriter(false, false).write(evaluated, List.of());

        assertThat(pretty).contains("\n");
        assertThat(compact).doesNotContain("\n");
        assertThat(MAPPER.readTree(pretty)).isEqualTo(MAPPER.readTree(compact));
    }
}
