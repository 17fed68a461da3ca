package io.buildeval.core.sdk;

import static org.assertj.core.api.Assertions.assertThat;

import io.buildeval.core.spi.SdkResolverContext;
import io.buildeval.core.spi.SdkResult;
import io.buildeval.core.spi.SdkResultFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DirectorySdkResolver")
class DirectorySdkResolverTest {

    @TempDir
    Path dir;

    private Path first;
    private Path second;
    private DirectorySdkResolver resolver;

    private final SdkResolverContext context = new SdkResolverContext(null, null, "Current", false);

    /** Builds results the way the resolver service does. */
    private static SdkResultFactory factory(SdkReference sdk) {
        return new SdkResultFactory() {
            @Override
            public SdkResult indicateSuccess(Path path, String version, List<String> warnings) {
                return SdkResult.success(sdk, path, version, warnings);
            }

            @Override
            public SdkResult indicateFailure(List<String> errors, List<String> warnings) {
                return SdkResult.failure(sdk, errors, warnings);
            }
        };
    }

    private SdkResult resolve(SdkReference sdk) {
        return resolver.resolve(sdk, context, factory(sdk));
    }

    @BeforeEach
    void setUp() throws IOException {
        first = Files.createDirectories(dir.resolve("first"));
        second = Files.createDirectories(dir.resolve("second"));
        Files.createDirectories(second.resolve("Web.Sdk/Sdk"));
        Files.createDirectories(second.resolve("Web.Sdk/2.0/Sdk"));
        Files.createDirectories(first.resolve("Lib.Sdk/Sdk"));
        resolver = new DirectorySdkResolver(List.of(first, second));
    }

    @Test
    @DisplayName("finds an unversioned SDK in any root")
    void unversioned() {
        SdkResult result = resolve(new SdkReference("Web.Sdk", null, null));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.path()).isEqualTo(second.resolve("Web.Sdk/Sdk").toAbsolutePath().normalize());
        assertThat(result.version()).isNull();
    }

    @Test
    @DisplayName("prefers a versioned directory when the version is requested")
    void versioned() {
        SdkResult result = resolve(new SdkReference("Web.Sdk", "2.0", null));

        assertThat(result.path()).endsWithRaw(Path.of("Web.Sdk", "2.0", "Sdk"));
        assertThat(result.version()).isEqualTo("2.0");
    }

    @Test
    @DisplayName("falls back to the unversioned directory for an unknown version")
    void unknownVersionFallsBack() {
        SdkResult result = resolve(new SdkReference("Web.Sdk", "3.0", null));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.path()).endsWithRaw(Path.of("Web.Sdk", "Sdk"));
    }

    @Test
    @DisplayName("reports the roots it searched when the SDK is missing")
    void missing() {
        SdkResult result = resolve(new SdkReference("Missing.Sdk", null, null));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.path()).isNull();
        assertThat(result.errors()).singleElement().asString()
                .contains("Missing.Sdk")
                .contains(first.toString());
    }

    @Test
    @DisplayName("has a stable name and priority")
    void identity() {
        assertThat(resolver.name()).isEqualTo(DirectorySdkResolver.NAME);
        assertThat(resolver.priority()).isEqualTo(DirectorySdkResolver.PRIORITY);
        assertThat(resolver.roots()).containsExactly(first, second);
        assertThat(resolver.namePattern()).isEmpty();
    }
}
