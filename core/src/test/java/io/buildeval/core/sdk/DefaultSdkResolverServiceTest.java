package io.buildeval.core.sdk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.buildeval.core.construction.ElementLocation;
import io.buildeval.core.error.SdkResolutionException;
import io.buildeval.core.spi.SdkResolver;
import io.buildeval.core.spi.SdkResolverContext;
import io.buildeval.core.spi.SdkResult;
import io.buildeval.core.spi.SdkResultFactory;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("DefaultSdkResolverService")
class DefaultSdkResolverServiceTest {

    private static final SdkReference SDK = new SdkReference("My.Sdk", null, null);
    private static final SdkResolverContext CONTEXT = new SdkResolverContext(
            Path.of("/work/app.proj"), Path.of("/work/app.proj"), "Current", false);
    private static final ElementLocation LOCATION = new ElementLocation("/work/app.proj", 1, 1);

    private final SdkResolverRegistry registry = new SdkResolverRegistry();
    private DefaultSdkResolverService service;

    @BeforeEach
    void setUp() {
        service = new DefaultSdkResolverService(registry);
    }

    private SdkResolver resolver(String name, int priority, Pattern pattern) {
        SdkResolver resolver = mock(SdkResolver.class);
        when(resolver.name()).thenReturn(name);
        when(resolver.priority()).thenReturn(priority);
        when(resolver.namePattern()).thenReturn(Optional.ofNullable(pattern));
        registry.register(resolver);
        return resolver;
    }

    private static void succeeds(SdkResolver resolver, String path) {
        when(resolver.resolve(any(), any(), any())).thenAnswer(invocation -> invocation
                .<SdkResultFactory>getArgument(2)
                .indicateSuccess(Path.of(path), "1.0"));
    }

    private static void fails(SdkResolver resolver, String error, String warning) {
        when(resolver.resolve(any(), any(), any())).thenAnswer(invocation -> invocation
                .<SdkResultFactory>getArgument(2)
                .indicateFailure(List.of(error), List.of(warning)));
    }

    @Test
    @DisplayName("resolvers are consulted by priority until one succeeds")
    void priorityOrder() {
        SdkResolver low = resolver("low", 10, null);
        SdkResolver high = resolver("high", 20, null);
        fails(low, "not here", "low warning");
        succeeds(high, "/sdks/high");

        SdkResult result = service.resolve(SDK, CONTEXT, LOCATION);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.path()).isEqualTo(Path.of("/sdks/high"));
        assertThat(result.sdkReference()).isEqualTo(SDK);
        assertThat(result.warnings()).containsExactly("low warning");
    }

    @Test
    @DisplayName("resolvers with a matching name pattern go before general ones")
    void specificResolversFirst() {
        SdkResolver general = resolver("general", 1, null);
        SdkResolver specific = resolver("specific", 100, Pattern.compile("My\\..*"));
        SdkResolver other = resolver("other", 2, Pattern.compile("Other\\..*"));
        succeeds(general, "/sdks/general");
        succeeds(specific, "/sdks/specific");

        SdkResult result = service.resolve(SDK, CONTEXT, LOCATION);

        assertThat(result.path()).isEqualTo(Path.of("/sdks/specific"));
        verify(general, never()).resolve(any(), any(), any());
        verify(other, never()).resolve(any(), any(), any());
    }

    @Test
    @DisplayName("a null result means the resolver does not handle the SDK")
    void nullResultSkipped() {
        SdkResolver silent = resolver("silent", 1, null);
        SdkResolver next = resolver("next", 2, null);
        when(silent.resolve(any(), any(), any())).thenReturn(null);
        succeeds(next, "/sdks/next");

        assertThat(service.resolve(SDK, CONTEXT, LOCATION).path()).isEqualTo(Path.of("/sdks/next"));
    }

    @Test
    @DisplayName("when every resolver fails their errors are collected")
    void allFail() {
        fails(resolver("a", 1, null), "error a", "warning a");
        fails(resolver("b", 2, null), "error b", "warning b");

        SdkResult result = service.resolve(SDK, CONTEXT, LOCATION);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errors()).containsExactly("error a", "error b");
        assertThat(result.warnings()).containsExactly("warning a", "warning b");
    }

    @Test
    @DisplayName("without resolvers the failure names the SDK")
    void noResolvers() {
        SdkResult result = service.resolve(SDK, CONTEXT, LOCATION);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errors()).singleElement().asString().contains("My.Sdk");
    }

    @Test
    @DisplayName("a resolver that throws fails the resolution")
    void resolverThrows() {
        SdkResolver broken = resolver("broken", 1, null);
        when(broken.resolve(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> service.resolve(SDK, CONTEXT, LOCATION))
                .isInstanceOfSatisfying(SdkResolutionException.class, e -> {
                    assertThat(e.errorCode()).isEqualTo(SdkResolverService.RESOLVER_FAILED_CODE);
                    assertThat(e.getMessage()).contains("broken").contains("boom");
                    assertThat(e.location()).isEqualTo(LOCATION);
                    assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
                });
    }
}
