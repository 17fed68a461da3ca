package io.buildeval.core.sdk;

import io.buildeval.core.spi.SdkResolver;
import io.buildeval.core.spi.SdkResolverContext;
import io.buildeval.core.spi.SdkResult;
import io.buildeval.core.spi.SdkResultFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Resolves SDKs from directories laid out as {@code <root>/<Name>/Sdk}, or
 * {@code <root>/<Name>/<Version>/Sdk} when a version is requested. Roots are
 * searched in order. Registered with the lowest precedence so other resolvers
 * are consulted first.
 */
public final class DirectorySdkResolver implements SdkResolver {

    public static final String NAME = "DirectorySdkResolver";
    public static final int PRIORITY = 10_000;

    private final List<Path> roots;

    public DirectorySdkResolver(List<Path> roots) {
        this.roots = List.copyOf(roots);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    public List<Path> roots() {
        return roots;
    }

    @Override
    public SdkResult resolve(SdkReference sdk, SdkResolverContext context, SdkResultFactory factory) {
        for (Path root : roots) {
            Path sdkDir = root.resolve(sdk.name());
            if (sdk.version() != null) {
                Path versioned = sdkDir.resolve(sdk.version()).resolve("Sdk");
                if (Files.isDirectory(versioned)) {
                    return factory.indicateSuccess(versioned.toAbsolutePath().normalize(), sdk.version());
                }
            }
            Path unversioned = sdkDir.resolve("Sdk");
            if (Files.isDirectory(unversioned)) {
                return factory.indicateSuccess(unversioned.toAbsolutePath().normalize(), null);
            }
        }
        return factory.indicateFailure(
                List.of("The SDK \"" + sdk + "\" was not found under " + roots + "."), List.of());
    }
}
