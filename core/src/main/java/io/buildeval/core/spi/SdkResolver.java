package io.buildeval.core.spi;

import io.buildeval.core.sdk.SdkReference;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * SPI for locating SDKs referenced by projects.
 *
 * <p>
 * Resolvers are consulted in ascending {@link #priority()} order. Resolvers
 * that declare a {@link #namePattern()} are only asked about matching SDK names
 * and are tried before resolvers without one.
 *
 * <p>
 * Implementations must be thread-safe.
 */
public interface SdkResolver {

    /** Unique resolver name (e.g. "DirectorySdkResolver"). */
    String name();

    /** Lower values are consulted first. */
    int priority();

    /** SDK names this resolver handles; empty when it handles any name. */
    default Optional<Pattern> namePattern() {
        return Optional.empty();
    }

    /**
     * Resolves an SDK.
     *
     * @param sdk the requested SDK
     * @param context information about the referencing project
     * @param factory creates the result
     * @return a success or failure result, or {@code null} when this resolver
     *     does not handle the SDK
     */
    SdkResult resolve(SdkReference sdk, SdkResolverContext context, SdkResultFactory factory);
}
