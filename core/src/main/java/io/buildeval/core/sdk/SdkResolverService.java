package io.buildeval.core.sdk;

import io.buildeval.core.construction.ElementLocation;
import io.buildeval.core.spi.SdkResolverContext;
import io.buildeval.core.spi.SdkResult;

/** Resolves SDK references for the import resolver. */
public interface SdkResolverService {

    /** Error code for a resolver that threw. */
    String RESOLVER_FAILED_CODE = "MSB4242";

    /**
     * Resolves an SDK by consulting resolvers in order.
     *
     * @param location location of the reference, used in errors
     * @return a success, or a failure carrying the errors of every resolver
     *     consulted
     * @throws io.buildeval.core.error.SdkResolutionException when a resolver
     *     throws
     */
    SdkResult resolve(SdkReference sdk, SdkResolverContext context, ElementLocation location);
}
