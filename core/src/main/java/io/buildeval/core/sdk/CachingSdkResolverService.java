package io.buildeval.core.sdk;

import io.buildeval.core.construction.ElementLocation;
import io.buildeval.core.spi.SdkResolverContext;
import io.buildeval.core.spi.SdkResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remembers the first result per SDK name (case-insensitive). A later request
 * for a different version of the same SDK is answered from the cache with a
 * warning.
 */
public final class CachingSdkResolverService implements SdkResolverService {

    /** Warning code for references to several versions of one SDK. */
    public static final String MULTIPLE_VERSIONS_CODE = "MSB4240";

    private static final Logger LOG = LoggerFactory.getLogger(CachingSdkResolverService.class);

    private final SdkResolverService delegate;
    private final Map<String, SdkResult> cache = new ConcurrentHashMap<>();

    public CachingSdkResolverService(SdkResolverService delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public SdkResult resolve(SdkReference sdk, SdkResolverContext context, ElementLocation location) {
        SdkResult cached = cache.computeIfAbsent(
                sdk.name().toLowerCase(Locale.ROOT), k -> delegate.resolve(sdk, context, location));
        SdkReference first = cached.sdkReference();
        if (cached.isSuccess() && !Objects.equals(first.version(), sdk.version()) && !sdk.isSameVersion(cached.version())) {
            String warning = "The SDK \"" + sdk + "\" was already resolved as \"" + first + "\" at " + cached.path()
                    + "; that result is used.";
            LOG.warn("SDK version conflict: requested={}, cached={}", sdk, first);
            List<String> warnings = new ArrayList<>(cached.warnings());
            warnings.add(MULTIPLE_VERSIONS_CODE + ": " + warning);
            return SdkResult.success(sdk, cached.path(), cached.version(), warnings);
        }
        return cached;
    }

    /** Drops every cached result. */
    public void clear() {
        cache.clear();
    }

    public int size() {
        return cache.size();
    }
}
