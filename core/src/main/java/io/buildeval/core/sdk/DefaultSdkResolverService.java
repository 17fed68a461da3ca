package io.buildeval.core.sdk;

import io.buildeval.core.construction.ElementLocation;
import io.buildeval.core.error.SdkResolutionException;
import io.buildeval.core.spi.SdkResolver;
import io.buildeval.core.spi.SdkResolverContext;
import io.buildeval.core.spi.SdkResult;
import io.buildeval.core.spi.SdkResultFactory;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consults the resolvers of a {@link SdkResolverRegistry}: first those whose
 * name pattern matches the SDK, then those without a pattern, each group by
 * ascending priority. The first successful result wins; {@code null} results
 * are skipped.
 */
public final class DefaultSdkResolverService implements SdkResolverService {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultSdkResolverService.class);

    private final SdkResolverRegistry registry;

    public DefaultSdkResolverService(SdkResolverRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public SdkResult resolve(SdkReference sdk, SdkResolverContext context, ElementLocation location) {
        List<SdkResolver> specific = new ArrayList<>();
        List<SdkResolver> general = new ArrayList<>();
        for (SdkResolver resolver : registry.resolvers()) {
            if (resolver.namePattern().isEmpty()) {
                general.add(resolver);
            } else if (resolver.namePattern().get().matcher(sdk.name()).matches()) {
                specific.add(resolver);
            }
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        SdkResult result = tryResolvers(specific, sdk, context, location, errors, warnings);
        if (result == null) {
            result = tryResolvers(general, sdk, context, location, errors, warnings);
        }
        if (result != null) {
            return result;
        }
        if (errors.isEmpty()) {
            errors.add("No SDK resolver could resolve the SDK \"" + sdk + "\".");
        }
        LOG.debug("SDK not resolved: sdk={}, errors={}", sdk, errors);
        return SdkResult.failure(sdk, errors, warnings);
    }

    private static SdkResult tryResolvers(
            List<SdkResolver> resolvers,
            SdkReference sdk,
            SdkResolverContext context,
            ElementLocation location,
            List<String> errors,
            List<String> warnings) {
        for (SdkResolver resolver : resolvers) {
            SdkResult result;
            try {
                result = resolver.resolve(sdk, context, new Factory(sdk));
            } catch (RuntimeException e) {
                throw new SdkResolutionException(
                        "The SDK resolver \"" + resolver.name() + "\" failed while attempting to resolve the SDK \""
                                + sdk + "\": " + e.getMessage(),
                        e,
                        RESOLVER_FAILED_CODE,
                        location);
            }
            if (result == null) {
                continue;
            }
            if (result.isSuccess()) {
                LOG.debug("SDK resolved: sdk={}, resolver={}, path={}", sdk, resolver.name(), result.path());
                if (warnings.isEmpty()) {
                    return result;
                }
                List<String> all = new ArrayList<>(warnings);
                all.addAll(result.warnings());
                return SdkResult.success(sdk, result.path(), result.version(), all);
            }
            errors.addAll(result.errors());
            warnings.addAll(result.warnings());
        }
        return null;
    }

    /** Factory bound to the reference being resolved. */
    private static final class Factory implements SdkResultFactory {

        private final SdkReference sdk;

        Factory(SdkReference sdk) {
            this.sdk = sdk;
        }

        @Override
        public SdkResult indicateSuccess(Path path, String version, List<String> warnings) {
            return SdkResult.success(sdk, path, version, warnings);
        }

        @Override
        public SdkResult indicateFailure(List<String> errors, List<String> warnings) {
            return SdkResult.failure(sdk, errors, warnings);
        }
    }
}
