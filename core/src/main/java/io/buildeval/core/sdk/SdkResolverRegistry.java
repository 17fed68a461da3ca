package io.buildeval.core.sdk;

import io.buildeval.core.spi.SdkResolver;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for SDK resolvers, keyed by resolver name. Thread-safe; registration
 * and lookup can happen concurrently.
 */
public final class SdkResolverRegistry {

    private final Map<String, SdkResolver> resolvers = new ConcurrentHashMap<>();

    /**
     * Registers a resolver. A resolver with the same name is replaced.
     *
     * @throws NullPointerException if resolver is null
     * @throws IllegalArgumentException if resolver.name() is null or empty
     */
    public void register(SdkResolver resolver) {
        if (resolver == null) {
            throw new NullPointerException("resolver must not be null");
        }
        String name = resolver.name();
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("resolver name must not be null or empty");
        }
        resolvers.put(name, resolver);
    }

    public Optional<SdkResolver> getResolver(String name) {
        return Optional.ofNullable(resolvers.get(name));
    }

    /**
     * @throws IllegalArgumentException if no resolver is registered with the
     *     given name
     */
    public SdkResolver requireResolver(String name) {
        return getResolver(name)
                .orElseThrow(() -> new IllegalArgumentException("No SDK resolver registered for name: '" + name + "'"));
    }

    /** Registered resolvers by ascending priority, ties broken by name. */
    public List<SdkResolver> resolvers() {
        List<SdkResolver> sorted = new ArrayList<>(resolvers.values());
        sorted.sort(Comparator.comparingInt(SdkResolver::priority).thenComparing(SdkResolver::name));
        return sorted;
    }

    public int size() {
        return resolvers.size();
    }

    public boolean hasResolver(String name) {
        return resolvers.containsKey(name);
    }
}
