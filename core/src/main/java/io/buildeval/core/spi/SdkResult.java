package io.buildeval.core.spi;

import io.buildeval.core.sdk.SdkReference;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/** Outcome of resolving one SDK reference. */
public final class SdkResult {

    private final SdkReference sdkReference;
    private final boolean success;
    private final Path path;
    private final String version;
    private final List<String> errors;
    private final List<String> warnings;

    private SdkResult(
            SdkReference sdkReference,
            boolean success,
            Path path,
            String version,
            List<String> errors,
            List<String> warnings) {
        this.sdkReference = Objects.requireNonNull(sdkReference, "sdkReference must not be null");
        this.success = success;
        this.path = path;
        this.version = version;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static SdkResult success(SdkReference sdk, Path path, String version, List<String> warnings) {
        Objects.requireNonNull(path, "path must not be null");
        return new SdkResult(sdk, true, path, version, List.of(), warnings);
    }

    public static SdkResult failure(SdkReference sdk, List<String> errors, List<String> warnings) {
        return new SdkResult(sdk, false, null, null, errors, warnings);
    }

    public SdkReference sdkReference() {
        return sdkReference;
    }

    public boolean isSuccess() {
        return success;
    }

    /** Root directory of the SDK; {@code null} on failure. */
    public Path path() {
        return path;
    }

    /**
     * Resolved version, or {@code null} when the resolver did not report one.
     */
    public String version() {
        return version;
    }

    public List<String> errors() {
        return errors;
    }

    public List<String> warnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return success
                ? "SdkResult[" + sdkReference + " -> " + path + (version != null ? " (" + version + ")" : "") + "]"
                : "SdkResult[" + sdkReference + " failed: " + errors + "]";
    }
}
