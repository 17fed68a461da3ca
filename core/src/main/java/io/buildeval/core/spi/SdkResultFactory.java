package io.buildeval.core.spi;

import java.nio.file.Path;
import java.util.List;

/** Creates {@link SdkResult}s for the SDK currently being resolved. */
public interface SdkResultFactory {

    SdkResult indicateSuccess(Path path, String version, List<String> warnings);

    default SdkResult indicateSuccess(Path path, String version) {
        return indicateSuccess(path, version, List.of());
    }

    SdkResult indicateFailure(List<String> errors, List<String> warnings);
}
