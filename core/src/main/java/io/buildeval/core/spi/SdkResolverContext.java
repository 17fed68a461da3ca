package io.buildeval.core.spi;

import java.nio.file.Path;

/**
 * Information passed to {@link SdkResolver}s about the project that references
 * an SDK.
 *
 * @param projectFile full path of the main project
 * @param importingFile full path of the file containing the SDK reference
 * @param toolsVersion version of the toolset evaluating the project
 * @param interactive whether a resolver may prompt the user
 */
public record SdkResolverContext(Path projectFile, Path importingFile, String toolsVersion, boolean interactive) {}
