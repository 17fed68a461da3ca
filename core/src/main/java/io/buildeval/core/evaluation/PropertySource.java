package io.buildeval.core.evaluation;

/** Where a property value came from. */
public enum PropertySource {
    /** An environment variable visible at evaluation start. */
    ENVIRONMENT,
    /** A toolset or sub-toolset property. */
    TOOLSET,
    /** A global property supplied by the caller. */
    GLOBAL,
    /**
     * A property the engine sets itself, such as
     * {@code MSBuildProjectDirectory}.
     */
    RESERVED,
    /** A {@code <PropertyGroup>} assignment in a project or import file. */
    XML
}
