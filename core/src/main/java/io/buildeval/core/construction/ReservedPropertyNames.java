package io.buildeval.core.construction;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Names of properties the engine sets itself; project files may not assign
 * them.
 */
public final class ReservedPropertyNames {

    public static final String PROJECT_DIRECTORY = "MSBuildProjectDirectory";
    public static final String PROJECT_DIRECTORY_NO_ROOT = "MSBuildProjectDirectoryNoRoot";
    public static final String PROJECT_FILE = "MSBuildProjectFile";
    public static final String PROJECT_EXTENSION = "MSBuildProjectExtension";
    public static final String PROJECT_FULL_PATH = "MSBuildProjectFullPath";
    public static final String PROJECT_NAME = "MSBuildProjectName";
    public static final String PROJECT_DEFAULT_TARGETS = "MSBuildProjectDefaultTargets";
    public static final String THIS_FILE = "MSBuildThisFile";
    public static final String THIS_FILE_DIRECTORY = "MSBuildThisFileDirectory";
    public static final String THIS_FILE_DIRECTORY_NO_ROOT = "MSBuildThisFileDirectoryNoRoot";
    public static final String THIS_FILE_EXTENSION = "MSBuildThisFileExtension";
    public static final String THIS_FILE_FULL_PATH = "MSBuildThisFileFullPath";
    public static final String THIS_FILE_NAME = "MSBuildThisFileName";
    public static final String TOOLS_VERSION = "MSBuildToolsVersion";
    public static final String TOOLS_PATH = "MSBuildToolsPath";
    public static final String BIN_PATH = "MSBuildBinPath";

    private static final Set<String> RESERVED = Set.of(
            PROJECT_DIRECTORY,
            PROJECT_DIRECTORY_NO_ROOT,
            PROJECT_FILE,
            PROJECT_EXTENSION,
            PROJECT_FULL_PATH,
            PROJECT_NAME,
            PROJECT_DEFAULT_TARGETS,
            THIS_FILE,
            THIS_FILE_DIRECTORY,
            THIS_FILE_DIRECTORY_NO_ROOT,
            THIS_FILE_EXTENSION,
            THIS_FILE_FULL_PATH,
            THIS_FILE_NAME,
            TOOLS_VERSION,
            TOOLS_PATH,
            BIN_PATH)
            .stream()
            .map(n -> n.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());

    private ReservedPropertyNames() {
        // utility class
    }

    public static boolean isReserved(String name) {
        return RESERVED.contains(name.toLowerCase(Locale.ROOT));
    }
}
