package io.buildeval.core.evaluation;

import io.buildeval.core.construction.ProjectRootElement;
import java.io.File;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Values of the {@code MSBuildThisFile*} properties. They describe the file an
 * element is physically written in, so they are computed on lookup instead of
 * being stored.
 */
final class ThisFileProperties {

    private ThisFileProperties() {
        // utility class
    }

    /**
     * Escaped value of {@code name} for {@code file}, or {@code null} when it
     * is not a this-file property.
     */
    static String valueEscaped(String name, ProjectRootElement file) {
        if (file == null || !name.regionMatches(true, 0, "MSBuildThisFile", 0, 15)) {
            return null;
        }
        String fileName = file.fileName();
        String value;
        switch (name.toLowerCase(Locale.ROOT)) {
            case "msbuildthisfile":
                value = fileName;
                break;
            case "msbuildthisfiledirectory":
                value = withTrailingSlash(file.directory().toString());
                break;
            case "msbuildthisfiledirectorynoroot":
                value = withTrailingSlash(withoutRoot(file.directory()));
                break;
            case "msbuildthisfileextension":
                value = WellKnownMetadata.extension(fileName);
                break;
            case "msbuildthisfilefullpath":
                value = file.fullPath().toString();
                break;
            case "msbuildthisfilename":
                value = WellKnownMetadata.fileNameWithoutExtension(fileName);
                break;
            default:
                return null;
        }
        return EscapingUtilities.escape(value);
    }

    /**
     * Directory path without its root and without leading or trailing
     * separators.
     */
    static String withoutRoot(Path directory) {
        Path root = directory.getRoot();
        String text = root == null ? directory.toString() : root.relativize(directory).toString();
        while (text.endsWith("/") || text.endsWith("\\")) {
            text = text.substring(0, text.length() - 1);
        }
        return text;
    }

    static String withTrailingSlash(String path) {
        if (path.isEmpty() || path.endsWith("/") || path.endsWith("\\")) {
            return path;
        }
        return path + File.separator;
    }
}
