package io.buildeval.core.evaluation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Metadata every item carries implicitly, derived from its include and its
 * defining project. Values are computed on demand and never stored.
 */
public final class WellKnownMetadata {

    public static final String IDENTITY = "Identity";
    public static final String FULL_PATH = "FullPath";
    public static final String ROOT_DIR = "RootDir";
    public static final String FILENAME = "Filename";
    public static final String EXTENSION = "Extension";
    public static final String RELATIVE_DIR = "RelativeDir";
    public static final String DIRECTORY = "Directory";
    public static final String RECURSIVE_DIR = "RecursiveDir";
    public static final String MODIFIED_TIME = "ModifiedTime";
    public static final String CREATED_TIME = "CreatedTime";
    public static final String ACCESSED_TIME = "AccessedTime";
    public static final String DEFINING_PROJECT_FULL_PATH = "DefiningProjectFullPath";
    public static final String DEFINING_PROJECT_DIRECTORY = "DefiningProjectDirectory";
    public static final String DEFINING_PROJECT_NAME = "DefiningProjectName";
    public static final String DEFINING_PROJECT_EXTENSION = "DefiningProjectExtension";

    public static final List<String> NAMES = List.of(
            IDENTITY,
            FULL_PATH,
            ROOT_DIR,
            FILENAME,
            EXTENSION,
            RELATIVE_DIR,
            DIRECTORY,
            RECURSIVE_DIR,
            MODIFIED_TIME,
            CREATED_TIME,
            ACCESSED_TIME,
            DEFINING_PROJECT_FULL_PATH,
            DEFINING_PROJECT_DIRECTORY,
            DEFINING_PROJECT_NAME,
            DEFINING_PROJECT_EXTENSION);

    private static final Set<String> NAME_SET = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

    static {
        NAME_SET.addAll(NAMES);
    }

    private static final DateTimeFormatter FILE_TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSSS", Locale.ROOT).withZone(ZoneId.systemDefault());

    private WellKnownMetadata() {
        // utility class
    }

    public static boolean isWellKnown(String name) {
        return name != null && NAME_SET.contains(name);
    }

    /**
     * Computes a well-known metadata value.
     *
     * @param name one of {@link #NAMES}, any casing
     * @param itemSpec escaped include of the item
     * @param baseDirectory directory relative includes are resolved against
     * @param definingProject full path of the file that declared the item, or
     *     {@code null}
     * @param recursiveDir the part of the path matched by {@code **}, or
     *     {@code null}
     * @return escaped value, empty when it cannot be derived
     */
    public static String compute(
            String name, String itemSpec, Path baseDirectory, Path definingProject, String recursiveDir) {
        String spec = fixSeparators(EscapingUtilities.unescape(itemSpec));
        String lower = name.toLowerCase(Locale.ROOT);
        String value;
        switch (lower) {
            case "identity":
                return itemSpec;
            case "recursivedir":
                return recursiveDir != null ? recursiveDir : "";
            case "fullpath":
                value = fullPath(spec, baseDirectory);
                break;
            case "rootdir":
                value = rootDir(fullPath(spec, baseDirectory));
                break;
            case "filename":
                value = fileNameWithoutExtension(spec);
                break;
            case "extension":
                value = extension(spec);
                break;
            case "relativedir":
                value = directoryPart(spec);
                break;
            case "directory":
                value = directoryWithoutRoot(fullPath(spec, baseDirectory));
                break;
            case "modifiedtime":
                value = fileTime(spec, baseDirectory, BasicFileAttributes::lastModifiedTime);
                break;
            case "createdtime":
                value = fileTime(spec, baseDirectory, BasicFileAttributes::creationTime);
                break;
            case "accessedtime":
                value = fileTime(spec, baseDirectory, BasicFileAttributes::lastAccessTime);
                break;
            default:
                value = definingProjectModifier(lower, definingProject);
                break;
        }
        return EscapingUtilities.escape(value);
    }

    private static String definingProjectModifier(String lower, Path definingProject) {
        if (definingProject == null) {
            return "";
        }
        String path = definingProject.toString();
        switch (lower) {
            case "definingprojectfullpath":
                return path;
            case "definingprojectdirectory":
                return rootDir(path) + directoryWithoutRoot(path);
            case "definingprojectname":
                return fileNameWithoutExtension(path);
            case "definingprojectextension":
                return extension(path);
            default:
                throw new IllegalArgumentException("Not a well-known metadata name: " + lower);
        }
    }

    static String fullPath(String spec, Path baseDirectory) {
        try {
            return baseDirectory.resolve(spec).normalize().toString();
        } catch (InvalidPathException e) {
            return spec;
        }
    }

    private static String rootDir(String fullPath) {
        Path root = Path.of(fullPath).getRoot();
        if (root == null) {
            return "";
        }
        String r = root.toString();
        return r.endsWith("/") || r.endsWith("\\") ? r : r + "/";
    }

    private static String directoryWithoutRoot(String fullPath) {
        String dir = directoryPart(fullPath);
        String root = rootDir(fullPath);
        return dir.startsWith(root) ? dir.substring(root.length()) : dir;
    }

    /** Everything up to and including the last separator, or empty. */
    static String directoryPart(String spec) {
        int slash = Math.max(spec.lastIndexOf('/'), spec.lastIndexOf('\\'));
        return slash >= 0 ? spec.substring(0, slash + 1) : "";
    }

    static String fileName(String spec) {
        int slash = Math.max(spec.lastIndexOf('/'), spec.lastIndexOf('\\'));
        return spec.substring(slash + 1);
    }

    static String fileNameWithoutExtension(String spec) {
        String file = fileName(spec);
        int dot = file.lastIndexOf('.');
        return dot >= 0 ? file.substring(0, dot) : file;
    }

    static String extension(String spec) {
        String file = fileName(spec);
        int dot = file.lastIndexOf('.');
        return dot >= 0 && dot < file.length() - 1 ? file.substring(dot) : "";
    }

    private static String fileTime(String spec, Path baseDirectory, Function<BasicFileAttributes, FileTime> pick) {
        try {
            Path file = baseDirectory.resolve(spec);
            if (!Files.isRegularFile(file)) {
                return "";
            }
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            return FILE_TIME_FORMAT.format(pick.apply(attributes).toInstant());
        } catch (IOException | InvalidPathException e) {
            return "";
        }
    }

    /**
     * Backslashes in item specs denote directory separators on every platform.
     */
    static String fixSeparators(String spec) {
        return spec.indexOf('\\') >= 0 ? spec.replace('\\', '/') : spec;
    }
}
