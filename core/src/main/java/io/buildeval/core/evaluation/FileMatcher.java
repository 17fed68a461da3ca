package io.buildeval.core.evaluation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Expands file specifications containing {@code *}, {@code ?} and {@code **}
 * against the file system.
 *
 * <p>
 * The leading segments without wildcards name the directory the search starts
 * from; a missing directory yields no matches. Results keep the form the
 * pattern was written in (relative patterns give relative paths, always with
 * {@code /} separators) and are sorted lexicographically.
 */
public final class FileMatcher {

    /**
     * A matched file and the part of its directory matched by wildcard
     * segments.
     */
    public record Match(String path, String recursiveDir) {}

    private FileMatcher() {
        // utility class
    }

    public static boolean hasWildcards(String fileSpec) {
        return fileSpec.indexOf('*') >= 0 || fileSpec.indexOf('?') >= 0;
    }

    /**
     * Lists files matching {@code fileSpec}.
     *
     * @param baseDirectory directory relative patterns are resolved against
     * @param fileSpec unescaped pattern; {@code \} is accepted as a separator
     * @throws UncheckedIOException when a directory cannot be listed
     */
    public static List<Match> match(Path baseDirectory, String fileSpec) {
        String spec = fileSpec.replace('\\', '/');
        String[] segments = spec.split("/", -1);
        int firstWild = 0;
        while (firstWild < segments.length && !hasWildcards(segments[firstWild])) {
            firstWild++;
        }
        if (firstWild == segments.length) {
            return List.of();
        }
        String fixedPrefix = firstWild == 0 ? "" : String.join("/", List.of(segments).subList(0, firstWild)) + "/";
        String wildPart = String.join("/", List.of(segments).subList(firstWild, segments.length));

        Path searchRoot;
        try {
            searchRoot = fixedPrefix.isEmpty() ? baseDirectory : baseDirectory.resolve(fixedPrefix).normalize();
        } catch (InvalidPathException e) {
            return List.of();
        }
        if (!Files.isDirectory(searchRoot)) {
            return List.of();
        }

        Pattern pattern = toRegex(wildPart);
        boolean recursive = wildPart.contains("**");
        int depth = recursive ? Integer.MAX_VALUE : segments.length - firstWild;
        List<Match> result = new ArrayList<>();
        try (Stream<Path> files = Files.walk(searchRoot, depth)) {
            files.filter(Files::isRegularFile).forEach(file -> {
                String relative = searchRoot.relativize(file).toString().replace('\\', '/');
                Matcher m = pattern.matcher(relative);
                if (m.matches()) {
                    int slash = relative.lastIndexOf('/');
                    String recursiveDir = slash >= 0 ? relative.substring(0, slash + 1) : "";
                    result.add(new Match(fixedPrefix + relative, recursiveDir));
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to enumerate files for '" + fileSpec + "'", e);
        }
        result.sort((a, b) -> a.path().compareTo(b.path()));
        return result;
    }

    /**
     * Translates the wildcard part of a pattern into a regular expression over
     * {@code /} paths.
     */
    static Pattern toRegex(String wildPart) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < wildPart.length()) {
            char c = wildPart.charAt(i);
            if (c == '*' && i + 1 < wildPart.length() && wildPart.charAt(i + 1) == '*') {
                boolean slashFollows = i + 2 < wildPart.length() && wildPart.charAt(i + 2) == '/';
                if (slashFollows) {
                    sb.append("(?:.*/)?");
                    i += 3;
                } else {
                    sb.append(".*");
                    i += 2;
                }
                continue;
            }
            if (c == '*') {
                sb.append("[^/]*");
            } else if (c == '?') {
                sb.append("[^/]");
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return Pattern.compile(sb.toString());
    }
}
