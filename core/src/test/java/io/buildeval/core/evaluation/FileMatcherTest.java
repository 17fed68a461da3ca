package io.buildeval.core.evaluation;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FileMatcher")
class FileMatcherTest {

    @TempDir
    Path dir;

    @BeforeEach
    void createTree() throws IOException {
        for (String file : new String[] {"a.cs", "b.cs", "readme.md", "src/c.cs", "src/deep/d.cs", "src/deep/e.txt"}) {
            Path path = dir.resolve(file);
            Files.createDirectories(path.getParent());
            Files.writeString(path, "");
        }
    }

    private static List<String> paths(List<FileMatcher.Match> matches) {
        return matches.stream().map(FileMatcher.Match::path).toList();
    }

    @Test
    @DisplayName("a single star stays within one directory")
    void singleStar() {
        assertThat(paths(FileMatcher.match(dir, "*.cs"))).containsExactly("a.cs", "b.cs");
    }

    @Test
    @DisplayName("a fixed prefix is kept in the result")
    void fixedPrefix() {
        assertThat(paths(FileMatcher.match(dir, "src\\*.cs"))).containsExactly("src/c.cs");
    }

    @Test
    @DisplayName("a double star recurses and records the recursive directory")
    void recursive() {
        var matches = FileMatcher.match(dir, "src/**/*.cs");

        assertThat(paths(matches)).containsExactly("src/c.cs", "src/deep/d.cs");
        assertThat(matches).extracting(FileMatcher.Match::recursiveDir).containsExactly("", "deep/");
    }

    @Test
    @DisplayName("a question mark matches exactly one character")
    void questionMark() {
        assertThat(paths(FileMatcher.match(dir, "?.cs"))).containsExactly("a.cs", "b.cs");
        assertThat(paths(FileMatcher.match(dir, "??.cs"))).isEmpty();
    }

    @Test
    @DisplayName("a missing search directory matches nothing")
    void missingDirectory() {
        assertThat(FileMatcher.match(dir, "nope/*.cs")).isEmpty();
    }

    @Test
    @DisplayName("a pattern without wildcards matches nothing")
    void noWildcards() {
        assertThat(FileMatcher.match(dir, "a.cs")).isEmpty();
        assertThat(FileMatcher.hasWildcards("a.cs")).isFalse();
        assertThat(FileMatcher.hasWildcards("**")).isTrue();
    }
}
