package io.buildeval.core.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.buildeval.core.construction.ProjectRootElement;
import io.buildeval.core.construction.ProjectXmlParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ProjectRootElementCache")
class ProjectRootElementCacheTest {

    @TempDir
    Path dir;

    private final ProjectXmlParser parser = new ProjectXmlParser();
    private final AtomicInteger loads = new AtomicInteger();
    private Path a;
    private Path b;

    @BeforeEach
    void setUp() throws IOException {
        a = Files.writeString(dir.resolve("a.proj"), "<Project />");
        b = Files.writeString(dir.resolve("b.props"), "<Project />");
    }

    private ProjectRootElementCache cache(boolean autoReload, int capacity) {
        return new ProjectRootElementCache(path -> {
            loads.incrementAndGet();
            return parser.parse(path);
        }, autoReload, capacity);
    }

    @Test
    @DisplayName("a file is parsed once and the same tree is returned afterwards")
    void parsesOnce() {
        var cache = cache(false, 10);

        ProjectRootElement first = cache.get(a, true);
        ProjectRootElement second = cache.get(dir.resolve("./a.proj"), false);

        assertThat(second).isSameAs(first);
        assertThat(loads).hasValue(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("tryGet never loads")
    void tryGetDoesNotLoad() {
        var cache = cache(false, 10);

        assertThat(cache.tryGet(a)).isEmpty();
        cache.get(a, true);

        assertThat(cache.tryGet(a)).isPresent();
        assertThat(loads).hasValue(1);
    }

    @Test
    @DisplayName("with auto-reload a file changed on disk is parsed again")
    void autoReload() throws IOException {
        var cache = cache(true, 10);
        ProjectRootElement first = cache.get(a, true);

        FileTime before = Files.getLastModifiedTime(a);
        Files.writeString(a, "<Project DefaultTargets=\"Build\" />");
        Files.setLastModifiedTime(a, FileTime.fromMillis(before.toMillis() + 5_000));

        ProjectRootElement second = cache.get(a, true);

        assertThat(second).isNotSameAs(first);
        assertThat(second.defaultTargets()).isEqualTo("Build");
        assertThat(loads).hasValue(2);
    }

    @Test
    @DisplayName("without auto-reload a changed file keeps its cached tree")
    void noAutoReload() throws IOException {
        var cache = cache(false, 10);
        ProjectRootElement first = cache.get(a, true);

        Files.setLastModifiedTime(a, FileTime.fromMillis(Files.getLastModifiedTime(a).toMillis() + 5_000));

        assertThat(cache.get(a, true)).isSameAs(first);
        assertThat(cache.isAutoReload()).isFalse();
    }

    @Test
    @DisplayName("only the most recently used entries stay hot")
    void capacityBoundsHotEntries() {
        var cache = cache(false, 1);

        ProjectRootElement keepA = cache.get(a, true);
        ProjectRootElement keepB = cache.get(b, false);

        assertThat(cache.isHot(b)).isTrue();
        assertThat(cache.isHot(a)).isFalse();
        assertThat(cache.get(a, true)).isSameAs(keepA);
        assertThat(cache.isHot(a)).isTrue();
        assertThat(keepB).isNotNull();
    }

    @Test
    @DisplayName("evicting hot entries keeps referenced trees available")
    void evictHotEntries() {
        var cache = cache(false, 10);
        ProjectRootElement kept = cache.get(a, true);

        cache.evictHotEntries();

        assertThat(cache.isHot(a)).isFalse();
        assertThat(cache.tryGet(a)).containsSame(kept);
    }

    @Test
    @DisplayName("discarding implicit references forgets files only reached as imports")
    void discardImplicitReferences() {
        var cache = cache(false, 10);
        ProjectRootElement keepA = cache.get(a, true);
        ProjectRootElement keepB = cache.get(b, false);

        cache.discardImplicitReferences();

        assertThat(cache.tryGet(a)).containsSame(keepA);
        assertThat(cache.tryGet(b)).isEmpty();
        assertThat(keepB).isNotNull();
    }

    @Test
    @DisplayName("clear removes every entry")
    void clear() {
        var cache = cache(false, 10);
        ProjectRootElement kept = cache.get(a, true);

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(cache.get(a, true)).isNotSameAs(kept);
    }

    @Test
    @DisplayName("addEntry publishes a tree without parsing")
    void addEntry() {
        var cache = cache(false, 10);
        ProjectRootElement tree = parser.parse(a);

        cache.addEntry(tree);

        assertThat(cache.get(a, true)).isSameAs(tree);
        assertThat(loads).hasValue(0);
    }

    @Test
    @DisplayName("an in-memory tree is found under any spelling of its path")
    void addEntryInMemory() {
        var cache = cache(true, 10);
        ProjectRootElement tree = parser.parse("<Project />", dir.resolve("mem.proj"));

        cache.addEntry(tree);

        assertThat(cache.get(dir.resolve("sub/../mem.proj"), true)).isSameAs(tree);
        assertThat(loads).hasValue(0);
    }

    @Test
    @DisplayName("per-path load locks are released once the load completes")
    void loadLocksReleased() {
        var cache = cache(false, 10);

        cache.get(a, true);
        cache.get(b, false);

        assertThat(cache.loadLockCount()).isZero();
    }

    @Test
    @DisplayName("a negative capacity is rejected")
    void negativeCapacity() {
        assertThatThrownBy(() -> cache(false, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1");
    }

    @Test
    @DisplayName("concurrent lookups of one file parse it once")
    void concurrentLookups() throws Exception {
        var cache = cache(false, 10);
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<ProjectRootElement>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return cache.get(a, true);
                }));
            }
            start.countDown();
            ProjectRootElement first = futures.get(0).get(30, TimeUnit.SECONDS);
            for (Future<ProjectRootElement> future : futures) {
                assertThat(future.get(30, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(loads).hasValue(1);
    }
}
