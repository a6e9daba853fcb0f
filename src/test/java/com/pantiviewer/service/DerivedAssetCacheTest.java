package com.pantiviewer.service;

import com.pantiviewer.model.AssetKind;
import com.pantiviewer.model.AssetLookup;
import com.pantiviewer.model.AssetSource;
import com.pantiviewer.model.Visibility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link DerivedAssetCache} with the renderer mocked.
 */
@ExtendWith(MockitoExtension.class)
class DerivedAssetCacheTest {

    private static final String CHECKSUM = "c0ffee";
    private static final byte[] JPEG_BYTES = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xD9};

    @TempDir
    Path tempDir;

    @Mock
    private AssetRenderer renderer;

    @Mock
    private ChangeNotifier notifier;

    private Path original;
    private DerivedAssetCache cache;

    @BeforeEach
    void setUp() throws Exception {
        original = Files.write(tempDir.resolve("original.png"), new byte[]{1});
        AssetSourceResolver resolver = checksum -> CHECKSUM.equals(checksum)
                ? Optional.of(new AssetSource(checksum, original, false, Visibility.PUBLIC))
                : Optional.empty();
        cache = new DerivedAssetCache(tempDir.resolve("cache"), renderer, resolver, notifier,
                Executors.newFixedThreadPool(2));
    }

    @AfterEach
    void tearDown() {
        cache.stopService();
    }

    @Test
    void testGetOrBuild_PublishedFile_ShouldBeReady() throws Exception {
        Path target = cache.pathFor(CHECKSUM, AssetKind.THUMBNAIL);
        Files.createDirectories(target.getParent());
        Files.write(target, JPEG_BYTES);

        AssetLookup lookup = cache.getOrBuild(CHECKSUM, AssetKind.THUMBNAIL, 400);

        assertTrue(lookup.isReady());
        assertEquals(target, lookup.getPath());
        verifyNoInteractions(renderer);
    }

    @Test
    void testPathFor_ShouldFollowNamingScheme() {
        assertEquals(tempDir.resolve("cache/thumbnails/" + CHECKSUM + "_thumb.jpg").toAbsolutePath().normalize(),
                cache.pathFor(CHECKSUM, AssetKind.THUMBNAIL));
        assertEquals(tempDir.resolve("cache/previews/" + CHECKSUM + "_preview.jpg").toAbsolutePath().normalize(),
                cache.pathFor(CHECKSUM, AssetKind.PREVIEW));
    }

    @Test
    void testGetOrBuild_NoReadableOriginal_ShouldBeUnavailable() {
        AssetLookup lookup = cache.getOrBuild("unknown", AssetKind.PREVIEW, 1024);

        assertEquals(AssetLookup.Status.UNAVAILABLE, lookup.getStatus());
        verifyNoInteractions(renderer);
    }

    /**
     * Verifies that misses for one key arriving from many threads at once trigger a single
     * build, and that every caller then gets the published file.
     */
    @Test
    void testGetOrBuild_ConcurrentMisses_ShouldBuildOnce() throws Exception {
        // 1. Arrange
        int callers = 16;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch firstCallsDone = new CountDownLatch(callers);
        CountDownLatch published = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Queue<AssetLookup.Status> firstStatuses = new ConcurrentLinkedQueue<>();
        when(renderer.render(original, false, 400)).thenAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            return JPEG_BYTES;
        });
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        List<Future<AssetLookup>> secondLookups = new ArrayList<>();

        // 2. Act
        try {
            for (int i = 0; i < callers; i++) {
                Callable<AssetLookup> caller = () -> {
                    start.await();
                    firstStatuses.add(cache.getOrBuild(CHECKSUM, AssetKind.THUMBNAIL, 400).getStatus());
                    firstCallsDone.countDown();
                    published.await();
                    return cache.getOrBuild(CHECKSUM, AssetKind.THUMBNAIL, 400);
                };
                secondLookups.add(pool.submit(caller));
            }
            start.countDown();
            assertTrue(firstCallsDone.await(10, TimeUnit.SECONDS));
            assertEquals(1, cache.inFlightCount());
            release.countDown();
            waitFor(() -> cache.inFlightCount() == 0);
            published.countDown();

            // 3. Assert
            Path target = cache.pathFor(CHECKSUM, AssetKind.THUMBNAIL);
            assertEquals(callers, firstStatuses.size());
            for (AssetLookup.Status status : firstStatuses) {
                assertEquals(AssetLookup.Status.PENDING, status);
            }
            for (Future<AssetLookup> lookup : secondLookups) {
                AssetLookup ready = lookup.get(10, TimeUnit.SECONDS);
                assertTrue(ready.isReady());
                assertEquals(target, ready.getPath());
            }
            assertArrayEquals(JPEG_BYTES, Files.readAllBytes(target));
            try (var listing = Files.list(target.getParent())) {
                assertEquals(1, listing.count(), "No temporary file may be left behind");
            }
        } finally {
            pool.shutdownNow();
        }
        verify(renderer, times(1)).render(any(), anyBoolean(), anyInt());
        verify(notifier, timeout(2000)).schedule(Visibility.PUBLIC);
    }

    @Test
    void testGetOrBuild_KindsAreIndependentKeys() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(renderer.render(any(), anyBoolean(), anyInt())).thenAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            return JPEG_BYTES;
        });

        cache.getOrBuild(CHECKSUM, AssetKind.THUMBNAIL, 400);
        cache.getOrBuild(CHECKSUM, AssetKind.PREVIEW, 1024);

        assertEquals(2, cache.inFlightCount());
        release.countDown();
        waitFor(() -> cache.inFlightCount() == 0);
        assertTrue(Files.isRegularFile(cache.pathFor(CHECKSUM, AssetKind.PREVIEW)));
    }

    /**
     * Verifies that a failed build is not remembered and the next request retries.
     */
    @Test
    void testGetOrBuild_FailedBuild_ShouldRetryOnNextRequest() throws Exception {
        // 1. Arrange
        when(renderer.render(original, false, 1024))
                .thenThrow(new AssetRenderException("corrupt"))
                .thenReturn(JPEG_BYTES);
        Path target = cache.pathFor(CHECKSUM, AssetKind.PREVIEW);

        // 2. Act
        cache.getOrBuild(CHECKSUM, AssetKind.PREVIEW, 1024);
        waitFor(() -> cache.inFlightCount() == 0);
        assertFalse(Files.exists(target));

        AssetLookup retry = cache.getOrBuild(CHECKSUM, AssetKind.PREVIEW, 1024);
        waitFor(() -> cache.inFlightCount() == 0);

        // 3. Assert
        assertEquals(AssetLookup.Status.PENDING, retry.getStatus());
        assertTrue(Files.isRegularFile(target));
        verify(notifier, timeout(2000).times(1)).schedule(Visibility.PUBLIC);
        try (var listing = Files.list(target.getParent())) {
            assertEquals(1, listing.count(), "No temporary file may be left behind");
        }
    }

    @Test
    void testPurge_ShouldOnlyDeleteThatKind() throws Exception {
        Path thumb = cache.pathFor(CHECKSUM, AssetKind.THUMBNAIL);
        Path otherThumb = cache.pathFor("beef", AssetKind.THUMBNAIL);
        Path preview = cache.pathFor(CHECKSUM, AssetKind.PREVIEW);
        for (Path file : new Path[]{thumb, otherThumb, preview}) {
            Files.createDirectories(file.getParent());
            Files.write(file, JPEG_BYTES);
        }

        int deleted = cache.purge(AssetKind.THUMBNAIL);

        assertEquals(2, deleted);
        assertFalse(Files.exists(thumb));
        assertTrue(Files.exists(preview));
        assertEquals(0, cache.purge(AssetKind.THUMBNAIL));
    }

    @Test
    void testEvict_ShouldDeleteEveryKindOfOneChecksum() throws Exception {
        for (AssetKind kind : AssetKind.values()) {
            Path file = cache.pathFor(CHECKSUM, kind);
            Files.createDirectories(file.getParent());
            Files.write(file, JPEG_BYTES);
        }

        cache.evict(CHECKSUM);

        for (AssetKind kind : AssetKind.values()) {
            assertFalse(Files.exists(cache.pathFor(CHECKSUM, kind)));
        }
    }

    @Test
    void testGetOrBuild_AfterStop_ShouldBeUnavailable() {
        cache.stopService();

        assertEquals(AssetLookup.Status.UNAVAILABLE, cache.getOrBuild(CHECKSUM, AssetKind.THUMBNAIL, 400).getStatus());
        assertEquals(0, cache.inFlightCount());
        assertFalse(cache.isRunning());
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(condition.getAsBoolean(), "Condition not reached in time");
    }
}
