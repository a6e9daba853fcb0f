package com.pantiviewer.service;

import com.pantiviewer.model.IngestResult;
import com.pantiviewer.model.Location;
import com.pantiviewer.model.Visibility;
import com.pantiviewer.model.WatchedRoot;
import com.pantiviewer.repository.CatalogDatabase;
import com.pantiviewer.repository.ContentStore;
import com.pantiviewer.repository.LocationIndex;
import com.pantiviewer.repository.SearchIndex;
import com.pantiviewer.repository.TagRepository;
import com.pantiviewer.repository.WatchedRootRepository;
import com.pantiviewer.util.IngestSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link WatcherService}. Event handling is driven directly with explicit clock
 * values; one test goes through the platform watch service.
 */
class WatcherServiceTest {

    private static final long SETTLE_MILLIS = 50;
    private static final long MOVE_WINDOW_MILLIS = 1000;

    @TempDir
    Path tempDir;

    private IngestService ingestService;
    private WatcherService watcher;
    private Path library;
    private Path restricted;

    @BeforeEach
    void setUp() throws Exception {
        CatalogDatabase database = new CatalogDatabase(tempDir.resolve("catalog.sqlite"));
        ContentStore contentStore = new ContentStore();
        LocationIndex locationIndex = new LocationIndex();
        SearchIndex searchIndex = new SearchIndex(contentStore, locationIndex);
        WatchedRootRepository rootRepository = new WatchedRootRepository();
        MetadataExtractor extractor = new MetadataExtractor(mock(FFmpegService.class));
        ChangeNotifier notifier = mock(ChangeNotifier.class);
        ChecksumService checksumService = new ChecksumService();

        CatalogMaintenance maintenance = new CatalogMaintenance(database, rootRepository, new TagRepository(),
                contentStore, locationIndex, searchIndex, extractor, notifier);
        ingestService = new IngestService(database, contentStore, locationIndex, searchIndex, rootRepository,
                checksumService, extractor, new KnownChecksums(), notifier);
        watcher = new WatcherService(ingestService, maintenance, checksumService, SETTLE_MILLIS, MOVE_WINDOW_MILLIS);

        library = Files.createDirectories(tempDir.resolve("library"));
        restricted = Files.createDirectories(library.resolve("private"));
        maintenance.registerConfiguredRoots(List.of(
                new IngestSettings.RootSettings(library, Visibility.PUBLIC, null, false, List.of()),
                new IngestSettings.RootSettings(restricted, Visibility.RESTRICTED, null, false, List.of())
        ));
    }

    @AfterEach
    void tearDown() {
        watcher.stopService();
    }

    @Test
    void testCollapseToOutermost_ShouldDropNestedPaths() {
        List<Path> collapsed = WatcherService.collapseToOutermost(List.of(
                Paths.get("/media/photos/2024"),
                Paths.get("/media/photos"),
                Paths.get("/media/photos-old"),
                Paths.get("/media/photos/2024/trip")
        ));

        assertEquals(List.of(Paths.get("/media/photos"), Paths.get("/media/photos-old")), collapsed);
    }

    @Test
    void testOnCreated_FileInRoot_ShouldIngest() throws Exception {
        Path photo = MediaFixtures.png(library.resolve("new.png"), 10, 10, Color.RED);

        watcher.onCreated(photo);

        assertTrue(ingestService.findLocation(photo).isPresent());
    }

    /**
     * Verifies that files in directories no scan has registered yet are left alone.
     */
    @Test
    void testOnCreated_UnregisteredDirectory_ShouldBeLeftToNextScan() throws Exception {
        Path photo = MediaFixtures.png(library.resolve("unscanned/new.png"), 10, 10, Color.RED);

        watcher.onCreated(photo);

        assertTrue(ingestService.findLocation(photo).isEmpty());
    }

    @Test
    void testOnCreated_UnsupportedFile_ShouldBeIgnored() throws Exception {
        Path notes = Files.writeString(library.resolve("notes.txt"), "text");

        watcher.onCreated(notes);

        assertTrue(ingestService.findLocation(notes).isEmpty());
    }

    /**
     * Verifies that a delete followed by a create with the same checksum is applied as a move.
     */
    @Test
    void testDeleteThenCreate_SameChecksum_ShouldBeAppliedAsMove() throws Exception {
        // 1. Arrange
        Path from = MediaFixtures.png(library.resolve("a.png"), 10, 10, Color.RED);
        Location before = ingestService.ingest(from).getLocation();
        Path to = restricted.resolve("a-moved.png");
        Files.move(from, to);

        // 2. Act
        watcher.handleDeleted(from, 1000);
        assertEquals(1, watcher.pendingDeleteCount());
        watcher.onCreated(to);

        // 3. Assert
        assertEquals(0, watcher.pendingDeleteCount());
        Optional<Location> after = ingestService.findLocation(to);
        assertTrue(after.isPresent());
        assertEquals(before.getId(), after.get().getId());
        assertTrue(ingestService.findLocation(from).isEmpty());
    }

    /**
     * Verifies that a delete without a partner is applied once the move window expires.
     */
    @Test
    void testHandleDeleted_WindowExpires_ShouldRemoveLocation() throws Exception {
        Path photo = MediaFixtures.png(library.resolve("a.png"), 10, 10, Color.RED);
        ingestService.ingest(photo);
        Files.delete(photo);

        watcher.handleDeleted(photo, 1000);
        watcher.processDue(1000 + MOVE_WINDOW_MILLIS - 1);
        assertTrue(ingestService.findLocation(photo).isPresent(), "Still inside the move window");

        watcher.processDue(1000 + MOVE_WINDOW_MILLIS);
        assertTrue(ingestService.findLocation(photo).isEmpty());
        assertEquals(0, watcher.pendingDeleteCount());
    }

    @Test
    void testHandleDeleted_UncatalogedPath_ShouldHoldNothing() {
        watcher.handleDeleted(library.resolve("never-seen.png"), 1000);

        assertEquals(0, watcher.pendingDeleteCount());
    }

    @Test
    void testCreateThenDifferentContent_ShouldIngestAndKeepDeletePending() throws Exception {
        Path gone = MediaFixtures.png(library.resolve("gone.png"), 10, 10, Color.RED);
        ingestService.ingest(gone);
        Files.delete(gone);
        Path other = MediaFixtures.png(library.resolve("other.png"), 10, 10, Color.BLUE);

        watcher.handleDeleted(gone, 1000);
        watcher.onCreated(other);

        assertTrue(ingestService.findLocation(other).isPresent());
        assertEquals(1, watcher.pendingDeleteCount());
    }

    /**
     * Verifies the whole path through the platform watch service.
     */
    @Test
    void testStart_FileDroppedIntoRoot_ShouldBeIngested() throws Exception {
        // 1. Arrange
        watcher.start();
        assertTrue(watcher.isRunning());

        // 2. Act
        Path photo = MediaFixtures.png(restricted.resolve("dropped.png"), 10, 10, Color.RED);

        // 3. Assert
        long deadline = System.currentTimeMillis() + 15_000;
        while (ingestService.findLocation(photo).isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(100);
        }
        assertTrue(ingestService.findLocation(photo).isPresent());

        watcher.stopService();
        assertFalse(watcher.isRunning());
    }

    /**
     * Verifies that a failing delete does not keep the other expired deletes from being applied.
     */
    @Test
    void testProcessDue_OneDeleteFails_ShouldApplyTheOthers() {
        // 1. Arrange
        IngestService failing = mock(IngestService.class);
        Path first = library.resolve("first.png");
        Path second = library.resolve("second.png");
        when(failing.findLocation(any())).thenReturn(
                Optional.of(new Location(1, library, "first.png", "aa", false, Instant.now())));
        when(failing.removeLocation(any()))
                .thenThrow(new IllegalStateException("catalog unavailable"))
                .thenReturn(true);
        WatcherService isolated = new WatcherService(failing, mock(CatalogMaintenance.class),
                new ChecksumService(), SETTLE_MILLIS, MOVE_WINDOW_MILLIS);
        isolated.handleDeleted(first, 1000);
        isolated.handleDeleted(second, 1000);

        // 2. Act
        isolated.processDue(1000 + MOVE_WINDOW_MILLIS);

        // 3. Assert
        verify(failing).removeLocation(first);
        verify(failing).removeLocation(second);
        assertEquals(0, isolated.pendingDeleteCount());
    }

    /**
     * Verifies that the watcher keeps running and ingesting after one file fails.
     */
    @Test
    void testStart_FirstIngestThrows_ShouldKeepWatching() throws Exception {
        // 1. Arrange
        IngestService failing = mock(IngestService.class);
        CatalogMaintenance maintenance = mock(CatalogMaintenance.class);
        WatchedRoot root = new WatchedRoot(1, library, "library", null, null, false, Visibility.PUBLIC, true, Set.of());
        when(maintenance.roots()).thenReturn(List.of(root));
        when(failing.rootFor(any())).thenReturn(Optional.of(root));
        when(failing.ingest(any()))
                .thenThrow(new ArrayIndexOutOfBoundsException("corrupt segment"))
                .thenReturn(IngestResult.unsupported());
        WatcherService resilient = new WatcherService(failing, maintenance, new ChecksumService(),
                SETTLE_MILLIS, MOVE_WINDOW_MILLIS);

        try {
            resilient.start();

            // 2. Act
            MediaFixtures.png(library.resolve("bad.png"), 10, 10, Color.RED);
            MediaFixtures.png(library.resolve("good.png"), 10, 10, Color.BLUE);

            // 3. Assert
            verify(failing, timeout(15_000).times(2)).ingest(any());
            assertTrue(resilient.isRunning());
        } finally {
            resilient.stopService();
        }
    }
}
