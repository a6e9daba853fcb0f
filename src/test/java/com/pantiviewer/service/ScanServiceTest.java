package com.pantiviewer.service;

import com.pantiviewer.model.IngestResult;
import com.pantiviewer.model.ScanReport;
import com.pantiviewer.model.Visibility;
import com.pantiviewer.model.WatchedRoot;
import com.pantiviewer.repository.CatalogDatabase;
import com.pantiviewer.repository.ContentStore;
import com.pantiviewer.repository.LocationIndex;
import com.pantiviewer.repository.SearchIndex;
import com.pantiviewer.repository.TagRepository;
import com.pantiviewer.repository.WatchedRootRepository;
import com.pantiviewer.util.IngestSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.awt.Color;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link ScanService}: full scans over a real catalog, and the scan lock and
 * file ordering with collaborators mocked.
 */
class ScanServiceTest {

    @TempDir
    Path tempDir;

    private IngestService ingestService;
    private CatalogMaintenance maintenance;
    private ScanService scanService;
    private Path library;

    @BeforeEach
    void setUp() throws Exception {
        CatalogDatabase database = new CatalogDatabase(tempDir.resolve("catalog.sqlite"));
        ContentStore contentStore = new ContentStore();
        LocationIndex locationIndex = new LocationIndex();
        SearchIndex searchIndex = new SearchIndex(contentStore, locationIndex);
        WatchedRootRepository rootRepository = new WatchedRootRepository();
        MetadataExtractor extractor = new MetadataExtractor(mock(FFmpegService.class));
        ChangeNotifier notifier = mock(ChangeNotifier.class);
        KnownChecksums knownChecksums = new KnownChecksums();

        maintenance = new CatalogMaintenance(database, rootRepository, new TagRepository(), contentStore,
                locationIndex, searchIndex, extractor, notifier);
        ingestService = new IngestService(database, contentStore, locationIndex, searchIndex, rootRepository,
                new ChecksumService(), extractor, knownChecksums, notifier);
        scanService = new ScanService(maintenance, ingestService, knownChecksums);

        library = Files.createDirectories(tempDir.resolve("library"));
    }

    private void configure(IngestSettings.RootSettings... roots) {
        maintenance.registerConfiguredRoots(List.of(roots));
    }

    private static IngestSettings.RootSettings root(Path path, boolean ignored) {
        return new IngestSettings.RootSettings(path, Visibility.PUBLIC, null, ignored, List.of());
    }

    /**
     * Verifies that a scan ingests media, registers new subdirectories and skips hidden ones.
     */
    @Test
    void testScanAll_ShouldDiscoverAndIngest() throws Exception {
        // 1. Arrange
        configure(root(library, false));
        Path top = MediaFixtures.png(library.resolve("a.png"), 10, 10, Color.RED);
        Path nested = MediaFixtures.png(library.resolve("2024/b.png"), 10, 10, Color.GREEN);
        Path hidden = MediaFixtures.png(library.resolve(".cache/c.png"), 10, 10, Color.BLUE);
        Files.write(library.resolve("notes.txt"), "not media".getBytes(StandardCharsets.UTF_8));

        // 2. Act
        ScanReport report = scanService.scanAll();

        // 3. Assert
        assertFalse(report.isSkipped());
        assertEquals(1, report.getRootsScanned());
        assertEquals(1, report.getDirectoriesRegistered());
        assertEquals(3, report.getFilesSeen());
        assertEquals(2, report.getNewLocations());
        assertTrue(ingestService.findLocation(top).isPresent());
        assertTrue(ingestService.findLocation(nested).isPresent());
        assertTrue(ingestService.findLocation(hidden).isEmpty());

        WatchedRoot discovered = maintenance.roots().stream()
                .filter(r -> r.getPath().equals(library.resolve("2024"))).findFirst().orElseThrow();
        assertEquals(Visibility.RESTRICTED, discovered.getVisibility());
        assertEquals(library, discovered.getParent());
    }

    /**
     * Verifies that a second scan over an unchanged tree adds nothing and walks discovered
     * directories as roots of their own.
     */
    @Test
    void testScanAll_SecondPass_ShouldAddNothing() throws Exception {
        configure(root(library, false));
        MediaFixtures.png(library.resolve("a.png"), 10, 10, Color.RED);
        MediaFixtures.png(library.resolve("2024/b.png"), 10, 10, Color.GREEN);
        scanService.scanAll();

        ScanReport second = scanService.scanAll();

        assertEquals(2, second.getRootsScanned());
        assertEquals(0, second.getDirectoriesRegistered());
        assertEquals(2, second.getFilesSeen());
        assertEquals(0, second.getNewLocations());
    }

    @Test
    void testScanAll_IgnoredAndMissingRoots_ShouldBeSkipped() throws Exception {
        Path ignored = Files.createDirectories(tempDir.resolve("ignored"));
        Path file = MediaFixtures.png(ignored.resolve("a.png"), 10, 10, Color.RED);
        configure(root(ignored, true), root(tempDir.resolve("unplugged-drive"), false));

        ScanReport report = scanService.scanAll();

        assertEquals(0, report.getRootsScanned());
        assertEquals(2, report.getRootsSkipped());
        assertTrue(ingestService.findLocation(file).isEmpty());
    }

    /**
     * Verifies that a scan requested while another runs returns at once.
     */
    @Test
    void testScanAll_WhileRunning_ShouldSkip() throws Exception {
        // 1. Arrange
        CatalogMaintenance blocking = mock(CatalogMaintenance.class);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(blocking.cleanupOrphans()).thenAnswer(invocation -> {
            entered.countDown();
            release.await(10, TimeUnit.SECONDS);
            return 0;
        });
        ScanService service = new ScanService(blocking, mock(IngestService.class), new KnownChecksums());
        Thread first = new Thread(service::scanAll, "first-scan");
        first.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        // 2. Act
        ScanReport concurrent = service.scanAll();

        // 3. Assert
        assertTrue(concurrent.isSkipped());
        assertTrue(service.isScanning());
        release.countDown();
        first.join(5000);
        assertFalse(service.isScanning());
        verify(blocking, times(1)).cleanupOrphans();
    }

    /**
     * Verifies that files inside a directory are ingested oldest first.
     */
    @Test
    void testScanAll_ShouldIngestOldestFirst() throws Exception {
        // 1. Arrange
        Path older = MediaFixtures.png(library.resolve("z.png"), 10, 10, Color.RED);
        Thread.sleep(20);
        Path newer = MediaFixtures.png(library.resolve("a.png"), 10, 10, Color.GREEN);
        Instant base = Instant.parse("2024-01-01T00:00:00Z");
        Files.setLastModifiedTime(older, FileTime.from(base));
        Files.setLastModifiedTime(newer, FileTime.from(base.plusSeconds(60)));

        CatalogMaintenance stub = mock(CatalogMaintenance.class);
        when(stub.roots()).thenReturn(List.of(new WatchedRoot(1, library, "library", null, null,
                false, Visibility.PUBLIC, true, Set.of())));
        IngestService recorder = mock(IngestService.class);
        when(recorder.ingest(any())).thenReturn(IngestResult.unsupported());

        // 2. Act
        new ScanService(stub, recorder, new KnownChecksums()).scanAll();

        // 3. Assert
        InOrder inOrder = inOrder(recorder);
        inOrder.verify(recorder).ingest(older);
        inOrder.verify(recorder).ingest(newer);
    }

    /**
     * Verifies that a file whose ingestion throws is counted as an error and the rest of the
     * directory is still scanned.
     */
    @Test
    void testScanAll_IngestThrows_ShouldCountErrorAndContinue() throws Exception {
        // 1. Arrange
        Path broken = MediaFixtures.png(library.resolve("broken.png"), 10, 10, Color.RED);
        Path unreadable = MediaFixtures.png(library.resolve("unreadable.png"), 10, 10, Color.GREEN);
        Path fine = MediaFixtures.png(library.resolve("fine.png"), 10, 10, Color.BLUE);

        CatalogMaintenance stub = mock(CatalogMaintenance.class);
        when(stub.roots()).thenReturn(List.of(new WatchedRoot(1, library, "library", null, null,
                false, Visibility.PUBLIC, true, Set.of())));
        IngestService failing = mock(IngestService.class);
        when(failing.ingest(any()))
                .thenThrow(new IllegalStateException("corrupt header"))
                .thenReturn(IngestResult.error())
                .thenReturn(IngestResult.unsupported());

        // 2. Act
        ScanReport report = new ScanService(stub, failing, new KnownChecksums()).scanAll();

        // 3. Assert
        verify(failing).ingest(broken);
        verify(failing).ingest(unreadable);
        verify(failing).ingest(fine);
        assertEquals(1, report.getRootsScanned());
        assertEquals(3, report.getFilesSeen());
        assertEquals(2, report.getErrors());
        assertEquals(0, report.getNewLocations());
    }
}
