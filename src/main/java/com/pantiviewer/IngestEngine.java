package com.pantiviewer;

import com.pantiviewer.model.AssetKind;
import com.pantiviewer.model.AssetLookup;
import com.pantiviewer.model.IngestResult;
import com.pantiviewer.model.ReprocessScope;
import com.pantiviewer.model.ScanReport;
import com.pantiviewer.model.Visibility;
import com.pantiviewer.repository.CatalogDatabase;
import com.pantiviewer.repository.ContentStore;
import com.pantiviewer.repository.LocationIndex;
import com.pantiviewer.repository.SearchIndex;
import com.pantiviewer.repository.TagRepository;
import com.pantiviewer.repository.WatchedRootRepository;
import com.pantiviewer.service.AssetRenderer;
import com.pantiviewer.service.CatalogChangeListener;
import com.pantiviewer.service.CatalogMaintenance;
import com.pantiviewer.service.ChangeNotifier;
import com.pantiviewer.service.ChecksumService;
import com.pantiviewer.service.DerivedAssetCache;
import com.pantiviewer.service.FFmpegService;
import com.pantiviewer.service.IngestService;
import com.pantiviewer.service.KnownChecksums;
import com.pantiviewer.service.MetadataExtractor;
import com.pantiviewer.service.ScanService;
import com.pantiviewer.service.ServiceManager;
import com.pantiviewer.service.WatcherService;
import com.pantiviewer.util.IngestSettings;
import com.pantiviewer.util.ProjectLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Wires the ingestion core together and exposes its operations to the host application.
 * <p>
 * One engine owns one catalog database, one derived asset cache and the background
 * threads serving them. All operations are safe to call from any thread.
 */
public class IngestEngine implements AutoCloseable {

    private static final String CONTEXT = "IngestEngine";

    private final IngestSettings settings;
    private final ServiceManager serviceManager = new ServiceManager();
    private final ChangeNotifier notifier;
    private final IngestService ingestService;
    private final CatalogMaintenance maintenance;
    private final ScanService scanService;
    private final WatcherService watcherService;
    private final DerivedAssetCache assetCache;

    public IngestEngine(IngestSettings settings) {
        this.settings = settings;

        CatalogDatabase database = new CatalogDatabase(settings.getDatabase());
        ContentStore contentStore = new ContentStore();
        LocationIndex locationIndex = new LocationIndex();
        SearchIndex searchIndex = new SearchIndex(contentStore, locationIndex);
        WatchedRootRepository rootRepository = new WatchedRootRepository();
        TagRepository tagRepository = new TagRepository();

        FFmpegService ffmpegService = new FFmpegService(settings.getFfmpegPath(), settings.getFfprobePath());
        MetadataExtractor metadataExtractor = new MetadataExtractor(ffmpegService);
        ChecksumService checksumService = new ChecksumService();
        KnownChecksums knownChecksums = new KnownChecksums();

        this.notifier = new ChangeNotifier(settings.getDebounceMillis());
        this.ingestService = new IngestService(database, contentStore, locationIndex, searchIndex, rootRepository,
                checksumService, metadataExtractor, knownChecksums, notifier);
        this.maintenance = new CatalogMaintenance(database, rootRepository, tagRepository, contentStore,
                locationIndex, searchIndex, metadataExtractor, notifier);
        this.scanService = new ScanService(maintenance, ingestService, knownChecksums);
        this.watcherService = new WatcherService(ingestService, maintenance, checksumService,
                settings.getSettleMillis(), settings.getMoveWindowMillis());
        this.assetCache = new DerivedAssetCache(settings.getCacheRoot(), new AssetRenderer(ffmpegService),
                ingestService::resolveAssetSource, notifier, settings.getAssetWorkers());

        serviceManager.registerService(notifier);
        serviceManager.registerService(assetCache);

        maintenance.registerConfiguredRoots(settings.getRoots());
        knownChecksums.replaceAll(maintenance.loadKnownChecksums());
        ProjectLogger.logInfo(null, CONTEXT, "Catalog ready at " + database.getDatabaseFile()
                + " with " + knownChecksums.size() + " known items");
    }

    public IngestResult ingest(Path path) {
        return ingestService.ingest(path);
    }

    public ScanReport scanAll() {
        return scanService.scanAll();
    }

    /**
     * Starts applying live filesystem changes. Calling it twice has no effect.
     *
     * @throws IOException if the platform watch service is unavailable
     */
    public void startWatching() throws IOException {
        watcherService.start();
        serviceManager.registerService(watcherService);
    }

    public AssetLookup getOrBuildAsset(String checksum, AssetKind kind) {
        return getOrBuildAsset(checksum, kind, settings.sizeFor(kind));
    }

    public AssetLookup getOrBuildAsset(String checksum, AssetKind kind, int size) {
        return assetCache.getOrBuild(checksum, kind, size);
    }

    public int purgeAssets(AssetKind kind) {
        return assetCache.purge(kind);
    }

    /**
     * @param audience Who listens: {@link Visibility#PUBLIC} clients only hear about public
     *                 roots, {@link Visibility#RESTRICTED} clients hear about every root
     * @return a handle that unsubscribes when run
     */
    public Runnable onCatalogChange(Visibility audience, CatalogChangeListener listener) {
        return notifier.subscribe(audience, listener);
    }

    public int cleanupOrphans() {
        return maintenance.cleanupOrphans();
    }

    public int applyFolderTags() {
        return maintenance.applyFolderTags();
    }

    public int reprocessMetadata(ReprocessScope scope) {
        return maintenance.reprocessMetadata(scope);
    }

    public int rebuildSearchIndex() {
        return maintenance.rebuildSearchIndex();
    }

    public boolean trash(long locationId) {
        return ingestService.setTrashed(locationId, true);
    }

    public boolean restore(long locationId) {
        return ingestService.setTrashed(locationId, false);
    }

    /**
     * Deletes the file from disk and from the catalog. Derived assets go with the content
     * when this was its last location.
     *
     * @return the checksum of the removed content, empty if other locations still hold it
     */
    public Optional<String> permanentlyDelete(long locationId) {
        Optional<String> removed = ingestService.permanentlyDelete(locationId);
        removed.ifPresent(assetCache::evict);
        return removed;
    }

    public void tagRoot(Path rootPath, String tag) {
        maintenance.tagRoot(rootPath, tag);
    }

    public String getStatus() {
        return serviceManager.getGlobalStatus();
    }

    @Override
    public void close() {
        watcherService.stopService();
        serviceManager.shutdown();
        ProjectLogger.logInfo(null, CONTEXT, "Engine closed");
    }
}
