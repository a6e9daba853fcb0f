package com.pantiviewer.service;

import com.pantiviewer.model.Location;
import com.pantiviewer.model.WatchedRoot;
import com.pantiviewer.util.FileUtils;
import com.pantiviewer.util.ProjectLogger;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Applies live filesystem changes to the catalog.
 * <p>
 * One OS subscription tree is opened per outermost root. Events are turned into catalog
 * operations on a single dispatch thread:
 * <ul>
 *     <li>a created file is ingested once it has been quiet for the settle delay;</li>
 *     <li>a deleted cataloged file is held for the move window, and applied as a move if a
 *     file with the same checksum appears meanwhile, as a removal otherwise.</li>
 * </ul>
 * Files in directories that are not yet watched roots are left to the next scan.
 */
public class WatcherService implements BackgroundService {

    private static final String CONTEXT = "WatcherService";
    private static final long POLL_MILLIS = 100;

    private final IngestService ingestService;
    private final CatalogMaintenance maintenance;
    private final ChecksumService checksumService;
    private final long settleMillis;
    private final long moveWindowMillis;

    private final Map<WatchKey, Path> watchedDirectories = new ConcurrentHashMap<>();

    // Confined to the dispatch thread
    private final Map<Path, Long> pendingCreates = new LinkedHashMap<>();
    private final Map<Path, PendingDelete> pendingDeletes = new LinkedHashMap<>();

    private WatchService watchService;
    private Thread dispatchThread;
    private volatile boolean running = false;

    public WatcherService(IngestService ingestService, CatalogMaintenance maintenance, ChecksumService checksumService,
                          long settleMillis, long moveWindowMillis) {
        this.ingestService = ingestService;
        this.maintenance = maintenance;
        this.checksumService = checksumService;
        this.settleMillis = settleMillis;
        this.moveWindowMillis = moveWindowMillis;
    }

    /**
     * Subscribes to every outermost non-ignored root and starts the dispatch thread.
     *
     * @throws IOException if the platform watch service cannot be opened
     */
    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        watchService = FileSystems.getDefault().newWatchService();

        List<Path> candidates = new ArrayList<>();
        for (WatchedRoot root : maintenance.roots()) {
            if (!root.isIgnored() && Files.isDirectory(root.getPath())) {
                candidates.add(root.getPath());
            }
        }
        for (Path top : collapseToOutermost(candidates)) {
            registerTree(top);
        }

        running = true;
        dispatchThread = new Thread(this::runLoop, "catalog-watcher");
        dispatchThread.setDaemon(true);
        dispatchThread.start();
        ProjectLogger.logInfo(null, CONTEXT, "Watching " + watchedDirectories.size() + " directories");
    }

    /**
     * Drops every path nested inside another path of the collection.
     */
    static List<Path> collapseToOutermost(Collection<Path> paths) {
        List<Path> sorted = new ArrayList<>(paths);
        sorted.sort(null);
        List<Path> outermost = new ArrayList<>();
        for (Path path : sorted) {
            boolean nested = false;
            for (Path kept : outermost) {
                if (path.startsWith(kept)) {
                    nested = true;
                    break;
                }
            }
            if (!nested) {
                outermost.add(path);
            }
        }
        return outermost;
    }

    private void registerTree(Path top) {
        try {
            Files.walkFileTree(top, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(top) && FileUtils.isHidden(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    try {
                        WatchKey key = dir.register(watchService,
                                StandardWatchEventKinds.ENTRY_CREATE,
                                StandardWatchEventKinds.ENTRY_DELETE,
                                StandardWatchEventKinds.ENTRY_MODIFY);
                        watchedDirectories.put(key, dir);
                    } catch (IOException e) {
                        ProjectLogger.logWarn(top, CONTEXT, "Cannot watch " + dir + ": " + e.getMessage());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    ProjectLogger.logRecurringError(top, CONTEXT, "Cannot visit " + file, exc);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            ProjectLogger.logError(top, CONTEXT, "Failed to register watch tree", e);
        }
    }

    private void runLoop() {
        try {
            while (running) {
                WatchKey key;
                try {
                    key = watchService.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (ClosedWatchServiceException e) {
                    break;
                }

                if (key != null) {
                    Path dir = watchedDirectories.get(key);
                    if (dir != null) {
                        for (WatchEvent<?> event : key.pollEvents()) {
                            try {
                                handleEvent(dir, event);
                            } catch (RuntimeException e) {
                                ProjectLogger.logError(dir, CONTEXT, "Failed to handle " + event.kind() + " in " + dir, e);
                            }
                        }
                    }
                    if (!key.reset()) {
                        watchedDirectories.remove(key);
                    }
                }
                processDue(System.currentTimeMillis());
            }
        } finally {
            // Deletes still waiting for a partner are real deletes
            for (Path path : new ArrayList<>(pendingDeletes.keySet())) {
                pendingDeletes.remove(path);
                applyDelete(path);
            }
            pendingCreates.clear();
            running = false;
        }
    }

    private void handleEvent(Path dir, WatchEvent<?> event) {
        WatchEvent.Kind<?> kind = event.kind();
        if (kind == StandardWatchEventKinds.OVERFLOW) {
            ProjectLogger.logWarn(dir, CONTEXT, "Event overflow, changes will be picked up by the next scan");
            return;
        }
        Path child = dir.resolve((Path) event.context());
        long now = System.currentTimeMillis();

        if (kind == StandardWatchEventKinds.ENTRY_CREATE) {
            if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                if (!FileUtils.isHidden(child)) {
                    registerTree(child);
                }
            } else {
                pendingCreates.put(child, now + settleMillis);
            }
        } else if (kind == StandardWatchEventKinds.ENTRY_MODIFY) {
            if (pendingCreates.containsKey(child)) {
                pendingCreates.put(child, now + settleMillis);
            }
        } else if (kind == StandardWatchEventKinds.ENTRY_DELETE) {
            handleDeleted(child, now);
        }
    }

    /**
     * Holds the delete of a cataloged file for the move window. Deletes of uncataloged
     * paths are no-ops.
     */
    void handleDeleted(Path path, long now) {
        pendingCreates.remove(path);
        Optional<Location> location = ingestService.findLocation(path);
        if (location.isEmpty()) {
            ProjectLogger.logDebug(path.getParent(), CONTEXT, "Delete of uncataloged " + path + ", nothing to do");
            return;
        }
        pendingDeletes.put(path, new PendingDelete(location.get().getChecksum(), now + moveWindowMillis));
    }

    /**
     * Applies the settled creates, then the deletes whose move window expired.
     */
    void processDue(long now) {
        Iterator<Map.Entry<Path, Long>> creates = pendingCreates.entrySet().iterator();
        List<Path> settled = new ArrayList<>();
        while (creates.hasNext()) {
            Map.Entry<Path, Long> entry = creates.next();
            if (entry.getValue() <= now) {
                settled.add(entry.getKey());
                creates.remove();
            }
        }
        for (Path path : settled) {
            try {
                onCreated(path);
            } catch (RuntimeException e) {
                ProjectLogger.logError(path.getParent(), CONTEXT, "Failed to apply create of " + path, e);
            }
        }

        Iterator<Map.Entry<Path, PendingDelete>> deletes = pendingDeletes.entrySet().iterator();
        List<Path> expired = new ArrayList<>();
        while (deletes.hasNext()) {
            Map.Entry<Path, PendingDelete> entry = deletes.next();
            if (entry.getValue().deadline <= now) {
                expired.add(entry.getKey());
                deletes.remove();
            }
        }
        for (Path path : expired) {
            applyDelete(path);
        }
    }

    private void applyDelete(Path path) {
        try {
            onDeleted(path);
        } catch (RuntimeException e) {
            ProjectLogger.logError(path.getParent(), CONTEXT, "Failed to apply delete of " + path, e);
        }
    }

    /**
     * Ingests a settled file, or applies it as the destination of a held delete with the
     * same checksum.
     */
    void onCreated(Path file) {
        if (!Files.isRegularFile(file) || FileUtils.supportedMimeType(file).isEmpty()) {
            return;
        }
        Optional<WatchedRoot> root = ingestService.rootFor(file.getParent());
        if (root.isEmpty() || root.get().isIgnored()) {
            ProjectLogger.logDebug(file.getParent(), CONTEXT, "Not a watched root yet, leaving " + file + " to the next scan");
            return;
        }

        if (!pendingDeletes.isEmpty()) {
            Optional<String> checksum = checksumService.checksum(file);
            if (checksum.isPresent()) {
                for (Map.Entry<Path, PendingDelete> entry : pendingDeletes.entrySet()) {
                    if (entry.getValue().checksum.equals(checksum.get())) {
                        Path from = entry.getKey();
                        pendingDeletes.remove(from);
                        onMoved(from, file);
                        return;
                    }
                }
            }
        }
        ingestService.ingest(file);
    }

    void onDeleted(Path path) {
        ingestService.removeLocation(path);
    }

    void onMoved(Path from, Path to) {
        ingestService.move(from, to);
    }

    int pendingDeleteCount() {
        return pendingDeletes.size();
    }

    @Override
    public String getServiceName() {
        return "watcher";
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public String getStatus() {
        return watchedDirectories.size() + " directories";
    }

    @Override
    public synchronized void stopService() {
        if (!running && dispatchThread == null) {
            return;
        }
        running = false;
        if (dispatchThread != null) {
            try {
                dispatchThread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            dispatchThread = null;
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                ProjectLogger.logWarn(null, CONTEXT, "Failed to close watch service: " + e.getMessage());
            }
            watchService = null;
        }
        watchedDirectories.clear();
        ProjectLogger.logInfo(null, CONTEXT, "Stopped");
    }

    private static class PendingDelete {
        private final String checksum;
        private final long deadline;

        PendingDelete(String checksum, long deadline) {
            this.checksum = checksum;
            this.deadline = deadline;
        }
    }
}
