package com.pantiviewer.service;

import com.pantiviewer.model.AssetKind;
import com.pantiviewer.model.AssetLookup;
import com.pantiviewer.model.AssetSource;
import com.pantiviewer.util.ProjectLogger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * On-disk cache of thumbnails and previews, named {@code {checksum}_{kind}.jpg} under one
 * directory per kind.
 * <p>
 * A hit is served straight from disk. A miss claims the key in the in-flight set and queues
 * one build on the worker pool; concurrent misses for the same key get {@code PENDING}
 * without queuing anything. A build writes a temporary file next to the target and renames
 * it into place, so a reader never sees a partial file. Failures are not remembered: the
 * next request retries.
 */
public class DerivedAssetCache implements BackgroundService {

    private static final String CONTEXT = "DerivedAssetCache";

    private final Path cacheRoot;
    private final AssetRenderer renderer;
    private final AssetSourceResolver resolver;
    private final ChangeNotifier notifier;
    private final ExecutorService workers;

    private final Object inFlightLock = new Object();
    private final Set<String> inFlight = new HashSet<>();
    private final AtomicInteger built = new AtomicInteger();

    public DerivedAssetCache(Path cacheRoot, AssetRenderer renderer, AssetSourceResolver resolver,
                             ChangeNotifier notifier, int workerCount) {
        this(cacheRoot, renderer, resolver, notifier, newWorkerPool(workerCount));
    }

    DerivedAssetCache(Path cacheRoot, AssetRenderer renderer, AssetSourceResolver resolver,
                      ChangeNotifier notifier, ExecutorService workers) {
        this.cacheRoot = cacheRoot.toAbsolutePath().normalize();
        this.renderer = renderer;
        this.resolver = resolver;
        this.notifier = notifier;
        this.workers = workers;
    }

    private static ExecutorService newWorkerPool(int workerCount) {
        AtomicInteger index = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, workerCount), r -> {
            Thread t = new Thread(r, "asset-worker-" + index.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public Path pathFor(String checksum, AssetKind kind) {
        return cacheRoot.resolve(kind.getDirectoryName()).resolve(kind.fileName(checksum));
    }

    /**
     * Returns the published asset, or queues its build.
     *
     * @param checksum     Content key
     * @param kind         Thumbnail or preview
     * @param boundingSize Bounding size used when a build is needed
     * @return {@code READY} with the path, {@code PENDING} while a build runs, or
     * {@code UNAVAILABLE} when no original can be read
     */
    public AssetLookup getOrBuild(String checksum, AssetKind kind, int boundingSize) {
        Path target = pathFor(checksum, kind);
        if (Files.isRegularFile(target)) {
            return AssetLookup.ready(target);
        }

        Optional<AssetSource> source = resolver.resolve(checksum);
        if (source.isEmpty()) {
            return AssetLookup.unavailable();
        }

        String key = checksum + ":" + kind.getSuffix();
        synchronized (inFlightLock) {
            if (!inFlight.add(key)) {
                return AssetLookup.pending();
            }
        }
        // A build may have published between the first check and the claim
        if (Files.isRegularFile(target)) {
            release(key);
            return AssetLookup.ready(target);
        }

        try {
            workers.execute(() -> build(key, source.get(), target, boundingSize));
        } catch (RejectedExecutionException e) {
            release(key);
            ProjectLogger.logWarn(null, CONTEXT, "Build of " + key + " rejected, cache is shutting down");
            return AssetLookup.unavailable();
        }
        return AssetLookup.pending();
    }

    private void build(String key, AssetSource source, Path target, int boundingSize) {
        Path directory = target.getParent();
        boolean published = false;
        try {
            byte[] bytes = renderer.render(source.getFile(), source.isVideo(), boundingSize);
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            try {
                Files.write(temp, bytes);
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
            published = true;
            built.incrementAndGet();
            ProjectLogger.logDebug(source.getFile().getParent(), CONTEXT, "Published " + target);
        } catch (AssetRenderException e) {
            ProjectLogger.logRecurringError(source.getFile().getParent(), CONTEXT,
                    "Cannot render " + key + " from " + source.getFile(), e);
        } catch (IOException | RuntimeException e) {
            ProjectLogger.logError(source.getFile().getParent(), CONTEXT,
                    "Failed to publish " + key + " from " + source.getFile(), e);
        } finally {
            release(key);
        }
        if (published) {
            notifier.schedule(source.getTier());
        }
    }

    private void release(String key) {
        synchronized (inFlightLock) {
            inFlight.remove(key);
        }
    }

    public int inFlightCount() {
        synchronized (inFlightLock) {
            return inFlight.size();
        }
    }

    /**
     * Deletes every cached file of a kind. Safe at any time.
     *
     * @return the number of files deleted
     */
    public int purge(AssetKind kind) {
        Path directory = cacheRoot.resolve(kind.getDirectoryName());
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        int deleted = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path file : stream) {
                try {
                    if (Files.deleteIfExists(file)) {
                        deleted++;
                    }
                } catch (IOException e) {
                    ProjectLogger.logRecurringError(null, CONTEXT, "Cannot delete cached file " + file, e);
                }
            }
        } catch (IOException e) {
            ProjectLogger.logError(null, CONTEXT, "Cannot list " + directory, e);
        }
        ProjectLogger.flush(null);
        ProjectLogger.logInfo(null, CONTEXT, "Purged " + deleted + " " + kind.getDirectoryName());
        return deleted;
    }

    /**
     * Deletes the cached files of one content, of every kind.
     */
    public void evict(String checksum) {
        for (AssetKind kind : AssetKind.values()) {
            Path file = pathFor(checksum, kind);
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                ProjectLogger.logWarn(null, CONTEXT, "Cannot evict " + file + ": " + e.getMessage());
            }
        }
    }

    @Override
    public String getServiceName() {
        return "asset-cache";
    }

    @Override
    public boolean isRunning() {
        return !workers.isShutdown();
    }

    @Override
    public String getStatus() {
        int pending = inFlightCount();
        return pending == 0 ? "idle, " + built.get() + " built" : pending + " builds in flight";
    }

    @Override
    public void stopService() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
