package com.pantiviewer.service;

import com.pantiviewer.model.IngestOutcome;
import com.pantiviewer.model.IngestResult;
import com.pantiviewer.model.ScanReport;
import com.pantiviewer.model.WatchedRoot;
import com.pantiviewer.util.FileUtils;
import com.pantiviewer.util.ProjectLogger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Full reconciliation pass over every watched root.
 * <p>
 * Roots are walked parents first. A subdirectory that is itself a watched root is pruned
 * from its parent's walk and scanned on its own turn. New subdirectories are registered as
 * restricted roots the moment they are seen, and every file commits on its own, so an
 * interrupted scan leaves a consistent catalog that the next pass resumes.
 */
public class ScanService {

    private static final String CONTEXT = "ScanService";

    private final CatalogMaintenance maintenance;
    private final IngestService ingestService;
    private final KnownChecksums knownChecksums;
    private final ReentrantLock scanLock = new ReentrantLock();

    public ScanService(CatalogMaintenance maintenance, IngestService ingestService, KnownChecksums knownChecksums) {
        this.maintenance = maintenance;
        this.ingestService = ingestService;
        this.knownChecksums = knownChecksums;
    }

    public boolean isScanning() {
        return scanLock.isLocked();
    }

    /**
     * Runs cleanup, tag reconciliation and a walk of every root. Returns at once with a
     * skipped report when another scan holds the lock.
     */
    public ScanReport scanAll() {
        if (!scanLock.tryLock()) {
            ProjectLogger.logInfo(null, CONTEXT, "Scan requested while another one is running, skipping");
            return ScanReport.alreadyRunning();
        }
        try {
            return runScan();
        } finally {
            scanLock.unlock();
        }
    }

    private ScanReport runScan() {
        Instant start = Instant.now();
        maintenance.cleanupOrphans();
        maintenance.applyFolderTags();

        List<WatchedRoot> roots = new ArrayList<>(maintenance.roots());
        roots.sort(Comparator.comparing(WatchedRoot::getPath));
        Set<Path> tracked = new HashSet<>();
        for (WatchedRoot root : roots) {
            tracked.add(root.getPath());
        }
        knownChecksums.replaceAll(maintenance.loadKnownChecksums());

        ScanCounters counters = new ScanCounters();
        for (WatchedRoot root : roots) {
            if (root.isIgnored()) {
                ProjectLogger.logDebug(root.getPath(), CONTEXT, "Root is ignored, skipping");
                counters.rootsSkipped++;
                continue;
            }
            if (!Files.isDirectory(root.getPath())) {
                ProjectLogger.logWarn(root.getPath(), CONTEXT, "Root no longer exists on disk, skipping");
                counters.rootsSkipped++;
                continue;
            }
            try {
                scanRoot(root.getPath(), tracked, counters);
            } catch (RuntimeException e) {
                ProjectLogger.logError(root.getPath(), CONTEXT, "Scan of root aborted", e);
                counters.errors++;
            }
            counters.rootsScanned++;
            ProjectLogger.flush(root.getPath());
        }

        ScanReport report = new ScanReport(false, counters.rootsScanned, counters.rootsSkipped,
                counters.directoriesRegistered, counters.filesSeen, counters.newLocations,
                counters.errors, Duration.between(start, Instant.now()));
        ProjectLogger.logInfo(null, CONTEXT, "Scan complete: " + report);
        return report;
    }

    private void scanRoot(Path rootPath, Set<Path> tracked, ScanCounters counters) {
        ProjectLogger.logInfo(rootPath, CONTEXT, "Scanning");
        try {
            Files.walkFileTree(rootPath, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(rootPath)) {
                        if (FileUtils.isHidden(dir) || tracked.contains(dir)) {
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        if (maintenance.registerDiscoveredDirectory(dir, dir.getParent())) {
                            ProjectLogger.logInfo(dir, CONTEXT, "Registered new directory under " + dir.getParent());
                            counters.directoriesRegistered++;
                        }
                        tracked.add(dir);
                    }
                    ingestDirectory(dir, counters);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    ProjectLogger.logRecurringError(rootPath, CONTEXT, "Failed to visit " + file, exc);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            ProjectLogger.logError(rootPath, CONTEXT, "Error walking root", e);
        }
    }

    /**
     * Ingests the regular files directly inside a directory, oldest first.
     */
    private void ingestDirectory(Path dir, ScanCounters counters) {
        List<FileEntry> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path file : stream) {
                if (FileUtils.isHidden(file)) {
                    continue;
                }
                try {
                    BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                    if (attrs.isRegularFile()) {
                        files.add(new FileEntry(file, attrs.creationTime()));
                    }
                } catch (IOException e) {
                    ProjectLogger.logRecurringError(dir, CONTEXT, "Cannot read attributes of " + file, e);
                }
            }
        } catch (IOException e) {
            ProjectLogger.logRecurringError(dir, CONTEXT, "Cannot list " + dir, e);
            return;
        }

        files.sort(Comparator.comparing((FileEntry f) -> f.created)
                .thenComparing(f -> f.path.getFileName().toString()));
        for (FileEntry entry : files) {
            counters.filesSeen++;
            IngestResult result;
            try {
                result = ingestService.ingest(entry.path);
            } catch (RuntimeException e) {
                ProjectLogger.logRecurringError(dir, CONTEXT, "Failed to ingest " + entry.path, e);
                counters.errors++;
                continue;
            }
            if (result.getOutcome() == IngestOutcome.NEW) {
                counters.newLocations++;
            } else if (result.getOutcome() == IngestOutcome.ERROR) {
                counters.errors++;
            }
        }
    }

    private static class FileEntry {
        private final Path path;
        private final FileTime created;

        FileEntry(Path path, FileTime created) {
            this.path = path;
            this.created = created;
        }
    }

    // Only touched by the scanning thread
    private static class ScanCounters {
        int rootsScanned;
        int rootsSkipped;
        int directoriesRegistered;
        int filesSeen;
        int newLocations;
        int errors;
    }
}
