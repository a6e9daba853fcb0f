package com.pantiviewer.service;

import com.pantiviewer.model.AssetSource;
import com.pantiviewer.model.Content;
import com.pantiviewer.model.IngestResult;
import com.pantiviewer.model.Location;
import com.pantiviewer.model.MediaMetadata;
import com.pantiviewer.model.Visibility;
import com.pantiviewer.model.WatchedRoot;
import com.pantiviewer.repository.CatalogDatabase;
import com.pantiviewer.repository.ContentStore;
import com.pantiviewer.repository.LocationIndex;
import com.pantiviewer.repository.SearchIndex;
import com.pantiviewer.repository.WatchedRootRepository;
import com.pantiviewer.util.FileUtils;
import com.pantiviewer.util.ProjectLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The single entry point through which the scanner and the watcher put files into the
 * catalog, and through which file-level changes (delete, move, trash) are applied.
 * <p>
 * Each call opens its own connection, so the service is safe to use from any number of
 * threads. A file is cataloged atomically: the content row, the location row and the
 * search row commit together or not at all.
 */
public class IngestService {

    private static final String CONTEXT = "IngestService";

    private final CatalogDatabase database;
    private final ContentStore contentStore;
    private final LocationIndex locationIndex;
    private final SearchIndex searchIndex;
    private final WatchedRootRepository rootRepository;
    private final ChecksumService checksumService;
    private final MetadataExtractor metadataExtractor;
    private final KnownChecksums knownChecksums;
    private final ChangeNotifier notifier;

    public IngestService(CatalogDatabase database, ContentStore contentStore, LocationIndex locationIndex,
                         SearchIndex searchIndex, WatchedRootRepository rootRepository,
                         ChecksumService checksumService, MetadataExtractor metadataExtractor,
                         KnownChecksums knownChecksums, ChangeNotifier notifier) {
        this.database = database;
        this.contentStore = contentStore;
        this.locationIndex = locationIndex;
        this.searchIndex = searchIndex;
        this.rootRepository = rootRepository;
        this.checksumService = checksumService;
        this.metadataExtractor = metadataExtractor;
        this.knownChecksums = knownChecksums;
        this.notifier = notifier;
    }

    /**
     * Catalogs one file. Calling it again for an unchanged, already cataloged path is a no-op.
     *
     * @param path The file to ingest
     * @return What happened; never throws
     */
    public IngestResult ingest(Path path) {
        Path file = path.toAbsolutePath().normalize();
        Path directory = file.getParent();
        String filename = file.getFileName().toString();

        try (Connection conn = database.connect()) {
            Optional<Location> existing = locationIndex.find(conn, directory, filename);
            if (existing.isPresent()) {
                return IngestResult.duplicate(existing.get());
            }

            Optional<String> mimeType = FileUtils.supportedMimeType(file);
            if (mimeType.isEmpty()) {
                return IngestResult.unsupported();
            }

            Optional<String> checksum = checksumService.checksum(file);
            if (checksum.isEmpty()) {
                // Already logged, retried on the next scan
                return IngestResult.error();
            }

            boolean known = knownChecksums.contains(checksum.get()) || contentStore.exists(conn, checksum.get());
            Content content = known ? null : buildContent(file, checksum.get(), mimeType.get());

            Instant now = Instant.now();
            Location location;
            boolean contentCreated;
            conn.setAutoCommit(false);
            try {
                contentCreated = content != null && contentStore.insertIfAbsent(conn, content);
                location = locationIndex.insert(conn, directory, filename, checksum.get(), now);
                searchIndex.upsert(conn, location.getId());
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                if (!CatalogDatabase.isConstraintViolation(e)) {
                    if (content == null) {
                        // The cached set may name content that was deleted since, rebuild it next time
                        knownChecksums.remove(checksum.get());
                    }
                    throw e;
                }
                // Another ingestion path won the race for this location
                ProjectLogger.logDebug(directory, CONTEXT, "Concurrent insert of " + file + ", keeping the other writer's row");
                conn.setAutoCommit(true);
                return IngestResult.duplicate(locationIndex.find(conn, directory, filename).orElse(null));
            } catch (RuntimeException e) {
                conn.rollback();
                throw e;
            }
            conn.setAutoCommit(true);

            knownChecksums.add(checksum.get());
            notifier.schedule(tierFor(conn, directory));
            ProjectLogger.logDebug(directory, CONTEXT, "Cataloged " + file + " as " + checksum.get()
                    + (contentCreated ? " (new content)" : " (known content)"));
            return IngestResult.created(location, contentCreated);
        } catch (SQLException e) {
            ProjectLogger.logError(directory, CONTEXT, "Failed to ingest " + file, e);
            return IngestResult.error();
        } catch (RuntimeException e) {
            // A broken file must not take the scan or the watcher down with it
            ProjectLogger.logError(directory, CONTEXT, "Unexpected failure ingesting " + file, e);
            return IngestResult.error();
        }
    }

    private Content buildContent(Path file, String checksum, String mimeType) {
        MediaMetadata metadata = metadataExtractor.extract(file, mimeType);
        Instant created = null;
        Instant modified = null;
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            created = attrs.creationTime().toInstant();
            modified = attrs.lastModifiedTime().toInstant();
        } catch (IOException e) {
            ProjectLogger.logWarn(file.getParent(), CONTEXT, "No file timestamps for " + file + ": " + e.getMessage());
        }
        return new Content(
                checksum,
                FileUtils.isVideoMimeType(mimeType),
                metadata.getWidth(),
                metadata.getHeight(),
                metadataExtractor.toJson(metadata.getFields(), mimeType),
                created,
                modified,
                Instant.now()
        );
    }

    /**
     * Removes the location of a file that disappeared from disk. The content stays.
     *
     * @return true if a location was removed, false if there was none
     */
    public boolean removeLocation(Path path) {
        Path file = path.toAbsolutePath().normalize();
        try (Connection conn = database.connect()) {
            Optional<Location> location = locationIndex.find(conn, file);
            if (location.isEmpty()) {
                return false;
            }
            conn.setAutoCommit(false);
            try {
                searchIndex.remove(conn, location.get().getId());
                locationIndex.delete(conn, location.get().getId());
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            conn.setAutoCommit(true);
            ProjectLogger.logInfo(file.getParent(), CONTEXT, "Removed location of deleted file " + file);
            notifier.schedule(tierFor(conn, file.getParent()));
            return true;
        } catch (SQLException e) {
            ProjectLogger.logError(file.getParent(), CONTEXT, "Failed to remove location " + file, e);
            return false;
        }
    }

    /**
     * Applies a rename or move. The checksum is unchanged; a location already present at the
     * destination (an overwritten file) is replaced.
     * If the source was never cataloged the destination is ingested instead.
     *
     * @return The location now at the destination, if any
     */
    public Optional<Location> move(Path fromPath, Path toPath) {
        Path from = fromPath.toAbsolutePath().normalize();
        Path to = toPath.toAbsolutePath().normalize();

        try (Connection conn = database.connect()) {
            Optional<Location> source = locationIndex.find(conn, from);
            if (source.isEmpty()) {
                return Optional.ofNullable(ingest(to).getLocation());
            }
            if (FileUtils.supportedMimeType(to).isEmpty()) {
                // Renamed to something that is no longer media
                removeLocation(from);
                return Optional.empty();
            }

            conn.setAutoCommit(false);
            try {
                Optional<Location> overwritten = locationIndex.find(conn, to);
                if (overwritten.isPresent() && overwritten.get().getId() != source.get().getId()) {
                    searchIndex.remove(conn, overwritten.get().getId());
                    locationIndex.delete(conn, overwritten.get().getId());
                }
                locationIndex.move(conn, source.get().getId(), to.getParent(), to.getFileName().toString(), Instant.now());
                searchIndex.upsert(conn, source.get().getId());
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            conn.setAutoCommit(true);

            Visibility tier = Visibility.mostVisible(tierFor(conn, from.getParent()), tierFor(conn, to.getParent()));
            notifier.schedule(tier);
            ProjectLogger.logInfo(to.getParent(), CONTEXT, "Moved " + from + " to " + to);
            return locationIndex.findById(conn, source.get().getId());
        } catch (SQLException e) {
            ProjectLogger.logError(to.getParent(), CONTEXT, "Failed to move " + from + " to " + to, e);
            return Optional.empty();
        }
    }

    /**
     * Sets or clears the soft-delete flag of a location.
     *
     * @return true if the location exists
     */
    public boolean setTrashed(long locationId, boolean trashed) {
        try (Connection conn = database.connect()) {
            Optional<Location> location = locationIndex.findById(conn, locationId);
            if (location.isEmpty()) {
                return false;
            }
            locationIndex.setDeleted(conn, locationId, trashed);
            notifier.schedule(tierFor(conn, location.get().getDirectory()));
            return true;
        } catch (SQLException e) {
            ProjectLogger.logError(null, CONTEXT, "Failed to " + (trashed ? "trash" : "restore") + " location " + locationId, e);
            return false;
        }
    }

    /**
     * Deletes the file of a location from disk and removes the location. When it was the
     * last location of its content, the content row goes too.
     *
     * @return the checksum of the content that was removed along with its last location
     */
    public Optional<String> permanentlyDelete(long locationId) {
        try (Connection conn = database.connect()) {
            Optional<Location> found = locationIndex.findById(conn, locationId);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            Location location = found.get();
            try {
                Files.deleteIfExists(location.getPath());
            } catch (IOException e) {
                ProjectLogger.logError(location.getDirectory(), CONTEXT, "Could not delete " + location.getPath() + " from disk", e);
                return Optional.empty();
            }

            boolean contentRemoved;
            conn.setAutoCommit(false);
            try {
                searchIndex.remove(conn, locationId);
                locationIndex.delete(conn, locationId);
                contentRemoved = contentStore.deleteIfUnreferenced(conn, location.getChecksum());
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            conn.setAutoCommit(true);

            if (contentRemoved) {
                knownChecksums.remove(location.getChecksum());
            }
            ProjectLogger.logInfo(location.getDirectory(), CONTEXT, "Permanently deleted " + location.getPath()
                    + (contentRemoved ? " and its content " + location.getChecksum() : ""));
            notifier.schedule(tierFor(conn, location.getDirectory()));
            return contentRemoved ? Optional.of(location.getChecksum()) : Optional.empty();
        } catch (SQLException e) {
            ProjectLogger.logError(null, CONTEXT, "Failed to permanently delete location " + locationId, e);
            return Optional.empty();
        }
    }

    public Optional<Location> findLocation(Path path) {
        try (Connection conn = database.connect()) {
            return locationIndex.find(conn, path);
        } catch (SQLException e) {
            ProjectLogger.logError(null, CONTEXT, "Lookup failed for " + path, e);
            return Optional.empty();
        }
    }

    /**
     * @return the watched root registered for exactly this directory
     */
    public Optional<WatchedRoot> rootFor(Path directory) {
        try (Connection conn = database.connect()) {
            return rootRepository.findByPath(conn, directory);
        } catch (SQLException e) {
            ProjectLogger.logError(directory, CONTEXT, "Root lookup failed for " + directory, e);
            return Optional.empty();
        }
    }

    /**
     * Finds a readable original for a checksum, preferring locations not in the trash.
     */
    public Optional<AssetSource> resolveAssetSource(String checksum) {
        try (Connection conn = database.connect()) {
            Optional<Content> content = contentStore.find(conn, checksum);
            if (content.isEmpty()) {
                return Optional.empty();
            }
            List<Location> locations = locationIndex.findByChecksum(conn, checksum);
            Location best = null;
            for (Location location : locations) {
                if (!Files.isRegularFile(location.getPath())) {
                    continue;
                }
                if (best == null || (best.isDeleted() && !location.isDeleted())) {
                    best = location;
                }
            }
            if (best == null) {
                return Optional.empty();
            }
            return Optional.of(new AssetSource(checksum, best.getPath(), content.get().isVideo(),
                    tierFor(conn, best.getDirectory())));
        } catch (SQLException e) {
            ProjectLogger.logError(null, CONTEXT, "Source lookup failed for " + checksum, e);
            return Optional.empty();
        }
    }

    /**
     * Visibility tier of the root holding a directory: the root registered for the directory
     * itself, else its closest registered ancestor. Unknown directories are restricted.
     */
    Visibility tierFor(Connection conn, Path directory) throws SQLException {
        for (Path candidate = directory; candidate != null; candidate = candidate.getParent()) {
            Optional<WatchedRoot> root = rootRepository.findByPath(conn, candidate);
            if (root.isPresent()) {
                return root.get().getVisibility();
            }
        }
        return Visibility.RESTRICTED;
    }
}
