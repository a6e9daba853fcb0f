package com.pantiviewer.service;

import com.pantiviewer.model.Content;
import com.pantiviewer.model.Location;
import com.pantiviewer.model.MediaMetadata;
import com.pantiviewer.model.ReprocessScope;
import com.pantiviewer.model.Tag;
import com.pantiviewer.model.Visibility;
import com.pantiviewer.model.WatchedRoot;
import com.pantiviewer.repository.CatalogDatabase;
import com.pantiviewer.repository.ContentStore;
import com.pantiviewer.repository.DatabaseException;
import com.pantiviewer.repository.LocationIndex;
import com.pantiviewer.repository.SearchIndex;
import com.pantiviewer.repository.TagRepository;
import com.pantiviewer.repository.WatchedRootRepository;
import com.pantiviewer.util.FileUtils;
import com.pantiviewer.util.IngestSettings;
import com.pantiviewer.util.ProjectLogger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog-wide consistency passes and watched root administration: orphan cleanup,
 * folder tag reconciliation, metadata reprocessing and search index rebuilds.
 */
public class CatalogMaintenance {

    private static final String CONTEXT = "CatalogMaintenance";

    private final CatalogDatabase database;
    private final WatchedRootRepository rootRepository;
    private final TagRepository tagRepository;
    private final ContentStore contentStore;
    private final LocationIndex locationIndex;
    private final SearchIndex searchIndex;
    private final MetadataExtractor metadataExtractor;
    private final ChangeNotifier notifier;

    public CatalogMaintenance(CatalogDatabase database, WatchedRootRepository rootRepository, TagRepository tagRepository,
                              ContentStore contentStore, LocationIndex locationIndex, SearchIndex searchIndex,
                              MetadataExtractor metadataExtractor, ChangeNotifier notifier) {
        this.database = database;
        this.rootRepository = rootRepository;
        this.tagRepository = tagRepository;
        this.contentStore = contentStore;
        this.locationIndex = locationIndex;
        this.searchIndex = searchIndex;
        this.metadataExtractor = metadataExtractor;
        this.notifier = notifier;
    }

    /**
     * @return all watched roots, parents before children
     */
    public List<WatchedRoot> roots() {
        try (Connection conn = database.connect()) {
            return rootRepository.findAll(conn);
        } catch (SQLException e) {
            throw new DatabaseException("Failed to load watched roots", e);
        }
    }

    /**
     * Inserts or updates the roots declared in the settings, with their tags.
     * Roots discovered by earlier scans are left as they are.
     */
    public List<WatchedRoot> registerConfiguredRoots(List<IngestSettings.RootSettings> configured) {
        List<WatchedRoot> result = new ArrayList<>();
        try (Connection conn = database.connect()) {
            conn.setAutoCommit(false);
            try {
                for (IngestSettings.RootSettings root : configured) {
                    WatchedRoot saved = rootRepository.upsertConfigured(conn, root.getPath(), root.getDescription(),
                            root.isIgnored(), root.getVisibility());
                    for (String tagName : root.getTags()) {
                        Tag tag = tagRepository.getOrCreate(conn, tagName);
                        rootRepository.addTag(conn, saved.getId(), tag.getId());
                    }
                    result.add(saved);
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to register configured roots", e);
        }
        for (WatchedRoot root : result) {
            ProjectLogger.logInfo(root.getPath(), CONTEXT, "Configured root " + root);
        }
        return result;
    }

    /**
     * Registers a directory found during a scan as a restricted root. Commits immediately.
     *
     * @return true if the directory was new
     */
    public boolean registerDiscoveredDirectory(Path directory, Path parent) {
        try (Connection conn = database.connect()) {
            return rootRepository.registerDiscovered(conn, directory, parent);
        } catch (SQLException e) {
            ProjectLogger.logError(directory, CONTEXT, "Failed to register directory " + directory, e);
            return false;
        }
    }

    /**
     * Attaches a tag to a watched root. Content beneath it gets the tag on the next
     * reconciliation pass.
     *
     * @throws IllegalArgumentException if the path is not a watched root
     */
    public void tagRoot(Path rootPath, String tagName) {
        try (Connection conn = database.connect()) {
            WatchedRoot root = rootRepository.findByPath(conn, rootPath)
                    .orElseThrow(() -> new IllegalArgumentException("Not a watched root: " + rootPath));
            Tag tag = tagRepository.getOrCreate(conn, tagName);
            rootRepository.addTag(conn, root.getId(), tag.getId());
        } catch (SQLException e) {
            throw new DatabaseException("Failed to tag root " + rootPath, e);
        }
    }

    public Set<String> loadKnownChecksums() {
        try (Connection conn = database.connect()) {
            return contentStore.allChecksums(conn);
        } catch (SQLException e) {
            ProjectLogger.logError(null, CONTEXT, "Failed to load known checksums", e);
            return Collections.emptySet();
        }
    }

    /**
     * Deletes every location whose directory is no longer a watched root. Content rows stay.
     *
     * @return the number of locations removed
     */
    public int cleanupOrphans() {
        int removed = 0;
        try (Connection conn = database.connect()) {
            conn.setAutoCommit(false);
            try {
                for (Long id : locationIndex.findOrphanIds(conn)) {
                    searchIndex.remove(conn, id);
                    if (locationIndex.delete(conn, id)) {
                        removed++;
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            ProjectLogger.logError(null, CONTEXT, "Orphan cleanup failed", e);
            return 0;
        }
        if (removed > 0) {
            ProjectLogger.logInfo(null, CONTEXT, "Removed " + removed + " locations outside any watched root");
            notifier.schedule(Visibility.PUBLIC);
        }
        return removed;
    }

    /**
     * Adds every tagged root's tags to the content beneath it. Never removes a tag.
     *
     * @return the number of tag associations added
     */
    public int applyFolderTags() {
        int added = 0;
        Visibility tier = null;
        try (Connection conn = database.connect()) {
            for (WatchedRoot root : rootRepository.findAll(conn)) {
                if (root.getTags().isEmpty()) {
                    continue;
                }
                int addedForRoot = 0;
                conn.setAutoCommit(false);
                try {
                    for (String tagName : root.getTags()) {
                        Tag tag = tagRepository.getOrCreate(conn, tagName);
                        addedForRoot += contentStore.addTagUnder(conn, root.getPath(), tag.getId());
                    }
                    if (addedForRoot > 0) {
                        // Tags are part of the indexed document
                        for (Location location : locationIndex.findUnder(conn, root.getPath())) {
                            searchIndex.upsert(conn, location.getId());
                        }
                    }
                    conn.commit();
                } catch (SQLException e) {
                    conn.rollback();
                    throw e;
                } finally {
                    conn.setAutoCommit(true);
                }
                if (addedForRoot > 0) {
                    ProjectLogger.logInfo(root.getPath(), CONTEXT, "Applied folder tags " + root.getTags() + " to " + addedForRoot + " items");
                    added += addedForRoot;
                    tier = tier == null ? root.getVisibility() : Visibility.mostVisible(tier, root.getVisibility());
                }
            }
        } catch (SQLException e) {
            ProjectLogger.logError(null, CONTEXT, "Folder tag reconciliation failed", e);
        }
        if (tier != null) {
            notifier.schedule(tier);
        }
        return added;
    }

    /**
     * Re-extracts metadata and dimensions for the content reachable through the scope.
     * The stored MIME type is kept. When the original is missing or unreadable the stale
     * metadata stays and a warning is logged.
     *
     * @return the number of content rows updated
     */
    public int reprocessMetadata(ReprocessScope scope) {
        int updated = 0;
        try (Connection conn = database.connect()) {
            Map<String, Location> byChecksum = new LinkedHashMap<>();
            for (Location location : locationsIn(conn, scope)) {
                Location current = byChecksum.get(location.getChecksum());
                if (current == null || (!Files.isRegularFile(current.getPath()) && Files.isRegularFile(location.getPath()))) {
                    byChecksum.put(location.getChecksum(), location);
                }
            }

            for (Map.Entry<String, Location> entry : byChecksum.entrySet()) {
                if (reprocess(conn, entry.getKey(), entry.getValue())) {
                    updated++;
                }
            }
        } catch (SQLException e) {
            ProjectLogger.logError(null, CONTEXT, "Metadata reprocessing failed", e);
        }
        ProjectLogger.logInfo(scope.getDirectory(), CONTEXT, "Reprocessed metadata of " + updated + " items (" + scope.getKind() + ")");
        if (updated > 0) {
            notifier.schedule(Visibility.PUBLIC);
        }
        return updated;
    }

    private boolean reprocess(Connection conn, String checksum, Location location) throws SQLException {
        Optional<Content> content = contentStore.find(conn, checksum);
        if (content.isEmpty()) {
            return false;
        }
        Path file = location.getPath();
        if (!Files.isRegularFile(file)) {
            ProjectLogger.logWarn(location.getDirectory(), CONTEXT, "Original missing, keeping stale metadata for " + checksum + ": " + file);
            return false;
        }

        String mimeType = metadataExtractor.mimeTypeOf(content.get().getMetadataJson());
        if (mimeType == null) {
            mimeType = FileUtils.detectMimeType(file).orElse(null);
        }
        MediaMetadata metadata = metadataExtractor.extract(file, mimeType);
        if (metadata.isEmpty()) {
            ProjectLogger.logWarn(location.getDirectory(), CONTEXT, "Nothing readable, keeping stale metadata for " + checksum + ": " + file);
            return false;
        }

        conn.setAutoCommit(false);
        try {
            contentStore.updateMetadata(conn, checksum, metadata.getWidth(), metadata.getHeight(),
                    metadataExtractor.toJson(metadata.getFields(), mimeType));
            for (Location sibling : locationIndex.findByChecksum(conn, checksum)) {
                searchIndex.upsert(conn, sibling.getId());
            }
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
        return true;
    }

    private List<Location> locationsIn(Connection conn, ReprocessScope scope) throws SQLException {
        switch (scope.getKind()) {
            case LOCATION:
                return locationIndex.findById(conn, scope.getLocationId())
                        .map(Collections::singletonList)
                        .orElse(Collections.emptyList());
            case DIRECTORY:
                return locationIndex.findInDirectory(conn, scope.getDirectory());
            default:
                return locationIndex.findAll(conn);
        }
    }

    /**
     * Recreates the search row of every location.
     *
     * @return the number of rows written
     */
    public int rebuildSearchIndex() {
        try (Connection conn = database.connect()) {
            conn.setAutoCommit(false);
            try {
                int count = searchIndex.rebuild(conn);
                conn.commit();
                ProjectLogger.logInfo(null, CONTEXT, "Rebuilt search index with " + count + " rows");
                return count;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            ProjectLogger.logError(null, CONTEXT, "Search index rebuild failed", e);
            return 0;
        }
    }
}
