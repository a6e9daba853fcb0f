package com.pantiviewer.repository;

import com.pantiviewer.model.Visibility;
import com.pantiviewer.model.WatchedRoot;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Access to the watched roots table. Paths are stored absolute and normalized.
 */
public class WatchedRootRepository {

    private static final String SQL_SELECT_ALL = """
            SELECT id, path, short_name, description, parent, is_ignored, visibility, configured
            FROM watched_roots
            ORDER BY path""";

    private static final String SQL_SELECT_BY_PATH = """
            SELECT id, path, short_name, description, parent, is_ignored, visibility, configured
            FROM watched_roots
            WHERE path = ?""";

    private static final String SQL_SELECT_ROOT_TAGS = """
            SELECT rt.root_id, t.name
            FROM root_tags rt JOIN tags t ON t.id = rt.tag_id""";

    private static final String SQL_UPSERT_CONFIGURED = """
            INSERT INTO watched_roots (path, short_name, description, parent, is_ignored, visibility, configured)
            VALUES (?, ?, ?, NULL, ?, ?, 1)
            ON CONFLICT(path) DO UPDATE SET
             description = COALESCE(excluded.description, watched_roots.description),
             is_ignored = excluded.is_ignored,
             visibility = excluded.visibility,
             configured = 1""";

    private static final String SQL_INSERT_DISCOVERED = """
            INSERT OR IGNORE INTO watched_roots (path, short_name, description, parent, is_ignored, visibility, configured)
            VALUES (?, ?, ?, ?, 0, ?, 0)""";

    private static final String SQL_ADD_TAG = "INSERT OR IGNORE INTO root_tags (root_id, tag_id) VALUES (?, ?)";

    /**
     * @return every root, parents before children (sorted by path)
     */
    public List<WatchedRoot> findAll(Connection conn) throws SQLException {
        Map<Integer, Set<String>> tags = loadTags(conn);
        List<WatchedRoot> roots = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(SQL_SELECT_ALL)) {
            while (rs.next()) {
                roots.add(map(rs, tags));
            }
        }
        return roots;
    }

    public Optional<WatchedRoot> findByPath(Connection conn, Path path) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_SELECT_BY_PATH)) {
            pstmt.setString(1, normalize(path));
            try (ResultSet rs = pstmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(map(rs, loadTags(conn)));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Inserts or updates a root declared in the settings. Tags are not touched here.
     */
    public WatchedRoot upsertConfigured(Connection conn, Path path, String description, boolean ignored,
                                       Visibility visibility) throws SQLException {
        String normalized = normalize(path);
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_UPSERT_CONFIGURED)) {
            pstmt.setString(1, normalized);
            pstmt.setString(2, shortName(path));
            pstmt.setString(3, description);
            pstmt.setInt(4, ignored ? 1 : 0);
            pstmt.setString(5, visibility.name());
            pstmt.executeUpdate();
        }
        return findByPath(conn, path)
                .orElseThrow(() -> new SQLException("Watched root vanished after upsert: " + normalized));
    }

    /**
     * Registers a subdirectory found by a scan as a restricted root.
     *
     * @return true if the directory was not registered before
     */
    public boolean registerDiscovered(Connection conn, Path directory, Path parent) throws SQLException {
        String name = shortName(directory);
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_INSERT_DISCOVERED)) {
            pstmt.setString(1, normalize(directory));
            pstmt.setString(2, name);
            pstmt.setString(3, "Auto-added: " + name);
            pstmt.setString(4, parent == null ? null : normalize(parent));
            pstmt.setString(5, Visibility.RESTRICTED.name());
            return pstmt.executeUpdate() > 0;
        }
    }

    public void addTag(Connection conn, int rootId, int tagId) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_ADD_TAG)) {
            pstmt.setInt(1, rootId);
            pstmt.setInt(2, tagId);
            pstmt.executeUpdate();
        }
    }

    private Map<Integer, Set<String>> loadTags(Connection conn) throws SQLException {
        Map<Integer, Set<String>> tags = new HashMap<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(SQL_SELECT_ROOT_TAGS)) {
            while (rs.next()) {
                tags.computeIfAbsent(rs.getInt("root_id"), id -> new TreeSet<>()).add(rs.getString("name"));
            }
        }
        return tags;
    }

    private WatchedRoot map(ResultSet rs, Map<Integer, Set<String>> tags) throws SQLException {
        int id = rs.getInt("id");
        String parent = rs.getString("parent");
        return new WatchedRoot(
                id,
                Paths.get(rs.getString("path")),
                rs.getString("short_name"),
                rs.getString("description"),
                parent == null ? null : Paths.get(parent),
                rs.getInt("is_ignored") != 0,
                Visibility.valueOf(rs.getString("visibility")),
                rs.getInt("configured") != 0,
                tags.getOrDefault(id, new TreeSet<>())
        );
    }

    private static String shortName(Path path) {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }

    static String normalize(Path path) {
        return path.toAbsolutePath().normalize().toString();
    }
}
