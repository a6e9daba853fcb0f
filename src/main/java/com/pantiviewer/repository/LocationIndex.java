package com.pantiviewer.repository;

import com.pantiviewer.model.Location;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Catalog of filesystem instances. Each (directory, filename) pair appears at most once
 * and points at one content checksum.
 */
public class LocationIndex {

    private static final String COLUMNS = "id, directory, filename, checksum, deleted, date_scanned";

    private static final String SQL_FIND = "SELECT " + COLUMNS + " FROM locations WHERE directory = ? AND filename = ?";
    private static final String SQL_FIND_BY_ID = "SELECT " + COLUMNS + " FROM locations WHERE id = ?";
    private static final String SQL_FIND_BY_CHECKSUM = "SELECT " + COLUMNS + " FROM locations WHERE checksum = ? ORDER BY id";
    private static final String SQL_FIND_IN_DIRECTORY = "SELECT " + COLUMNS + " FROM locations WHERE directory = ? ORDER BY filename";
    private static final String SQL_FIND_UNDER = "SELECT " + COLUMNS
            + " FROM locations WHERE directory = ? OR substr(directory, 1, length(?)) = ? ORDER BY id";
    private static final String SQL_FIND_ALL = "SELECT " + COLUMNS + " FROM locations ORDER BY id";
    private static final String SQL_INSERT = "INSERT INTO locations (directory, filename, checksum, deleted, date_scanned) VALUES (?, ?, ?, 0, ?)";
    private static final String SQL_DELETE = "DELETE FROM locations WHERE id = ?";
    private static final String SQL_MOVE = "UPDATE locations SET directory = ?, filename = ?, date_scanned = ? WHERE id = ?";
    private static final String SQL_SET_DELETED = "UPDATE locations SET deleted = ? WHERE id = ?";
    private static final String SQL_FIND_ORPHANS = """
            SELECT id FROM locations
            WHERE directory NOT IN (SELECT path FROM watched_roots)""";

    public Optional<Location> find(Connection conn, Path directory, String filename) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_FIND)) {
            pstmt.setString(1, normalize(directory));
            pstmt.setString(2, filename);
            return single(pstmt);
        }
    }

    public Optional<Location> find(Connection conn, Path file) throws SQLException {
        Path absolute = file.toAbsolutePath().normalize();
        return find(conn, absolute.getParent(), absolute.getFileName().toString());
    }

    public Optional<Location> findById(Connection conn, long id) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_FIND_BY_ID)) {
            pstmt.setLong(1, id);
            return single(pstmt);
        }
    }

    public List<Location> findByChecksum(Connection conn, String checksum) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_FIND_BY_CHECKSUM)) {
            pstmt.setString(1, checksum);
            return list(pstmt);
        }
    }

    public List<Location> findInDirectory(Connection conn, Path directory) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_FIND_IN_DIRECTORY)) {
            pstmt.setString(1, normalize(directory));
            return list(pstmt);
        }
    }

    /**
     * @return locations in the directory or any directory beneath it
     */
    public List<Location> findUnder(Connection conn, Path directory) throws SQLException {
        String dir = normalize(directory);
        String prefix = dir.endsWith(File.separator) ? dir : dir + File.separator;
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_FIND_UNDER)) {
            pstmt.setString(1, dir);
            pstmt.setString(2, prefix);
            pstmt.setString(3, prefix);
            return list(pstmt);
        }
    }

    public List<Location> findAll(Connection conn) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_FIND_ALL)) {
            return list(pstmt);
        }
    }

    /**
     * Inserts a location. Fails with a constraint violation if the pair is already cataloged.
     */
    public Location insert(Connection conn, Path directory, String filename, String checksum, Instant scannedAt) throws SQLException {
        String dir = normalize(directory);
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_INSERT)) {
            pstmt.setString(1, dir);
            pstmt.setString(2, filename);
            pstmt.setString(3, checksum);
            pstmt.setString(4, ContentStore.toText(scannedAt));
            pstmt.executeUpdate();
        }
        long id;
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
            rs.next();
            id = rs.getLong(1);
        }
        return new Location(id, Paths.get(dir), filename, checksum, false, scannedAt);
    }

    public boolean delete(Connection conn, long id) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_DELETE)) {
            pstmt.setLong(1, id);
            return pstmt.executeUpdate() > 0;
        }
    }

    public void move(Connection conn, long id, Path newDirectory, String newFilename, Instant scannedAt) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_MOVE)) {
            pstmt.setString(1, normalize(newDirectory));
            pstmt.setString(2, newFilename);
            pstmt.setString(3, ContentStore.toText(scannedAt));
            pstmt.setLong(4, id);
            pstmt.executeUpdate();
        }
    }

    public boolean setDeleted(Connection conn, long id, boolean deleted) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_SET_DELETED)) {
            pstmt.setInt(1, deleted ? 1 : 0);
            pstmt.setLong(2, id);
            return pstmt.executeUpdate() > 0;
        }
    }

    /**
     * @return ids of locations whose directory is no longer a watched root
     */
    public List<Long> findOrphanIds(Connection conn) throws SQLException {
        List<Long> ids = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(SQL_FIND_ORPHANS)) {
            while (rs.next()) {
                ids.add(rs.getLong(1));
            }
        }
        return ids;
    }

    private Optional<Location> single(PreparedStatement pstmt) throws SQLException {
        try (ResultSet rs = pstmt.executeQuery()) {
            if (rs.next()) {
                return Optional.of(map(rs));
            }
        }
        return Optional.empty();
    }

    private List<Location> list(PreparedStatement pstmt) throws SQLException {
        List<Location> locations = new ArrayList<>();
        try (ResultSet rs = pstmt.executeQuery()) {
            while (rs.next()) {
                locations.add(map(rs));
            }
        }
        return locations;
    }

    private Location map(ResultSet rs) throws SQLException {
        return new Location(
                rs.getLong("id"),
                Paths.get(rs.getString("directory")),
                rs.getString("filename"),
                rs.getString("checksum"),
                rs.getInt("deleted") != 0,
                ContentStore.fromText(rs.getString("date_scanned"))
        );
    }

    private static String normalize(Path directory) {
        return directory.toAbsolutePath().normalize().toString();
    }
}
