package com.pantiviewer.repository;

import com.pantiviewer.model.Content;

import java.io.File;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog of unique content, keyed by checksum. Owns content rows and their tag
 * associations. Every method runs on the caller's connection so it joins the caller's
 * transaction.
 */
public class ContentStore {

    private static final String SQL_EXISTS = "SELECT 1 FROM content WHERE checksum = ?";

    private static final String SQL_INSERT = """
            INSERT INTO content (checksum, is_video, width, height, metadata, date_created, date_modified, date_indexed)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(checksum) DO NOTHING""";

    private static final String SQL_SELECT = """
            SELECT checksum, is_video, width, height, metadata, date_created, date_modified, date_indexed
            FROM content WHERE checksum = ?""";

    private static final String SQL_UPDATE_METADATA = "UPDATE content SET width = ?, height = ?, metadata = ? WHERE checksum = ?";

    private static final String SQL_ADD_TAG = "INSERT OR IGNORE INTO content_tags (checksum, tag_id) VALUES (?, ?)";

    private static final String SQL_SELECT_TAGS = """
            SELECT t.name FROM content_tags ct JOIN tags t ON t.id = ct.tag_id
            WHERE ct.checksum = ? ORDER BY t.name""";

    // Content reachable through a location in the directory or any directory beneath it
    private static final String SQL_ADD_TAG_UNDER = """
            INSERT OR IGNORE INTO content_tags (checksum, tag_id)
            SELECT DISTINCT l.checksum, ? FROM locations l
            WHERE l.directory = ? OR substr(l.directory, 1, length(?)) = ?""";

    private static final String SQL_DELETE_UNREFERENCED = """
            DELETE FROM content
            WHERE checksum = ? AND NOT EXISTS (SELECT 1 FROM locations WHERE checksum = ?)""";

    public boolean exists(Connection conn, String checksum) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_EXISTS)) {
            pstmt.setString(1, checksum);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Inserts the content row unless the checksum is already cataloged.
     *
     * @return true if this call created the row
     */
    public boolean insertIfAbsent(Connection conn, Content content) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_INSERT)) {
            pstmt.setString(1, content.getChecksum());
            pstmt.setInt(2, content.isVideo() ? 1 : 0);
            setNullableInt(pstmt, 3, content.getWidth());
            setNullableInt(pstmt, 4, content.getHeight());
            pstmt.setString(5, content.getMetadataJson());
            pstmt.setString(6, toText(content.getCreated()));
            pstmt.setString(7, toText(content.getModified()));
            pstmt.setString(8, toText(content.getIndexed()));
            return pstmt.executeUpdate() > 0;
        }
    }

    public Optional<Content> find(Connection conn, String checksum) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_SELECT)) {
            pstmt.setString(1, checksum);
            try (ResultSet rs = pstmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new Content(
                            rs.getString("checksum"),
                            rs.getInt("is_video") != 0,
                            getNullableInt(rs, "width"),
                            getNullableInt(rs, "height"),
                            rs.getString("metadata"),
                            fromText(rs.getString("date_created")),
                            fromText(rs.getString("date_modified")),
                            fromText(rs.getString("date_indexed"))
                    ));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Loads every known checksum, used to seed the in-memory working set before a scan.
     */
    public Set<String> allChecksums(Connection conn) throws SQLException {
        Set<String> checksums = new HashSet<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT checksum FROM content")) {
            while (rs.next()) {
                checksums.add(rs.getString(1));
            }
        }
        return checksums;
    }

    public void updateMetadata(Connection conn, String checksum, Integer width, Integer height, String metadataJson) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_UPDATE_METADATA)) {
            setNullableInt(pstmt, 1, width);
            setNullableInt(pstmt, 2, height);
            pstmt.setString(3, metadataJson);
            pstmt.setString(4, checksum);
            pstmt.executeUpdate();
        }
    }

    /**
     * @return true if the association did not exist before
     */
    public boolean addTag(Connection conn, String checksum, int tagId) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_ADD_TAG)) {
            pstmt.setString(1, checksum);
            pstmt.setInt(2, tagId);
            return pstmt.executeUpdate() > 0;
        }
    }

    public List<String> tagsFor(Connection conn, String checksum) throws SQLException {
        List<String> tags = new ArrayList<>();
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_SELECT_TAGS)) {
            pstmt.setString(1, checksum);
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    tags.add(rs.getString(1));
                }
            }
        }
        return tags;
    }

    /**
     * Adds a tag to every content with a location in {@code directory} or below it.
     * Existing associations are left alone.
     *
     * @return the number of associations added
     */
    public int addTagUnder(Connection conn, Path directory, int tagId) throws SQLException {
        String dir = directory.toAbsolutePath().normalize().toString();
        String prefix = dir.endsWith(File.separator) ? dir : dir + File.separator;
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_ADD_TAG_UNDER)) {
            pstmt.setInt(1, tagId);
            pstmt.setString(2, dir);
            pstmt.setString(3, prefix);
            pstmt.setString(4, prefix);
            return pstmt.executeUpdate();
        }
    }

    /**
     * Deletes the content row when no location references it any more. Tag associations
     * go with it through the cascade.
     *
     * @return true if the row was deleted
     */
    public boolean deleteIfUnreferenced(Connection conn, String checksum) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_DELETE_UNREFERENCED)) {
            pstmt.setString(1, checksum);
            pstmt.setString(2, checksum);
            return pstmt.executeUpdate() > 0;
        }
    }

    static String toText(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    static Instant fromText(String text) {
        return text == null ? null : Instant.parse(text);
    }

    private static void setNullableInt(PreparedStatement pstmt, int index, Integer value) throws SQLException {
        if (value == null) {
            pstmt.setNull(index, Types.INTEGER);
        } else {
            pstmt.setInt(index, value);
        }
    }

    private static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
