package com.pantiviewer.repository;

import com.pantiviewer.model.Tag;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Access to the shared tag vocabulary.
 */
public class TagRepository {

    private static final String SQL_INSERT_IGNORE = "INSERT OR IGNORE INTO tags (name) VALUES (?)";
    private static final String SQL_FIND_BY_NAME = "SELECT id, name FROM tags WHERE name = ?";

    /**
     * Returns the tag with this name, creating it if needed.
     *
     * @throws IllegalArgumentException if the name is blank once normalized
     */
    public Tag getOrCreate(Connection conn, String name) throws SQLException {
        String normalized = Tag.normalize(name);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Tag name must not be blank");
        }
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_INSERT_IGNORE)) {
            pstmt.setString(1, normalized);
            pstmt.executeUpdate();
        }
        return findByName(conn, normalized)
                .orElseThrow(() -> new SQLException("Tag vanished after insert: " + normalized));
    }

    public Optional<Tag> findByName(Connection conn, String name) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_FIND_BY_NAME)) {
            pstmt.setString(1, Tag.normalize(name));
            try (ResultSet rs = pstmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new Tag(rs.getInt("id"), rs.getString("name")));
                }
            }
        }
        return Optional.empty();
    }
}
