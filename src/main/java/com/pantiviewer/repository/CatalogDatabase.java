package com.pantiviewer.repository;

import com.pantiviewer.util.ProjectLogger;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Manages the catalog database (a single SQLite file).
 * Owns the schema and its migrations and hands out one connection per caller:
 * connections are never shared between threads. The store runs in WAL mode so the
 * scanner, the watcher and the asset workers can read while one of them writes, and
 * transactions begin IMMEDIATE so a second writer waits on the busy timeout instead of
 * failing on a lock upgrade.
 */
public class CatalogDatabase {
    private static final int CURRENT_DB_VERSION = 1;
    private static final int BUSY_TIMEOUT_MILLIS = 5000;

    private static final String SQL_CREATE_METADATA = """
            CREATE TABLE IF NOT EXISTS metadata (
             version integer PRIMARY KEY
            );""";

    private static final String SQL_CREATE_WATCHED_ROOTS = """
            CREATE TABLE IF NOT EXISTS watched_roots (
             id integer PRIMARY KEY AUTOINCREMENT,
             path text NOT NULL UNIQUE,
             short_name text,
             description text,
             parent text,
             is_ignored integer NOT NULL DEFAULT 0,
             visibility text NOT NULL DEFAULT 'RESTRICTED',
             configured integer NOT NULL DEFAULT 0
            );""";

    private static final String SQL_CREATE_TAGS = """
            CREATE TABLE IF NOT EXISTS tags (
             id integer PRIMARY KEY AUTOINCREMENT,
             name text NOT NULL UNIQUE
            );""";

    private static final String SQL_CREATE_ROOT_TAGS = """
            CREATE TABLE IF NOT EXISTS root_tags (
             root_id integer NOT NULL,
             tag_id integer NOT NULL,
             PRIMARY KEY (root_id, tag_id),
             FOREIGN KEY (root_id) REFERENCES watched_roots(id) ON DELETE CASCADE,
             FOREIGN KEY (tag_id) REFERENCES tags(id) ON DELETE CASCADE
            );""";

    private static final String SQL_CREATE_CONTENT = """
            CREATE TABLE IF NOT EXISTS content (
             checksum text PRIMARY KEY,
             is_video integer NOT NULL DEFAULT 0,
             width integer,
             height integer,
             metadata text,
             date_created text,
             date_modified text,
             date_indexed text
            );""";

    private static final String SQL_CREATE_CONTENT_TAGS = """
            CREATE TABLE IF NOT EXISTS content_tags (
             checksum text NOT NULL,
             tag_id integer NOT NULL,
             PRIMARY KEY (checksum, tag_id),
             FOREIGN KEY (checksum) REFERENCES content(checksum) ON DELETE CASCADE,
             FOREIGN KEY (tag_id) REFERENCES tags(id) ON DELETE CASCADE
            );""";

    private static final String SQL_CREATE_LOCATIONS = """
            CREATE TABLE IF NOT EXISTS locations (
             id integer PRIMARY KEY AUTOINCREMENT,
             directory text NOT NULL,
             filename text NOT NULL,
             checksum text NOT NULL,
             deleted integer NOT NULL DEFAULT 0,
             date_scanned text,
             UNIQUE (directory, filename),
             FOREIGN KEY (checksum) REFERENCES content(checksum)
            );""";

    private static final String SQL_CREATE_LOCATION_FTS = """
            CREATE VIRTUAL TABLE IF NOT EXISTS location_fts USING fts5(
             location_id UNINDEXED,
             path,
             filename,
             prompt,
             negative_prompt,
             model,
             sampler,
             scheduler,
             loras,
             upscaler,
             application,
             tags,
             full_text
            );""";

    private static final String SQL_INDEX_LOCATIONS_CHECKSUM = "CREATE INDEX IF NOT EXISTS idx_locations_checksum ON locations(checksum);";
    private static final String SQL_INDEX_LOCATIONS_DIRECTORY = "CREATE INDEX IF NOT EXISTS idx_locations_directory ON locations(directory);";
    private static final String SQL_INDEX_CONTENT_TAGS_TAG_ID = "CREATE INDEX IF NOT EXISTS idx_content_tags_tag_id ON content_tags(tag_id);";

    private final String connectionUrl;
    private final Path databaseFile;

    public CatalogDatabase(Path databaseFile) {
        this.databaseFile = databaseFile.toAbsolutePath().normalize();
        Path folder = this.databaseFile.getParent();
        if (folder != null && !Files.isDirectory(folder)) {
            try {
                Files.createDirectories(folder);
            } catch (IOException e) {
                throw new DatabaseException("Could not create catalog database directory: " + folder, e);
            }
        }
        this.connectionUrl = "jdbc:sqlite:" + this.databaseFile;
        initialize();
    }

    public Path getDatabaseFile() {
        return databaseFile;
    }

    /**
     * Opens a new connection. The caller owns it and must close it.
     */
    public Connection connect() throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
        config.enforceForeignKeys(true);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        return DriverManager.getConnection(connectionUrl, config.toProperties());
    }

    /**
     * Whether a failed statement was rejected by a UNIQUE or PRIMARY KEY constraint,
     * which ingestion treats as another writer having won the race. Foreign key, NOT NULL
     * and CHECK failures are real errors and do not match.
     */
    public static boolean isConstraintViolation(SQLException e) {
        if (e instanceof SQLiteException) {
            SQLiteErrorCode code = ((SQLiteException) e).getResultCode();
            if (code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY) {
                return true;
            }
            // Without extended result codes only the message tells the constraints apart
            String message = e.getMessage();
            return code == SQLiteErrorCode.SQLITE_CONSTRAINT && message != null
                    && (message.contains("UNIQUE constraint failed") || message.contains("PRIMARY KEY"));
        }
        return "23505".equals(e.getSQLState());
    }

    /**
     * Initializes the schema and handles migrations inside one transaction.
     */
    private void initialize() {
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                int version = 0;
                if (hasMetadataTable(stmt)) {
                    try (ResultSet rs = stmt.executeQuery("SELECT version FROM metadata ORDER BY version DESC LIMIT 1")) {
                        if (rs.next()) {
                            version = rs.getInt("version");
                        }
                    }
                }

                if (version < CURRENT_DB_VERSION) {
                    migrate(conn, version);
                }

                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new DatabaseException("Catalog database initialization failed: " + databaseFile, e);
        }
    }

    private static boolean hasMetadataTable(Statement stmt) throws SQLException {
        try (ResultSet rs = stmt.executeQuery("SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = 'metadata'")) {
            return rs.next();
        }
    }

    private void migrate(Connection conn, int currentVersion) throws SQLException {
        ProjectLogger.logInfo(null, "CatalogDatabase",
                "Migrating catalog " + databaseFile + " from version " + currentVersion + " to " + CURRENT_DB_VERSION);
        try (Statement stmt = conn.createStatement()) {
            if (currentVersion < 1) {
                stmt.execute(SQL_CREATE_METADATA);
                stmt.execute(SQL_CREATE_WATCHED_ROOTS);
                stmt.execute(SQL_CREATE_TAGS);
                stmt.execute(SQL_CREATE_ROOT_TAGS);
                stmt.execute(SQL_CREATE_CONTENT);
                stmt.execute(SQL_CREATE_CONTENT_TAGS);
                stmt.execute(SQL_CREATE_LOCATIONS);
                stmt.execute(SQL_CREATE_LOCATION_FTS);
                stmt.execute(SQL_INDEX_LOCATIONS_CHECKSUM);
                stmt.execute(SQL_INDEX_LOCATIONS_DIRECTORY);
                stmt.execute(SQL_INDEX_CONTENT_TAGS_TAG_ID);
            }
            stmt.execute("INSERT OR REPLACE INTO metadata (version) VALUES (" + CURRENT_DB_VERSION + ")");
        }
    }
}
