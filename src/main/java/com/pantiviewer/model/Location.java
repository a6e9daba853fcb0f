package com.pantiviewer.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One filesystem instance (directory + filename) of a {@link Content}.
 */
public class Location {
    private final long id;
    private final Path directory;
    private final String filename;
    private final String checksum;
    private final boolean deleted;
    private final Instant scannedAt;

    public Location(long id, Path directory, String filename, String checksum, boolean deleted, Instant scannedAt) {
        this.id = id;
        this.directory = directory;
        this.filename = filename;
        this.checksum = checksum;
        this.deleted = deleted;
        this.scannedAt = scannedAt;
    }

    public long getId() { return id; }
    public Path getDirectory() { return directory; }
    public String getFilename() { return filename; }
    public String getChecksum() { return checksum; }
    public boolean isDeleted() { return deleted; }
    public Instant getScannedAt() { return scannedAt; }

    public Path getPath() {
        return directory.resolve(filename);
    }

    @Override
    public String toString() {
        return "Location{" + id + ", " + getPath() + ", " + checksum + (deleted ? ", trashed" : "") + "}";
    }
}
