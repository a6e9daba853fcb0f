package com.pantiviewer.model;

import java.nio.file.Path;

/**
 * Selects the locations whose content metadata is re-extracted.
 */
public class ReprocessScope {

    public enum Kind { LOCATION, DIRECTORY, ALL }

    private final Kind kind;
    private final long locationId;
    private final Path directory;

    private ReprocessScope(Kind kind, long locationId, Path directory) {
        this.kind = kind;
        this.locationId = locationId;
        this.directory = directory;
    }

    public static ReprocessScope location(long locationId) {
        return new ReprocessScope(Kind.LOCATION, locationId, null);
    }

    public static ReprocessScope directory(Path directory) {
        return new ReprocessScope(Kind.DIRECTORY, -1, directory.toAbsolutePath().normalize());
    }

    public static ReprocessScope all() {
        return new ReprocessScope(Kind.ALL, -1, null);
    }

    public Kind getKind() { return kind; }
    public long getLocationId() { return locationId; }
    public Path getDirectory() { return directory; }
}
