package com.pantiviewer.model;

import java.nio.file.Path;

/**
 * Answer of the derived asset cache: the published file, or a reason there is none yet.
 */
public class AssetLookup {

    public enum Status {
        READY,          // The file exists and can be served
        PENDING,        // A build is queued or running
        UNAVAILABLE     // No readable source for this checksum
    }

    private static final AssetLookup PENDING = new AssetLookup(Status.PENDING, null);
    private static final AssetLookup UNAVAILABLE = new AssetLookup(Status.UNAVAILABLE, null);

    private final Status status;
    private final Path path;

    private AssetLookup(Status status, Path path) {
        this.status = status;
        this.path = path;
    }

    public static AssetLookup ready(Path path) {
        return new AssetLookup(Status.READY, path);
    }

    public static AssetLookup pending() {
        return PENDING;
    }

    public static AssetLookup unavailable() {
        return UNAVAILABLE;
    }

    public Status getStatus() { return status; }
    public Path getPath() { return path; }

    public boolean isReady() {
        return status == Status.READY;
    }

    @Override
    public String toString() {
        return status + (path != null ? " " + path : "");
    }
}
