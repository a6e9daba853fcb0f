package com.pantiviewer.model;

import java.time.Duration;

public class ScanReport {
    private final boolean skipped;
    private final int rootsScanned;
    private final int rootsSkipped;
    private final int directoriesRegistered;
    private final int filesSeen;
    private final int newLocations;
    private final int errors;
    private final Duration duration;

    public ScanReport(boolean skipped, int rootsScanned, int rootsSkipped, int directoriesRegistered,
                      int filesSeen, int newLocations, int errors, Duration duration) {
        this.skipped = skipped;
        this.rootsScanned = rootsScanned;
        this.rootsSkipped = rootsSkipped;
        this.directoriesRegistered = directoriesRegistered;
        this.filesSeen = filesSeen;
        this.newLocations = newLocations;
        this.errors = errors;
        this.duration = duration;
    }

    /**
     * Report of a scan that did not run because another one was in progress.
     */
    public static ScanReport alreadyRunning() {
        return new ScanReport(true, 0, 0, 0, 0, 0, 0, Duration.ZERO);
    }

    public boolean isSkipped() { return skipped; }
    public int getRootsScanned() { return rootsScanned; }
    public int getRootsSkipped() { return rootsSkipped; }
    public int getDirectoriesRegistered() { return directoriesRegistered; }
    public int getFilesSeen() { return filesSeen; }
    public int getNewLocations() { return newLocations; }
    /**
     * Files that could not be cataloged during this scan. They are retried by the next one.
     */
    public int getErrors() { return errors; }
    public Duration getDuration() { return duration; }

    @Override
    public String toString() {
        if (skipped) {
            return "ScanReport{skipped, another scan is running}";
        }
        return String.format("ScanReport{roots=%d, skippedRoots=%d, newDirectories=%d, files=%d, newLocations=%d, errors=%d, took=%dms}",
                rootsScanned, rootsSkipped, directoriesRegistered, filesSeen, newLocations, errors, duration.toMillis());
    }
}
