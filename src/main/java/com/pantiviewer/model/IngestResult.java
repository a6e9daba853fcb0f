package com.pantiviewer.model;

/**
 * Result of ingesting a single path.
 */
public class IngestResult {
    private final IngestOutcome outcome;
    private final Location location;
    private final boolean contentCreated;

    private IngestResult(IngestOutcome outcome, Location location, boolean contentCreated) {
        this.outcome = outcome;
        this.location = location;
        this.contentCreated = contentCreated;
    }

    public static IngestResult created(Location location, boolean contentCreated) {
        return new IngestResult(IngestOutcome.NEW, location, contentCreated);
    }

    public static IngestResult duplicate(Location existing) {
        return new IngestResult(IngestOutcome.DUPLICATE, existing, false);
    }

    public static IngestResult unsupported() {
        return new IngestResult(IngestOutcome.SKIPPED_UNSUPPORTED, null, false);
    }

    public static IngestResult error() {
        return new IngestResult(IngestOutcome.ERROR, null, false);
    }

    public IngestOutcome getOutcome() { return outcome; }

    /**
     * @return the new or already existing location, null when nothing was cataloged.
     */
    public Location getLocation() { return location; }

    /**
     * @return true when this ingest saw the checksum for the first time
     */
    public boolean isContentCreated() { return contentCreated; }

    @Override
    public String toString() {
        return outcome + (location != null ? " " + location.getPath() : "");
    }
}
