package com.pantiviewer.model;

import java.time.Instant;

/**
 * One catalog entry per unique checksum of media bytes.
 */
public class Content {
    private final String checksum;
    private final boolean video;
    private final Integer width;
    private final Integer height;
    private final String metadataJson;
    private final Instant created;
    private final Instant modified;
    private final Instant indexed;

    public Content(String checksum, boolean video, Integer width, Integer height, String metadataJson,
                   Instant created, Instant modified, Instant indexed) {
        this.checksum = checksum;
        this.video = video;
        this.width = width;
        this.height = height;
        this.metadataJson = metadataJson;
        this.created = created;
        this.modified = modified;
        this.indexed = indexed;
    }

    public String getChecksum() { return checksum; }
    public boolean isVideo() { return video; }
    public Integer getWidth() { return width; }
    public Integer getHeight() { return height; }
    public String getMetadataJson() { return metadataJson; }
    public Instant getCreated() { return created; }
    public Instant getModified() { return modified; }
    public Instant getIndexed() { return indexed; }
}
