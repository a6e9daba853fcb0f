package com.pantiviewer.model;

import java.nio.file.Path;

/**
 * The original file a derived asset is rendered from, and who must hear about the result.
 */
public class AssetSource {
    private final String checksum;
    private final Path file;
    private final boolean video;
    private final Visibility tier;

    public AssetSource(String checksum, Path file, boolean video, Visibility tier) {
        this.checksum = checksum;
        this.file = file;
        this.video = video;
        this.tier = tier;
    }

    public String getChecksum() { return checksum; }
    public Path getFile() { return file; }
    public boolean isVideo() { return video; }
    public Visibility getTier() { return tier; }
}
