package com.pantiviewer.model;

/**
 * Kinds of derived assets kept in the cache. The suffix is part of the on-disk file name.
 */
public enum AssetKind {
    THUMBNAIL("thumb", "thumbnails"),
    PREVIEW("preview", "previews");

    private final String suffix;
    private final String directoryName;

    AssetKind(String suffix, String directoryName) {
        this.suffix = suffix;
        this.directoryName = directoryName;
    }

    public String getSuffix() { return suffix; }
    public String getDirectoryName() { return directoryName; }

    /**
     * @return the cache file name, {@code {checksum}_{kind}.jpg}
     */
    public String fileName(String checksum) {
        return checksum + "_" + suffix + ".jpg";
    }
}
