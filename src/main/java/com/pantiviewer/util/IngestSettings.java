package com.pantiviewer.util;

import com.pantiviewer.model.AssetKind;
import com.pantiviewer.model.Visibility;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable runtime configuration of the ingestion core. Built by {@link SettingsManager}
 * or directly through {@link #builder()} in tests.
 */
public class IngestSettings {

    public static final int DEFAULT_THUMBNAIL_SIZE = 400;
    public static final int DEFAULT_PREVIEW_SIZE = 1024;
    public static final long DEFAULT_DEBOUNCE_MILLIS = 1500;
    public static final int DEFAULT_ASSET_WORKERS = 4;
    public static final long DEFAULT_SETTLE_MILLIS = 500;
    public static final long DEFAULT_MOVE_WINDOW_MILLIS = 1500;

    private final Path database;
    private final Path cacheRoot;
    private final int thumbnailSize;
    private final int previewSize;
    private final long debounceMillis;
    private final int assetWorkers;
    private final String ffmpegPath;
    private final String ffprobePath;
    private final long settleMillis;
    private final long moveWindowMillis;
    private final List<RootSettings> roots;

    private IngestSettings(Builder b) {
        this.database = b.database;
        this.cacheRoot = b.cacheRoot;
        this.thumbnailSize = b.thumbnailSize;
        this.previewSize = b.previewSize;
        this.debounceMillis = b.debounceMillis;
        this.assetWorkers = b.assetWorkers;
        this.ffmpegPath = b.ffmpegPath;
        this.ffprobePath = b.ffprobePath;
        this.settleMillis = b.settleMillis;
        this.moveWindowMillis = b.moveWindowMillis;
        this.roots = Collections.unmodifiableList(new ArrayList<>(b.roots));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path getDatabase() { return database; }
    public Path getCacheRoot() { return cacheRoot; }
    public int getThumbnailSize() { return thumbnailSize; }
    public int getPreviewSize() { return previewSize; }
    public long getDebounceMillis() { return debounceMillis; }
    public int getAssetWorkers() { return assetWorkers; }
    public String getFfmpegPath() { return ffmpegPath; }
    public String getFfprobePath() { return ffprobePath; }
    public long getSettleMillis() { return settleMillis; }
    public long getMoveWindowMillis() { return moveWindowMillis; }
    public List<RootSettings> getRoots() { return roots; }

    /**
     * @return the bounding size configured for an asset kind
     */
    public int sizeFor(AssetKind kind) {
        return kind == AssetKind.PREVIEW ? previewSize : thumbnailSize;
    }

    /**
     * A root directory declared in the settings file.
     */
    public static class RootSettings {
        private final Path path;
        private final Visibility visibility;
        private final String description;
        private final boolean ignored;
        private final List<String> tags;

        public RootSettings(Path path, Visibility visibility, String description, boolean ignored, List<String> tags) {
            this.path = path.toAbsolutePath().normalize();
            this.visibility = visibility;
            this.description = description;
            this.ignored = ignored;
            this.tags = tags == null ? Collections.emptyList() : List.copyOf(tags);
        }

        public Path getPath() { return path; }
        public Visibility getVisibility() { return visibility; }
        public String getDescription() { return description; }
        public boolean isIgnored() { return ignored; }
        public List<String> getTags() { return tags; }
    }

    public static class Builder {
        private Path database = Paths.get("panti-catalog.sqlite");
        private Path cacheRoot = Paths.get("cache");
        private int thumbnailSize = DEFAULT_THUMBNAIL_SIZE;
        private int previewSize = DEFAULT_PREVIEW_SIZE;
        private long debounceMillis = DEFAULT_DEBOUNCE_MILLIS;
        private int assetWorkers = DEFAULT_ASSET_WORKERS;
        private String ffmpegPath = "ffmpeg";
        private String ffprobePath = "ffprobe";
        private long settleMillis = DEFAULT_SETTLE_MILLIS;
        private long moveWindowMillis = DEFAULT_MOVE_WINDOW_MILLIS;
        private final List<RootSettings> roots = new ArrayList<>();

        public Builder database(Path database) { this.database = database; return this; }
        public Builder cacheRoot(Path cacheRoot) { this.cacheRoot = cacheRoot; return this; }
        public Builder thumbnailSize(int size) { this.thumbnailSize = size; return this; }
        public Builder previewSize(int size) { this.previewSize = size; return this; }
        public Builder debounceMillis(long millis) { this.debounceMillis = millis; return this; }
        public Builder assetWorkers(int workers) { this.assetWorkers = workers; return this; }
        public Builder ffmpegPath(String path) { this.ffmpegPath = path; return this; }
        public Builder ffprobePath(String path) { this.ffprobePath = path; return this; }
        public Builder settleMillis(long millis) { this.settleMillis = millis; return this; }
        public Builder moveWindowMillis(long millis) { this.moveWindowMillis = millis; return this; }
        public Builder addRoot(RootSettings root) { this.roots.add(root); return this; }

        public IngestSettings build() {
            if (thumbnailSize <= 0 || previewSize <= 0) {
                throw new IllegalArgumentException("Asset sizes must be positive");
            }
            if (assetWorkers <= 0) {
                throw new IllegalArgumentException("assetWorkers must be positive");
            }
            return new IngestSettings(this);
        }
    }
}
