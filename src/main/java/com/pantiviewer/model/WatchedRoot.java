package com.pantiviewer.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Set;

/**
 * A directory tree under ingestion, either configured or discovered by a scan.
 */
public class WatchedRoot {
    private final int id;
    private final Path path;
    private final String shortName;
    private final String description;
    private final Path parent;          // Null for configured roots
    private final boolean ignored;
    private final Visibility visibility;
    private final boolean configured;
    private final Set<String> tags;

    public WatchedRoot(int id, Path path, String shortName, String description, Path parent,
                       boolean ignored, Visibility visibility, boolean configured, Set<String> tags) {
        this.id = id;
        this.path = path;
        this.shortName = shortName;
        this.description = description;
        this.parent = parent;
        this.ignored = ignored;
        this.visibility = visibility;
        this.configured = configured;
        this.tags = tags == null ? Collections.emptySet() : Collections.unmodifiableSet(tags);
    }

    public int getId() { return id; }
    public Path getPath() { return path; }
    public String getShortName() { return shortName; }
    public String getDescription() { return description; }
    public Path getParent() { return parent; }
    public boolean isIgnored() { return ignored; }
    public Visibility getVisibility() { return visibility; }
    public boolean isConfigured() { return configured; }
    public Set<String> getTags() { return tags; }

    @Override
    public String toString() {
        return path + " (" + visibility + (ignored ? ", ignored" : "") + ")";
    }
}
