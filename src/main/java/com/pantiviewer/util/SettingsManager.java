package com.pantiviewer.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pantiviewer.model.Visibility;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads the ingestion settings from a JSON file.
 * Uses Jackson's tree model so every key is optional and falls back to its default.
 * A few environment variables override the file, which is how container deployments
 * point the service at mounted volumes.
 */
public class SettingsManager {

    static final String ENV_DATABASE = "PANTI_DATABASE";
    static final String ENV_CACHE_ROOT = "PANTI_CACHE_ROOT";
    static final String ENV_THUMBNAIL_SIZE = "PANTI_THUMBNAIL_SIZE";
    static final String ENV_PREVIEW_SIZE = "PANTI_PREVIEW_SIZE";

    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public SettingsManager() {
        this(System.getenv());
    }

    // Constructor for testing purposes
    SettingsManager(Map<String, String> environment) {
        this.mapper = new ObjectMapper();
        this.environment = environment;
    }

    /**
     * Reads the settings file. A missing or unreadable file yields the defaults.
     *
     * @param settingsFile The JSON file, may be null
     * @return The resolved settings
     * @throws IllegalArgumentException if a root declares an unknown visibility
     */
    public IngestSettings load(Path settingsFile) {
        JsonNode rootNode = readTree(settingsFile);
        Path baseDir = settingsFile != null && settingsFile.toAbsolutePath().getParent() != null
                ? settingsFile.toAbsolutePath().getParent()
                : Paths.get("").toAbsolutePath();

        IngestSettings.Builder builder = IngestSettings.builder();

        if (rootNode.has("database")) {
            builder.database(baseDir.resolve(rootNode.get("database").asText()));
        }
        if (rootNode.has("cacheRoot")) {
            builder.cacheRoot(baseDir.resolve(rootNode.get("cacheRoot").asText()));
        }
        if (rootNode.has("thumbnailSize")) {
            builder.thumbnailSize(rootNode.get("thumbnailSize").asInt(IngestSettings.DEFAULT_THUMBNAIL_SIZE));
        }
        if (rootNode.has("previewSize")) {
            builder.previewSize(rootNode.get("previewSize").asInt(IngestSettings.DEFAULT_PREVIEW_SIZE));
        }
        if (rootNode.has("debounceMillis")) {
            builder.debounceMillis(rootNode.get("debounceMillis").asLong(IngestSettings.DEFAULT_DEBOUNCE_MILLIS));
        }
        if (rootNode.has("assetWorkers")) {
            builder.assetWorkers(rootNode.get("assetWorkers").asInt(IngestSettings.DEFAULT_ASSET_WORKERS));
        }
        if (rootNode.has("ffmpegPath")) {
            builder.ffmpegPath(rootNode.get("ffmpegPath").asText());
        }
        if (rootNode.has("ffprobePath")) {
            builder.ffprobePath(rootNode.get("ffprobePath").asText());
        }

        JsonNode watcher = rootNode.path("watcher");
        if (watcher.has("settleMillis")) {
            builder.settleMillis(watcher.get("settleMillis").asLong(IngestSettings.DEFAULT_SETTLE_MILLIS));
        }
        if (watcher.has("moveWindowMillis")) {
            builder.moveWindowMillis(watcher.get("moveWindowMillis").asLong(IngestSettings.DEFAULT_MOVE_WINDOW_MILLIS));
        }

        JsonNode roots = rootNode.path("roots");
        if (roots.isArray()) {
            for (JsonNode node : roots) {
                if (!node.hasNonNull("path")) {
                    ProjectLogger.logWarn(null, "SettingsManager", "Ignoring root entry without a path: " + node);
                    continue;
                }
                List<String> tags = new ArrayList<>();
                for (JsonNode tag : node.path("tags")) {
                    tags.add(tag.asText());
                }
                builder.addRoot(new IngestSettings.RootSettings(
                        baseDir.resolve(node.get("path").asText()),
                        Visibility.parse(node.path("visibility").asText(null)),
                        node.path("description").asText(null),
                        node.path("ignored").asBoolean(false),
                        tags));
            }
        }

        applyEnvironment(builder, baseDir);
        return builder.build();
    }

    private JsonNode readTree(Path settingsFile) {
        if (settingsFile == null) {
            return mapper.createObjectNode();
        }
        File file = settingsFile.toFile();
        if (!file.exists()) {
            ProjectLogger.logWarn(null, "SettingsManager", "Settings file not found, using defaults: " + settingsFile);
            return mapper.createObjectNode();
        }
        try {
            JsonNode node = mapper.readTree(file);
            return node != null && node.isObject() ? node : mapper.createObjectNode();
        } catch (IOException e) {
            ProjectLogger.logError(null, "SettingsManager", "Unreadable settings file, using defaults: " + settingsFile, e);
            return mapper.createObjectNode();
        }
    }

    private void applyEnvironment(IngestSettings.Builder builder, Path baseDir) {
        String database = environment.get(ENV_DATABASE);
        if (database != null && !database.isBlank()) {
            builder.database(baseDir.resolve(database));
        }
        String cacheRoot = environment.get(ENV_CACHE_ROOT);
        if (cacheRoot != null && !cacheRoot.isBlank()) {
            builder.cacheRoot(baseDir.resolve(cacheRoot));
        }
        Integer thumbnailSize = parseInt(ENV_THUMBNAIL_SIZE);
        if (thumbnailSize != null) {
            builder.thumbnailSize(thumbnailSize);
        }
        Integer previewSize = parseInt(ENV_PREVIEW_SIZE);
        if (previewSize != null) {
            builder.previewSize(previewSize);
        }
    }

    private Integer parseInt(String variable) {
        String value = environment.get(variable);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            ProjectLogger.logWarn(null, "SettingsManager", "Ignoring non-numeric " + variable + "=" + value);
            return null;
        }
    }
}
