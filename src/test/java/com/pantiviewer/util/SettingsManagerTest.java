package com.pantiviewer.util;

import com.pantiviewer.model.AssetKind;
import com.pantiviewer.model.Visibility;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SettingsManager}.
 * The environment is injected so overrides can be tested without touching the real one.
 */
class SettingsManagerTest {

    @TempDir
    Path tempDir;

    /**
     * Verifies that every key of the file is read and relative paths resolve against the file's directory.
     */
    @Test
    void testLoad_FullFile_ShouldReadAllKeys() throws IOException {
        // 1. Arrange
        Path file = tempDir.resolve("settings.json");
        Files.writeString(file, """
                {
                  "database": "db/catalog.sqlite",
                  "cacheRoot": "cache-dir",
                  "thumbnailSize": 256,
                  "previewSize": 800,
                  "debounceMillis": 250,
                  "assetWorkers": 2,
                  "ffmpegPath": "/opt/ffmpeg",
                  "ffprobePath": "/opt/ffprobe",
                  "watcher": { "settleMillis": 100, "moveWindowMillis": 900 },
                  "roots": [
                    { "path": "public", "visibility": "public", "description": "Gallery", "tags": ["shared", "family"] },
                    { "path": "/abs/private", "visibility": "admin_only", "ignored": true }
                  ]
                }
                """);

        // 2. Act
        IngestSettings settings = new SettingsManager(Map.of()).load(file);

        // 3. Assert
        assertEquals(tempDir.resolve("db/catalog.sqlite"), settings.getDatabase());
        assertEquals(tempDir.resolve("cache-dir"), settings.getCacheRoot());
        assertEquals(256, settings.sizeFor(AssetKind.THUMBNAIL));
        assertEquals(800, settings.sizeFor(AssetKind.PREVIEW));
        assertEquals(250, settings.getDebounceMillis());
        assertEquals(2, settings.getAssetWorkers());
        assertEquals("/opt/ffmpeg", settings.getFfmpegPath());
        assertEquals("/opt/ffprobe", settings.getFfprobePath());
        assertEquals(100, settings.getSettleMillis());
        assertEquals(900, settings.getMoveWindowMillis());

        List<IngestSettings.RootSettings> roots = settings.getRoots();
        assertEquals(2, roots.size());
        assertEquals(tempDir.resolve("public"), roots.get(0).getPath());
        assertEquals(Visibility.PUBLIC, roots.get(0).getVisibility());
        assertEquals(List.of("shared", "family"), roots.get(0).getTags());
        assertEquals(Visibility.RESTRICTED, roots.get(1).getVisibility());
        assertTrue(roots.get(1).isIgnored());
    }

    /**
     * Verifies that a missing file yields the documented defaults.
     */
    @Test
    void testLoad_MissingFile_ShouldUseDefaults() {
        IngestSettings settings = new SettingsManager(Map.of()).load(tempDir.resolve("absent.json"));

        assertEquals(IngestSettings.DEFAULT_THUMBNAIL_SIZE, settings.getThumbnailSize());
        assertEquals(IngestSettings.DEFAULT_PREVIEW_SIZE, settings.getPreviewSize());
        assertEquals(IngestSettings.DEFAULT_DEBOUNCE_MILLIS, settings.getDebounceMillis());
        assertEquals(IngestSettings.DEFAULT_ASSET_WORKERS, settings.getAssetWorkers());
        assertTrue(settings.getRoots().isEmpty());
    }

    /**
     * Verifies that an unparsable file does not prevent startup.
     */
    @Test
    void testLoad_CorruptFile_ShouldUseDefaults() throws IOException {
        Path file = tempDir.resolve("settings.json");
        Files.writeString(file, "{ not json");

        IngestSettings settings = new SettingsManager(Map.of()).load(file);

        assertEquals(IngestSettings.DEFAULT_THUMBNAIL_SIZE, settings.getThumbnailSize());
    }

    /**
     * Verifies that environment variables win over the file, and that garbage numbers are ignored.
     */
    @Test
    void testLoad_EnvironmentOverrides_ShouldWin() throws IOException {
        Path file = tempDir.resolve("settings.json");
        Files.writeString(file, "{ \"database\": \"from-file.sqlite\", \"thumbnailSize\": 300, \"previewSize\": 900 }");
        Map<String, String> env = Map.of(
                SettingsManager.ENV_DATABASE, "/data/catalog.sqlite",
                SettingsManager.ENV_CACHE_ROOT, "/data/cache",
                SettingsManager.ENV_THUMBNAIL_SIZE, "128",
                SettingsManager.ENV_PREVIEW_SIZE, "large");

        IngestSettings settings = new SettingsManager(env).load(file);

        assertEquals(Path.of("/data/catalog.sqlite"), settings.getDatabase());
        assertEquals(Path.of("/data/cache"), settings.getCacheRoot());
        assertEquals(128, settings.getThumbnailSize());
        assertEquals(900, settings.getPreviewSize());
    }

    /**
     * Verifies that an unknown visibility fails fast instead of silently exposing a root.
     */
    @Test
    void testLoad_UnknownVisibility_ShouldThrow() throws IOException {
        Path file = tempDir.resolve("settings.json");
        Files.writeString(file, "{ \"roots\": [ { \"path\": \"x\", \"visibility\": \"everyone\" } ] }");

        SettingsManager manager = new SettingsManager(Map.of());
        assertThrows(IllegalArgumentException.class, () -> manager.load(file));
    }
}
