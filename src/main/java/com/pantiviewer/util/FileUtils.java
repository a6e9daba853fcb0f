package com.pantiviewer.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Utility class for file naming and media type sniffing.
 */
public class FileUtils {

    /**
     * MIME types the ingestion pipeline accepts.
     */
    public static final Set<String> SUPPORTED_MIME_TYPES = Set.of(
            "image/jpeg", "image/png", "image/gif", "image/webp", "image/tiff",
            "image/heic", "image/heif",
            "video/mp4", "video/quicktime", "video/x-msvideo", "video/webm"
    );

    private static final Map<String, String> EXTENSION_MIME_TYPES = Map.ofEntries(
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("jpe", "image/jpeg"),
            Map.entry("png", "image/png"),
            Map.entry("gif", "image/gif"),
            Map.entry("webp", "image/webp"),
            Map.entry("tif", "image/tiff"),
            Map.entry("tiff", "image/tiff"),
            Map.entry("heic", "image/heic"),
            Map.entry("heif", "image/heif"),
            Map.entry("mp4", "video/mp4"),
            Map.entry("m4v", "video/mp4"),
            Map.entry("mov", "video/quicktime"),
            Map.entry("qt", "video/quicktime"),
            Map.entry("avi", "video/x-msvideo"),
            Map.entry("webm", "video/webm")
    );

    private FileUtils() {
    }

    /**
     * Extracts the file extension from a file name.
     *
     * @param fileName The file name (e.g., "image.jpg").
     * @return The extension (lowercase, without dot), or an empty string if none found.
     */
    public static String getExtension(String fileName) {
        if (fileName == null) {
            return "";
        }
        int i = fileName.lastIndexOf('.');
        // ".gitignore" (i=0) has no extension
        if (i > 0) {
            return fileName.substring(i + 1).toLowerCase();
        }
        return "";
    }

    /**
     * Files and directories whose name starts with a dot are never ingested,
     * nor are the "._" resource forks some systems leave next to media.
     */
    public static boolean isHidden(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().startsWith(".");
    }

    /**
     * Guesses the MIME type of a file. The platform probe is tried first, then the
     * extension table.
     *
     * @param file The file to inspect.
     * @return The MIME type, or empty if it cannot be determined.
     */
    public static Optional<String> detectMimeType(Path file) {
        String probed = null;
        try {
            probed = Files.probeContentType(file);
        } catch (IOException e) {
            ProjectLogger.logDebug(file.getParent(), "FileUtils", "Content type probe failed for " + file + ": " + e.getMessage());
        }
        if (probed != null && SUPPORTED_MIME_TYPES.contains(probed.toLowerCase())) {
            return Optional.of(probed.toLowerCase());
        }
        String byExtension = EXTENSION_MIME_TYPES.get(getExtension(String.valueOf(file.getFileName())));
        if (byExtension != null) {
            return Optional.of(byExtension);
        }
        return Optional.ofNullable(probed).map(String::toLowerCase);
    }

    /**
     * @return the supported MIME type of the file, or empty if it must not be ingested.
     */
    public static Optional<String> supportedMimeType(Path file) {
        if (isHidden(file)) {
            return Optional.empty();
        }
        return detectMimeType(file).filter(SUPPORTED_MIME_TYPES::contains);
    }

    public static boolean isVideoMimeType(String mimeType) {
        return mimeType != null && mimeType.startsWith("video/");
    }
}
