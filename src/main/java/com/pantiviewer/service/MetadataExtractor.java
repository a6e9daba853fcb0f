package com.pantiviewer.service;

import com.drew.imaging.ImageMetadataReader;
import com.drew.lang.GeoLocation;
import com.drew.lang.KeyValuePair;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import com.drew.metadata.jpeg.JpegDirectory;
import com.drew.metadata.png.PngDirectory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pantiviewer.model.MediaMetadata;
import com.pantiviewer.util.FileUtils;
import com.pantiviewer.util.ProjectLogger;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads dimensions and embedded metadata of media files.
 * Images go through metadata-extractor for their tags and through ImageIO for the header
 * dimensions; videos only get their stream dimensions from ffprobe. Extraction never fails
 * ingestion: a file nothing can be read from yields {@link MediaMetadata#empty()}.
 */
public class MetadataExtractor {

    static final String KEY_MIME_TYPE = "mime_type";
    static final int MAX_VALUE_LENGTH = 16 * 1024;

    private static final TypeReference<LinkedHashMap<String, String>> MAP_TYPE = new TypeReference<>() {
    };

    private final FFmpegService ffmpegService;
    private final ObjectMapper mapper = new ObjectMapper();

    public MetadataExtractor(FFmpegService ffmpegService) {
        this.ffmpegService = ffmpegService;
    }

    /**
     * @param file     The media file
     * @param mimeType Its sniffed MIME type
     * @return The extracted metadata, possibly empty
     */
    public MediaMetadata extract(Path file, String mimeType) {
        if (FileUtils.isVideoMimeType(mimeType)) {
            return extractVideo(file.toFile());
        }
        return extractImage(file.toFile());
    }

    private MediaMetadata extractVideo(File file) {
        return ffmpegService.probeDimensions(file)
                .map(d -> new MediaMetadata(Map.of(), d.getWidth(), d.getHeight()))
                .orElseGet(MediaMetadata::empty);
    }

    private MediaMetadata extractImage(File file) {
        Map<String, String> fields = new LinkedHashMap<>();
        Integer width = null;
        Integer height = null;

        Metadata metadata = null;
        try {
            metadata = ImageMetadataReader.readMetadata(file);
        } catch (Exception e) {
            // Parsers also throw unchecked exceptions on corrupt segments; the header read below may still work
            ProjectLogger.logRecurringError(file.getParentFile().toPath(), "MetadataExtractor",
                    "Failed to read embedded metadata: " + file.getName(), e);
        }

        if (metadata != null) {
            try {
                collectTags(metadata, fields);
            } catch (RuntimeException e) {
                ProjectLogger.logRecurringError(file.getParentFile().toPath(), "MetadataExtractor",
                        "Failed to describe tags of " + file.getName(), e);
            }
        }

        int[] dimensions = readHeaderDimensions(file);
        if (dimensions == null && metadata != null) {
            dimensions = dimensionsFromTags(metadata);
        }
        if (dimensions != null) {
            width = dimensions[0];
            height = dimensions[1];
        }
        return new MediaMetadata(fields, width, height);
    }

    private void collectTags(Metadata metadata, Map<String, String> fields) {
        for (Directory directory : metadata.getDirectories()) {
            for (com.drew.metadata.Tag tag : directory.getTags()) {
                if (directory instanceof PngDirectory && isPngText(tag.getTagType())) {
                    // Text chunks are stored under their own keyword, e.g. "parameters"
                    Object value = directory.getObject(tag.getTagType());
                    if (value instanceof List) {
                        for (Object item : (List<?>) value) {
                            if (item instanceof KeyValuePair) {
                                KeyValuePair pair = (KeyValuePair) item;
                                fields.put(pair.getKey(), sanitize(pair.getValue().toString()));
                            }
                        }
                        continue;
                    }
                }
                String description = tag.getDescription();
                if (description != null) {
                    fields.put(directory.getName() + "/" + tag.getTagName(), sanitize(description));
                }
            }
        }

        GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);
        if (gps != null) {
            GeoLocation location = gps.getGeoLocation();
            if (location != null && !location.isZero()) {
                fields.put("gps_latitude", String.valueOf(location.getLatitude()));
                fields.put("gps_longitude", String.valueOf(location.getLongitude()));
            }
        }
    }

    private static boolean isPngText(int tagType) {
        return tagType == PngDirectory.TAG_TEXTUAL_DATA;
    }

    private int[] readHeaderDimensions(File file) {
        try (ImageInputStream iis = ImageIO.createImageInputStream(file)) {
            if (iis == null) {
                return null;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) {
                return null;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true, true);
                return new int[]{reader.getWidth(0), reader.getHeight(0)};
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            ProjectLogger.logDebug(file.getParentFile().toPath(), "MetadataExtractor",
                    "No header dimensions for " + file.getName() + ": " + e.getMessage());
            return null;
        }
    }

    private int[] dimensionsFromTags(Metadata metadata) {
        int[] fromJpeg = pair(metadata.getFirstDirectoryOfType(JpegDirectory.class),
                JpegDirectory.TAG_IMAGE_WIDTH, JpegDirectory.TAG_IMAGE_HEIGHT);
        if (fromJpeg != null) {
            return fromJpeg;
        }
        int[] fromPng = pair(metadata.getFirstDirectoryOfType(PngDirectory.class),
                PngDirectory.TAG_IMAGE_WIDTH, PngDirectory.TAG_IMAGE_HEIGHT);
        if (fromPng != null) {
            return fromPng;
        }
        return pair(metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class),
                ExifSubIFDDirectory.TAG_EXIF_IMAGE_WIDTH, ExifSubIFDDirectory.TAG_EXIF_IMAGE_HEIGHT);
    }

    private static int[] pair(Directory directory, int widthTag, int heightTag) {
        if (directory == null) {
            return null;
        }
        Integer w = directory.getInteger(widthTag);
        Integer h = directory.getInteger(heightTag);
        return w != null && h != null ? new int[]{w, h} : null;
    }

    /**
     * Makes a tag value safe to store and display: control characters become spaces,
     * unpaired surrogates become U+FFFD, and very long values are truncated.
     */
    static String sanitize(String value) {
        StringBuilder sb = new StringBuilder(Math.min(value.length(), MAX_VALUE_LENGTH));
        for (int i = 0; i < value.length() && sb.length() < MAX_VALUE_LENGTH; i++) {
            char c = value.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < value.length() && Character.isLowSurrogate(value.charAt(i + 1))) {
                sb.append(c).append(value.charAt(++i));
            } else if (Character.isSurrogate(c)) {
                sb.append('\uFFFD');
            } else if (c == '\n' || c == '\t') {
                sb.append(c);
            } else if (Character.isISOControl(c)) {
                sb.append(' ');
            } else {
                sb.append(c);
            }
        }
        return sb.toString().trim();
    }

    /**
     * Serializes the metadata blob stored on a content row. The MIME type is always present.
     */
    public String toJson(Map<String, String> fields, String mimeType) {
        Map<String, String> blob = new LinkedHashMap<>(fields);
        if (mimeType != null) {
            blob.put(KEY_MIME_TYPE, mimeType);
        }
        try {
            return mapper.writeValueAsString(blob);
        } catch (JsonProcessingException e) {
            // Only strings in the map
            throw new IllegalStateException("Metadata serialization failed", e);
        }
    }

    /**
     * Reads the MIME type back from a stored blob.
     *
     * @return the MIME type or null if absent or unparsable
     */
    public String mimeTypeOf(String metadataJson) {
        if (metadataJson == null || metadataJson.isBlank()) {
            return null;
        }
        try {
            Map<String, String> blob = mapper.readValue(metadataJson, MAP_TYPE);
            return blob.get(KEY_MIME_TYPE);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
