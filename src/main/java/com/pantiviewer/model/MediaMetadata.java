package com.pantiviewer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of metadata extraction: string fields plus pixel dimensions.
 */
public class MediaMetadata {
    private final Map<String, String> fields;
    private final Integer width;
    private final Integer height;

    public MediaMetadata(Map<String, String> fields, Integer width, Integer height) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.width = width;
        this.height = height;
    }

    public static MediaMetadata empty() {
        return new MediaMetadata(Collections.emptyMap(), null, null);
    }

    public Map<String, String> getFields() { return fields; }
    public Integer getWidth() { return width; }
    public Integer getHeight() { return height; }

    /**
     * @return true when nothing at all could be read from the file
     */
    public boolean isEmpty() {
        return fields.isEmpty() && width == null && height == null;
    }
}
