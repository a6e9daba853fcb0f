package com.pantiviewer.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pantiviewer.model.Content;
import com.pantiviewer.model.Location;
import com.pantiviewer.util.ProjectLogger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Keeps the full-text table in step with the locations. One row per location, whose rowid
 * is the location id, holding the path, the content tags and the flattened metadata.
 */
public class SearchIndex {

    private static final String SQL_DELETE = "DELETE FROM location_fts WHERE rowid = ?";

    private static final String SQL_INSERT = """
            INSERT INTO location_fts (rowid, location_id, path, filename, prompt, negative_prompt, model,
             sampler, scheduler, loras, upscaler, application, tags, full_text)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";

    private final ObjectMapper mapper = new ObjectMapper();
    private final ContentStore contentStore;
    private final LocationIndex locationIndex;

    public SearchIndex(ContentStore contentStore, LocationIndex locationIndex) {
        this.contentStore = contentStore;
        this.locationIndex = locationIndex;
    }

    /**
     * Replaces the row of a location with a fresh document. Does nothing if the location
     * or its content is gone.
     */
    public void upsert(Connection conn, long locationId) throws SQLException {
        Optional<Location> location = locationIndex.findById(conn, locationId);
        if (location.isEmpty()) {
            return;
        }
        Optional<Content> content = contentStore.find(conn, location.get().getChecksum());
        if (content.isEmpty()) {
            return;
        }
        List<String> tags = contentStore.tagsFor(conn, content.get().getChecksum());
        SearchDocument doc = buildDocument(location.get(), content.get().getMetadataJson(), tags);

        remove(conn, locationId);
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_INSERT)) {
            pstmt.setLong(1, locationId);
            pstmt.setLong(2, locationId);
            pstmt.setString(3, doc.path);
            pstmt.setString(4, doc.filename);
            pstmt.setString(5, doc.prompt);
            pstmt.setString(6, doc.negativePrompt);
            pstmt.setString(7, doc.model);
            pstmt.setString(8, doc.sampler);
            pstmt.setString(9, doc.scheduler);
            pstmt.setString(10, doc.loras);
            pstmt.setString(11, doc.upscaler);
            pstmt.setString(12, doc.application);
            pstmt.setString(13, doc.tags);
            pstmt.setString(14, doc.fullText);
            pstmt.executeUpdate();
        }
    }

    public void remove(Connection conn, long locationId) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(SQL_DELETE)) {
            pstmt.setLong(1, locationId);
            pstmt.executeUpdate();
        }
    }

    /**
     * Drops every row and indexes all locations again.
     *
     * @return the number of locations indexed
     */
    public int rebuild(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("DELETE FROM location_fts");
        }
        int count = 0;
        for (Location location : locationIndex.findAll(conn)) {
            upsert(conn, location.getId());
            count++;
        }
        return count;
    }

    SearchDocument buildDocument(Location location, String metadataJson, List<String> tags) {
        SearchDocument doc = new SearchDocument();
        doc.path = location.getDirectory().toString();
        doc.filename = location.getFilename();
        doc.tags = String.join(" ", tags);
        doc.application = "Unknown";

        JsonNode metadata = parse(metadataJson, location);
        if (metadata == null) {
            doc.fullText = "";
            return doc;
        }

        JsonNode parameters = metadata.get("parameters");
        JsonNode sui = null;
        if (parameters != null) {
            JsonNode params = parameters.isTextual() ? parse(parameters.asText(), location) : parameters;
            if (params != null) {
                sui = params.get("sui_image_params");
            }
        }
        if (sui != null && sui.isObject()) {
            doc.prompt = text(sui, "prompt");
            doc.negativePrompt = text(sui, "negativeprompt");
            doc.model = text(sui, "model");
            doc.sampler = text(sui, "sampler");
            doc.scheduler = text(sui, "scheduler");
            doc.loras = sui.has("loras") ? flatten(sui.get("loras")) : "";
            doc.upscaler = text(sui, "upscaler");
            if (sui.has("swarm_version")) {
                doc.application = "SwarmUI";
            }
        }
        doc.fullText = flatten(metadata);
        return doc;
    }

    private JsonNode parse(String json, Location location) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            JsonNode node = mapper.readTree(json);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            ProjectLogger.logDebug(location.getDirectory(), "SearchIndex",
                    "Unparsable JSON while indexing " + location.getPath() + ": " + e.getOriginalMessage());
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.isValueNode() ? value.asText() : value.toString();
    }

    private static String flatten(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        List<String> parts = new ArrayList<>();
        Iterator<JsonNode> elements = node.elements();
        while (elements.hasNext()) {
            String part = flatten(elements.next());
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return String.join(" ", parts);
    }

    /**
     * Indexable fields of one location.
     */
    static class SearchDocument {
        String path;
        String filename;
        String prompt;
        String negativePrompt;
        String model;
        String sampler;
        String scheduler;
        String loras;
        String upscaler;
        String application;
        String tags;
        String fullText;
    }
}
