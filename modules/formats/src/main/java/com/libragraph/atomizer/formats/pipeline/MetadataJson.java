package com.libragraph.atomizer.formats.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.atomizer.formats.api.AtomizationException;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Serializes and merges the JSON metadata strings carried by atoms.
 */
public final class MetadataJson {

    private static final Logger log = Logger.getLogger(MetadataJson.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MetadataJson() {
    }

    /**
     * Serializes the map as a JSON object, or returns null for an empty map.
     */
    public static String toJson(Map<String, ?> properties) {
        if (properties == null || properties.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(properties);
        } catch (JsonProcessingException e) {
            throw new AtomizationException("Failed to serialize atom metadata", e);
        }
    }

    /**
     * Overlays {@code additional} on the JSON object in {@code existing}.
     * When {@code existing} is absent or not a JSON object, only {@code additional} is returned.
     */
    public static String merge(String existing, Map<String, ?> additional) {
        if (existing == null || existing.isBlank()) {
            return toJson(additional);
        }
        JsonNode parsed;
        try {
            parsed = MAPPER.readTree(existing);
        } catch (JsonProcessingException e) {
            log.debugf("Discarding unparsable metadata while merging: %s", e.getOriginalMessage());
            return toJson(additional);
        }
        if (!(parsed instanceof ObjectNode target)) {
            return toJson(additional);
        }
        if (additional != null) {
            additional.forEach((key, value) -> target.set(key, MAPPER.valueToTree(value)));
        }
        return target.isEmpty() ? null : target.toString();
    }

    /**
     * Parses a metadata string back into a tree, for consumers and tests.
     */
    public static JsonNode parse(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AtomizationException("Invalid atom metadata JSON", e);
        }
    }
}
