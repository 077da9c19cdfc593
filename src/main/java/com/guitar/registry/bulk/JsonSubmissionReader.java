package com.guitar.registry.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guitar.registry.core.CatalogJson;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Reads submissions from a JSON document.
 *
 * <p>A top-level object is one submission (single mode); a top-level array is a batch whose
 * elements are handed over as-is, so a non-object element fails validation on its own rather
 * than failing the whole document:</p>
 * <pre>
 * {"manufacturer": {"name": "Gibson"}}
 * [{"manufacturer": {"name": "Gibson"}}, {"manufacturer": {"name": "Fender"}}]
 * </pre>
 */
public class JsonSubmissionReader {

    private final ObjectMapper objectMapper;

    public JsonSubmissionReader() {
        this(CatalogJson.newObjectMapper());
    }

    public JsonSubmissionReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalArgumentException if the document is malformed or is neither an object nor an array
     */
    public SubmissionDocument read(String json) {
        if (json == null) {
            throw new IllegalArgumentException("json must not be null");
        }
        try {
            return fromTree(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the document is malformed or is neither an object nor an array
     * @throws UncheckedIOException     if the stream cannot be read
     */
    public SubmissionDocument read(InputStream input) {
        if (input == null) {
            throw new IllegalArgumentException("input must not be null");
        }
        try {
            return fromTree(objectMapper.readTree(input));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read submissions", e);
        }
    }

    private SubmissionDocument fromTree(JsonNode root) {
        if (root != null && root.isObject()) {
            return new SubmissionDocument(false, List.of(toPlainValue(root)));
        }
        if (root != null && root.isArray()) {
            List<Object> submissions = new ArrayList<>(root.size());
            for (JsonNode element : root) {
                submissions.add(toPlainValue(element));
            }
            return new SubmissionDocument(true, submissions);
        }
        throw new IllegalArgumentException(
                "Invalid submission format. Expected an object or an array of objects.");
    }

    private Object toPlainValue(JsonNode node) {
        if (node.isNull()) {
            return null;
        }
        return node.isObject()
                ? objectMapper.convertValue(node, Map.class)
                : objectMapper.convertValue(node, Object.class);
    }

    /**
     * @param batchMode   {@code true} when the document was an array
     * @param submissions raw submissions; elements may be {@code null} or non-maps
     */
    public record SubmissionDocument(boolean batchMode, List<Object> submissions) {
        public SubmissionDocument {
            submissions = Collections.unmodifiableList(new ArrayList<>(submissions));
        }
    }
}
