package io.surfworks.accelforge.accelerator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Helpers for accelerator parameter documents.
 *
 * <p>Parameters are JSON objects of the form {@code {"app": {"specific": {...}}, "env": {...}}}.
 */
public final class JsonParameters {

    static final ObjectMapper JSON = new ObjectMapper();

    private JsonParameters() {
    }

    public static ObjectNode empty() {
        return JSON.createObjectNode();
    }

    /**
     * Merges {@code overrides} into a copy of {@code defaults}. Nested objects are merged
     * recursively; any other value replaces the default.
     */
    public static ObjectNode merge(ObjectNode defaults, JsonNode overrides) {
        ObjectNode result = defaults == null ? empty() : defaults.deepCopy();
        if (overrides != null && overrides.isObject()) {
            mergeInto(result, overrides);
        }
        return result;
    }

    /**
     * Parses a JSON object given either literally or as the path of a JSON file.
     *
     * @throws IllegalArgumentException if the text is neither a JSON object nor a readable JSON file
     */
    public static ObjectNode parse(String literalOrPath) {
        String text = literalOrPath.strip();
        try {
            JsonNode node = text.startsWith("{")
                    ? JSON.readTree(text)
                    : JSON.readTree(Files.readString(Path.of(text)));
            if (node instanceof ObjectNode object) {
                return object;
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid JSON parameters: " + literalOrPath, e);
        }
        throw new IllegalArgumentException("JSON parameters must be an object: " + literalOrPath);
    }

    /**
     * Returns the {@code app.specific} object of a parameters document, creating it if needed.
     */
    public static ObjectNode specific(ObjectNode parameters) {
        ObjectNode app = parameters.has("app") && parameters.get("app").isObject()
                ? (ObjectNode) parameters.get("app")
                : parameters.putObject("app");
        return app.has("specific") && app.get("specific").isObject()
                ? (ObjectNode) app.get("specific")
                : app.putObject("specific");
    }

    private static void mergeInto(ObjectNode target, JsonNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing instanceof ObjectNode existingObject && field.getValue().isObject()) {
                mergeInto(existingObject, field.getValue());
            } else {
                target.set(field.getKey(), field.getValue().deepCopy());
            }
        }
    }
}
