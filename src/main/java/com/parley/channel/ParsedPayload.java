package com.parley.channel;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider-native view of a request body: named fields for form and multipart
 * bodies, a JSON tree for JSON bodies.
 */
public final class ParsedPayload {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PayloadFormat format;
    private final MultiValueMap<String, String> fields;
    private final JsonNode json;

    private ParsedPayload(PayloadFormat format, MultiValueMap<String, String> fields, JsonNode json) {
        this.format = format;
        this.fields = fields;
        this.json = json;
    }

    public static ParsedPayload ofFields(PayloadFormat format, MultiValueMap<String, String> fields) {
        return new ParsedPayload(format, new LinkedMultiValueMap<>(fields), MissingNode.getInstance());
    }

    public static ParsedPayload ofJson(JsonNode json) {
        return new ParsedPayload(PayloadFormat.JSON, new LinkedMultiValueMap<>(), json);
    }

    public PayloadFormat format() { return format; }

    public boolean isJson() { return format == PayloadFormat.JSON; }

    /**
     * First value of a form field, or the text of a top-level JSON property.
     * Returns null when absent or blank.
     */
    public String field(String name) {
        String value;
        if (isJson()) {
            JsonNode node = json.path(name);
            value = node.isValueNode() ? node.asText() : null;
        } else {
            value = fields.getFirst(name);
        }
        return value == null || value.isBlank() ? null : value;
    }

    public MultiValueMap<String, String> fields() { return fields; }

    public JsonNode json() { return json; }

    public Map<String, Object> asMap() {
        if (isJson()) {
            if (!json.isObject()) return Map.of("payload", MAPPER.convertValue(json, Object.class));
            return MAPPER.convertValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        }
        Map<String, Object> map = new LinkedHashMap<>();
        fields.forEach((key, values) -> map.put(key, values.size() == 1 ? values.get(0) : values));
        return map;
    }
}
