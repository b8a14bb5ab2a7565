package com.buildscheduler.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the JSON text columns of scheduled jobs. Reading never fails:
 * double-encoded values are unwrapped, escaped values are unescaped, and anything
 * still unreadable comes back as an empty collection.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StoredJsonCodec {

    private static final int MAX_UNWRAP_DEPTH = 3;

    private final ObjectMapper objectMapper;

    // ── Writing ───────────────────────────────────────────────────────────

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job configuration: " + e.getMessage(), e);
        }
    }

    // ── Reading ───────────────────────────────────────────────────────────

    public List<String> readTargets(String raw) {
        JsonNode node = readLenient(raw, "targets");
        List<String> targets = new ArrayList<>();
        if (node == null) {
            return targets;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                String target = item.asText("").trim();
                if (!target.isEmpty() && !targets.contains(target)) {
                    targets.add(target);
                }
            }
        } else if (node.isObject()) {
            node.fieldNames().forEachRemaining(targets::add);
        } else if (node.isTextual() && !node.textValue().isBlank()) {
            targets.add(node.textValue().trim());
        }
        return targets;
    }

    public Map<String, Map<String, Object>> readJobConfigs(String raw) {
        JsonNode node = readLenient(raw, "job_configs");
        Map<String, Map<String, Object>> configs = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return configs;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            configs.put(entry.getKey(), toParameterMap(unwrap(entry.getValue())));
        }
        return configs;
    }

    public Map<String, Object> readParameters(String raw) {
        return toParameterMap(readLenient(raw, "parameters"));
    }

    private Map<String, Object> toParameterMap(JsonNode node) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return params;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            params.put(entry.getKey(), toParameterValue(entry.getValue()));
        }
        return params;
    }

    private Object toParameterValue(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isValueNode()) {
            return value.asText();
        }
        return value.toString();
    }

    private JsonNode readLenient(String raw, String column) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        JsonNode node = tryParse(raw);
        if (node == null) {
            node = tryParse(unescape(raw));
        }
        if (node == null) {
            log.warn("Unreadable {} value, treating as empty: {}", column, abbreviate(raw));
            return null;
        }
        return unwrap(node);
    }

    private JsonNode unwrap(JsonNode node) {
        JsonNode current = node;
        for (int depth = 0; depth < MAX_UNWRAP_DEPTH && current != null && current.isTextual(); depth++) {
            JsonNode inner = tryParse(current.textValue());
            if (inner == null || !inner.isContainerNode() && !inner.isTextual()) {
                break;
            }
            current = inner;
        }
        return current;
    }

    private JsonNode tryParse(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String unescape(String raw) {
        String text = raw.trim();
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            text = text.substring(1, text.length() - 1);
        }
        return text.replace("\\\"", "\"").replace("\\\\", "\\");
    }

    private static String abbreviate(String raw) {
        return raw.length() <= 80 ? raw : raw.substring(0, 80) + "...";
    }
}
