package com.convoviewer.viewer.adapter;

import com.convoviewer.viewer.normalizer.dialect.StateItemDialect;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns the JSON value of a VS Code state key into a flat list of chat items.
 *
 * The value is either an array of items or an object holding one under a known
 * container key; failing both, the longest nested array of objects is taken.
 * Items may be JSON strings or wrap their payload in {@code value}; both are
 * unwrapped. Items that yield no text are dropped.
 */
@Slf4j
public class StateItemExtractor {

    static final List<String> CONTAINER_KEYS = List.of(
            "prompts", "messages", "items", "history", "chatHistory", "threads", "sessions");

    private final ObjectMapper objectMapper;
    private final StateItemDialect dialect;

    public StateItemExtractor(ObjectMapper objectMapper, StateItemDialect dialect) {
        this.objectMapper = objectMapper;
        this.dialect = dialect;
    }

    /**
     * @param rawValue - Text stored in {@code ItemTable.value}
     * @return Items with text, in stored order
     */
    public List<ObjectNode> extract(String rawValue) {
        List<ObjectNode> items = new ArrayList<>();
        if (rawValue == null) {
            return items;
        }
        JsonNode data = parseMaybe(TextNode.valueOf(rawValue));
        for (JsonNode item : itemArray(data)) {
            normalize(item, items);
        }
        items.removeIf(item -> !dialect.hasText(item));
        return items;
    }

    /**
     * Score how much a state value looks like chat storage: the item count, plus 1000
     * when items carry a text field. Negative when the value is not JSON.
     */
    public int score(String rawValue) {
        JsonNode data = parseStrict(rawValue);
        if (data == null) {
            return -1;
        }
        if (data.isArray()) {
            return data.size() + (hasTextKey(data.get(0)) ? 1000 : 0);
        }
        if (data.isObject()) {
            JsonNode container = container(data);
            if (container.isArray()) {
                return container.size() + (hasTextKey(container.get(0)) ? 1000 : 0);
            }
            ArrayNode deep = longestObjectArray(data, true);
            return deep != null ? deep.size() + 1000 : 0;
        }
        return 0;
    }

    /**
     * Looser check used when no key name looked like chat storage.
     */
    public boolean looksLikeItems(String rawValue) {
        JsonNode data = parseStrict(rawValue);
        if (data == null) {
            return false;
        }
        if (data.isArray()) {
            return hasAnyKey(data.get(0));
        }
        if (data.isObject()) {
            JsonNode container = container(data);
            if (container.isArray()) {
                return hasAnyKey(container.get(0));
            }
            ArrayNode deep = longestObjectArray(data, false);
            return deep != null && hasAnyKey(deep.get(0));
        }
        return false;
    }

    private JsonNode itemArray(JsonNode data) {
        if (data.isArray()) {
            return data;
        }
        if (data.isObject()) {
            JsonNode container = container(data);
            if (container.isArray()) {
                return container;
            }
            ArrayNode deep = longestObjectArray(data, false);
            if (deep != null) {
                return deep;
            }
        }
        return objectMapper.createArrayNode();
    }

    private static JsonNode container(JsonNode data) {
        for (String key : CONTAINER_KEYS) {
            JsonNode value = data.path(key);
            if (value.isArray() && !value.isEmpty()) {
                return value;
            }
        }
        return MissingNode.getInstance();
    }

    private void normalize(JsonNode rawItem, List<ObjectNode> out) {
        JsonNode item = parseMaybe(rawItem);
        if (item.isObject()) {
            JsonNode value = item.path("value");
            JsonNode payload = value.isMissingNode() || value.isNull() ? item : parseMaybe(value);
            ObjectNode normalized;
            if (payload.isObject()) {
                normalized = ((ObjectNode) payload).deepCopy();
            } else {
                normalized = objectMapper.createObjectNode();
                normalized.put("role", "assistant");
                normalized.put("content", payload.isValueNode() ? payload.asText() : payload.toString());
            }
            JsonNode itemTimestamp = item.path("timestamp");
            if (!normalized.has("timestamp") && !normalized.has("time") && !itemTimestamp.isMissingNode()) {
                normalized.set("timestamp", itemTimestamp);
            }
            out.add(normalized);
        } else if (item.isArray()) {
            item.forEach(child -> normalize(child, out));
        } else if (!item.isNull() && !item.isMissingNode()) {
            ObjectNode normalized = objectMapper.createObjectNode();
            normalized.put("role", "assistant");
            normalized.put("content", item.asText());
            out.add(normalized);
        }
    }

    private JsonNode parseMaybe(JsonNode node) {
        if (!node.isTextual()) {
            return node;
        }
        String value = node.asText().strip();
        if ((value.startsWith("{") && value.endsWith("}")) || (value.startsWith("[") && value.endsWith("]"))) {
            try {
                return objectMapper.readTree(value);
            } catch (JsonProcessingException e) {
                return node;
            }
        }
        return node;
    }

    private JsonNode parseStrict(String rawValue) {
        if (rawValue == null) {
            return null;
        }
        try {
            return objectMapper.readTree(rawValue);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static boolean hasTextKey(JsonNode node) {
        return node != null && node.isObject()
                && Arrays.stream(StateItemDialect.CONTENT_KEYS).anyMatch(node::has);
    }

    private static boolean hasAnyKey(JsonNode node) {
        return hasTextKey(node) || (node != null && node.isObject() && (node.has("role") || node.has("type")));
    }

    private static ArrayNode longestObjectArray(JsonNode root, boolean requireTextKey) {
        ArrayNode[] best = {null};
        visit(root, best, requireTextKey);
        return best[0];
    }

    private static void visit(JsonNode node, ArrayNode[] best, boolean requireTextKey) {
        if (node.isArray()) {
            JsonNode first = node.get(0);
            boolean candidate = first != null && first.isObject() && (!requireTextKey || hasTextKey(first));
            if (candidate && (best[0] == null || node.size() > best[0].size())) {
                best[0] = (ArrayNode) node;
            }
            node.forEach(child -> visit(child, best, requireTextKey));
        } else if (node.isObject()) {
            node.forEach(child -> visit(child, best, requireTextKey));
        }
    }
}
