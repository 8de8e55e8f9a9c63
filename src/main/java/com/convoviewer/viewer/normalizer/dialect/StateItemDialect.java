package com.convoviewer.viewer.normalizer.dialect;

import com.convoviewer.viewer.model.Role;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Chat items stored in a VS Code style {@code state.vscdb} (Cursor, Trae).
 *
 * Items have no fixed schema. Role comes from {@code role}, else {@code from},
 * else {@code isUser}, else the presence of {@code outputText}; text comes from the
 * first known text field, else the longest text found under a text-like key.
 */
public class StateItemDialect implements RecordDialect {

    public static final String[] CONTENT_KEYS = {
            "content", "text", "prompt", "message", "inputText", "outputText", "body", "textContent"
    };

    private static final List<String> DEEP_TEXT_KEYS = List.of(
            "content", "text", "prompt", "message", "inputText", "outputText", "body", "textContent",
            "query", "question", "request", "description", "desc", "title");

    private static final Map<String, Role> ROLES = Map.of(
            "user", Role.USER,
            "human", Role.USER,
            "assistant", Role.ASSISTANT,
            "ai", Role.ASSISTANT,
            "bot", Role.ASSISTANT,
            "model", Role.ASSISTANT,
            "system", Role.SUMMARY,
            "summary", Role.SUMMARY,
            "tool", Role.TOOL);

    @Override
    public String roleToken(JsonNode record) {
        String role = JsonValues.text(record.path("role"));
        if (role != null) {
            return role.toLowerCase(Locale.ROOT);
        }
        String from = JsonValues.text(record.path("from"));
        if (from != null && !from.isEmpty()) {
            return "user".equalsIgnoreCase(from) ? "user" : "assistant";
        }
        JsonNode isUser = record.path("isUser");
        if (!isUser.isMissingNode() && !isUser.isNull()) {
            return isUser.asBoolean() ? "user" : "assistant";
        }
        return JsonValues.text(record.path("outputText")) != null ? "assistant" : "user";
    }

    @Override
    public Map<String, Role> roleTable() {
        return ROLES;
    }

    @Override
    public JsonNode content(JsonNode record) {
        for (String key : CONTENT_KEYS) {
            JsonNode value = record.path(key);
            if (value.isTextual() && !value.asText().isBlank()) {
                return value;
            }
            if (value.isArray() && !value.isEmpty()) {
                return value;
            }
            if (value.isObject() && !value.isEmpty()) {
                return TextNode.valueOf(value.toString());
            }
        }
        String deep = deepestText(record);
        return deep != null ? TextNode.valueOf(deep) : MissingNode.getInstance();
    }

    @Override
    public Instant timestamp(JsonNode record) {
        return JsonValues.timestamp(JsonValues.firstPresent(record, "timestamp", "time", "createdAt"));
    }

    @Override
    public String rawType(JsonNode record) {
        String type = JsonValues.text(record.path("type"));
        return type != null ? type : roleToken(record);
    }

    /**
     * True when the item yields non-blank text; items without text are not messages.
     */
    public boolean hasText(JsonNode record) {
        JsonNode content = content(record);
        if (content.isTextual()) {
            return !content.asText().isBlank();
        }
        return content.isArray() && !content.isEmpty();
    }

    private static String deepestText(JsonNode node) {
        String[] best = {null};
        visit(node, best);
        return best[0];
    }

    private static void visit(JsonNode node, String[] best) {
        if (node.isObject()) {
            node.fields().forEachRemaining(field -> {
                JsonNode value = field.getValue();
                if (value.isTextual() && !value.asText().isBlank()
                        && DEEP_TEXT_KEYS.stream().anyMatch(k -> field.getKey().contains(k))
                        && (best[0] == null || value.asText().length() > best[0].length())) {
                    best[0] = value.asText();
                }
                visit(value, best);
            });
        } else if (node.isArray()) {
            node.forEach(child -> visit(child, best));
        }
    }
}
