package com.convoviewer.viewer.normalizer.dialect;

import com.convoviewer.viewer.model.Role;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;

/**
 * Qwen Code chat documents: {@code messages[]} entries of {@code {type, content, timestamp}},
 * where the assistant type is the model name.
 */
public class QwenDialect implements RecordDialect {

    private static final Map<String, Role> ROLES = Map.of(
            "user", Role.USER,
            "qwen", Role.ASSISTANT,
            "model", Role.ASSISTANT,
            "assistant", Role.ASSISTANT,
            "summary", Role.SUMMARY,
            "tool", Role.TOOL);

    @Override
    public String roleToken(JsonNode record) {
        String type = JsonValues.text(record.path("type"));
        return type != null ? type : JsonValues.text(record.path("role"));
    }

    @Override
    public Map<String, Role> roleTable() {
        return ROLES;
    }

    @Override
    public JsonNode content(JsonNode record) {
        return JsonValues.firstPresent(record, "content", "parts");
    }

    @Override
    public Instant timestamp(JsonNode record) {
        return JsonValues.timestamp(record.path("timestamp"));
    }

    @Override
    public String rawType(JsonNode record) {
        return roleToken(record);
    }
}
