package com.convoviewer.viewer.normalizer.dialect;

import com.convoviewer.viewer.model.Role;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;

/**
 * Kiro session history entries: {@code {message: {role, type?, content: [blocks]}}}.
 * Entries without a role are assistant turns.
 */
public class KiroDialect implements RecordDialect {

    private static final Map<String, Role> ROLES = Map.of(
            "user", Role.USER,
            "assistant", Role.ASSISTANT,
            "summary", Role.SUMMARY,
            "tool", Role.TOOL);

    @Override
    public String roleToken(JsonNode record) {
        JsonNode message = record.path("message");
        if (!message.isObject()) {
            return null;
        }
        if ("summary".equals(JsonValues.text(message.path("type")))) {
            return "summary";
        }
        String role = JsonValues.text(message.path("role"));
        return role != null ? role : "assistant";
    }

    @Override
    public Map<String, Role> roleTable() {
        return ROLES;
    }

    @Override
    public JsonNode content(JsonNode record) {
        return record.path("message").path("content");
    }

    @Override
    public Instant timestamp(JsonNode record) {
        return JsonValues.timestamp(JsonValues.firstPresent(record, "timestamp", "createdAt"));
    }

    @Override
    public String rawType(JsonNode record) {
        return roleToken(record);
    }
}
