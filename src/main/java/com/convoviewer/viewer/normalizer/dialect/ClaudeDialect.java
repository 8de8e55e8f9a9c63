package com.convoviewer.viewer.normalizer.dialect;

import com.convoviewer.viewer.model.Role;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.time.Instant;
import java.util.Map;

/**
 * Claude Code JSONL records: {@code {type, message: {role, content}, timestamp, toolUseResult}},
 * {@code {type: "summary", summary}}, and the legacy {@code {role, content}} shape.
 */
public class ClaudeDialect implements RecordDialect {

    /** User records that only carry tool results are tool turns, not user turns. */
    static final String TOOL_RESULT_TOKEN = "tool_result";

    private static final Map<String, Role> ROLES = Map.of(
            "user", Role.USER,
            "assistant", Role.ASSISTANT,
            "summary", Role.SUMMARY,
            "system", Role.SUMMARY,
            TOOL_RESULT_TOKEN, Role.TOOL);

    @Override
    public String roleToken(JsonNode record) {
        String type = JsonValues.text(record.path("type"));
        if (type == null) {
            return JsonValues.text(record.path("role"));
        }
        if ("user".equals(type) && onlyToolResults(record.path("message").path("content"))) {
            return TOOL_RESULT_TOKEN;
        }
        return type;
    }

    @Override
    public Map<String, Role> roleTable() {
        return ROLES;
    }

    @Override
    public JsonNode content(JsonNode record) {
        String type = JsonValues.text(record.path("type"));
        if (type == null) {
            return record.path("content");
        }
        switch (type) {
            case "summary":
                return record.path("summary");
            case "user":
            case "assistant":
                return record.path("message").path("content");
            case "system":
                return record.path("content");
            default:
                return MissingNode.getInstance();
        }
    }

    @Override
    public Instant timestamp(JsonNode record) {
        return JsonValues.timestamp(record.path("timestamp"));
    }

    @Override
    public String rawType(JsonNode record) {
        String type = JsonValues.text(record.path("type"));
        return type != null ? type : JsonValues.text(record.path("role"));
    }

    @Override
    public JsonNode toolUseResult(JsonNode record) {
        return record.path("toolUseResult");
    }

    private static boolean onlyToolResults(JsonNode content) {
        if (!content.isArray() || content.isEmpty()) {
            return false;
        }
        for (JsonNode block : content) {
            if (!TOOL_RESULT_TOKEN.equals(JsonValues.text(block.path("type")))) {
                return false;
            }
        }
        return true;
    }
}
