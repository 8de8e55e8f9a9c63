package com.convoviewer.viewer.normalizer;

import com.convoviewer.viewer.adapter.SourceAdapter;
import com.convoviewer.viewer.adapter.SourceAdapterRegistry;
import com.convoviewer.viewer.diff.DiffEngine;
import com.convoviewer.viewer.model.Message;
import com.convoviewer.viewer.model.RawRecord;
import com.convoviewer.viewer.model.Role;
import com.convoviewer.viewer.model.Source;
import com.convoviewer.viewer.model.ToolCall;
import com.convoviewer.viewer.normalizer.dialect.JsonValues;
import com.convoviewer.viewer.normalizer.dialect.RecordDialect;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Converts raw platform records into {@link Message}s.
 *
 * Role comes from the source's {@link RecordDialect} role table; records whose role
 * token is not in the table, or that carry no content, become placeholder summary
 * messages so that no record silently disappears from a session.
 */
@Slf4j
public class MessageNormalizer {

    static final String IMAGE_PLACEHOLDER = "[Image attached]";
    static final int PARAMETER_PREVIEW_CHARS = 100;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final Map<Source, RecordDialect> dialects = new EnumMap<>(Source.class);
    private final DiffEngine diffEngine;
    private final ObjectMapper objectMapper;
    private final Set<String> editTools;
    private final int toolOutputMaxChars;

    public MessageNormalizer(SourceAdapterRegistry registry,
                             DiffEngine diffEngine,
                             ObjectMapper objectMapper,
                             Set<String> editTools,
                             int toolOutputMaxChars) {
        for (SourceAdapter adapter : registry.all()) {
            dialects.put(adapter.source(), adapter.dialect());
        }
        this.diffEngine = diffEngine;
        this.objectMapper = objectMapper;
        this.editTools = Set.copyOf(editTools);
        this.toolOutputMaxChars = toolOutputMaxChars;
    }

    /**
     * Normalize one record on its own. Tool results are not linked to the call that produced them.
     */
    public Message normalize(Source source, RawRecord record) {
        return normalize(source, record, new HashMap<>());
    }

    /**
     * Normalize a whole session in order, naming each tool result after the earlier
     * tool call with the same id.
     *
     * @param source - Source the records were read from
     * @param records - Records in log order; not closed by this method
     * @return Messages in the same order, one per record
     */
    public List<Message> normalizeAll(Source source, Stream<RawRecord> records) {
        Map<String, String> toolNamesById = new HashMap<>();
        return records.map(record -> normalize(source, record, toolNamesById))
                .collect(Collectors.toUnmodifiableList());
    }

    private Message normalize(Source source, RawRecord record, Map<String, String> toolNamesById) {
        RecordDialect dialect = dialects.get(source);
        if (dialect == null) {
            throw new IllegalArgumentException("No dialect registered for source " + source.id());
        }
        JsonNode payload = record.getPayload();
        if (payload == null || !payload.isObject()) {
            return placeholder(source, record.getLineIndex(), null, null, "record is not a JSON object", null);
        }

        String rawType = dialect.rawType(payload);
        Instant timestamp = dialect.timestamp(payload);
        String token = dialect.roleToken(payload);
        Role role = token == null ? null : dialect.roleTable().get(token);
        JsonNode content = dialect.content(payload);

        if (content.isMissingNode() || content.isNull()) {
            return placeholder(source, record.getLineIndex(), timestamp, rawType, "record has no content", null);
        }

        RenderedContent rendered = render(content, dialect.toolUseResult(payload), toolNamesById);
        if (role == null) {
            return placeholder(source, record.getLineIndex(), timestamp, rawType,
                    token == null ? "record has no role" : "unknown role '" + token + "'", rendered.text);
        }

        return Message.builder()
                .lineIndex(record.getLineIndex())
                .role(role)
                .timestamp(timestamp)
                .content(rendered.text)
                .toolCalls(rendered.toolCalls)
                .rawType(rawType)
                .build();
    }

    private Message placeholder(Source source, int lineIndex, Instant timestamp, String rawType,
                                String reason, String text) {
        log.debug("Placeholder for {} record at {}: {}", source.id(), lineIndex, reason);
        String label = rawType != null ? rawType : "unknown";
        StringBuilder content = new StringBuilder()
                .append("Unrecognized ").append(source.id()).append(" record of type '").append(label)
                .append("' (").append(reason).append(")");
        if (text != null && !text.isBlank()) {
            content.append("\n\n").append(text);
        }
        return Message.builder()
                .lineIndex(lineIndex)
                .role(Role.SUMMARY)
                .timestamp(timestamp)
                .content(content.toString())
                .rawType(rawType)
                .placeholder(true)
                .build();
    }

    private RenderedContent render(JsonNode content, JsonNode toolUseResult, Map<String, String> toolNamesById) {
        RenderedContent rendered = new RenderedContent();
        if (content.isTextual()) {
            rendered.text = content.asText();
            return rendered;
        }
        if (!content.isArray() && !content.isObject()) {
            rendered.text = content.asText();
            return rendered;
        }

        List<JsonNode> blocks = new ArrayList<>();
        if (content.isArray()) {
            content.forEach(blocks::add);
        } else {
            blocks.add(content);
        }

        List<String> parts = new ArrayList<>();
        for (JsonNode block : blocks) {
            if (block.isTextual()) {
                parts.add(block.asText());
                continue;
            }
            if (!block.isObject()) {
                parts.add(block.toString());
                continue;
            }
            String type = JsonValues.text(block.path("type"));
            if ("text".equals(type) || (type == null && block.path("text").isTextual())) {
                parts.add(block.path("text").asText(""));
            } else if ("image".equals(type)) {
                parts.add(IMAGE_PLACEHOLDER);
            } else if ("thinking".equals(type)) {
                String thinking = JsonValues.text(block.path("thinking"));
                if (thinking != null && !thinking.isBlank()) {
                    parts.add("*Thinking:*\n" + thinking);
                }
            } else if ("tool_use".equals(type)) {
                ToolCall call = toolUse(block);
                if (call.getId() != null) {
                    toolNamesById.put(call.getId(), call.getName());
                }
                rendered.toolCalls.add(call);
                parts.add(describeToolUse(call));
            } else if ("tool_result".equals(type)) {
                ToolCall call = toolResult(block, toolUseResult, toolNamesById);
                rendered.toolCalls.add(call);
                parts.add(describeToolResult(call));
            } else {
                rendered.toolCalls.add(ToolCall.builder()
                        .name(ToolCall.UNKNOWN)
                        .parameters(toMap(block))
                        .build());
                parts.add("**" + (type != null ? type : "Unknown") + ":**\n```json\n" + pretty(block) + "\n```");
            }
        }
        rendered.text = String.join("\n\n", parts);
        return rendered;
    }

    private ToolCall toolUse(JsonNode block) {
        String name = JsonValues.text(block.path("name"));
        Map<String, Object> parameters = toMap(block.path("input"));
        return withEditDetection(ToolCall.builder()
                .id(JsonValues.text(block.path("id")))
                .name(name != null ? name : ToolCall.UNKNOWN)
                .parameters(parameters)
                .build());
    }

    private ToolCall toolResult(JsonNode block, JsonNode toolUseResult, Map<String, String> toolNamesById) {
        String toolUseId = JsonValues.text(block.path("tool_use_id"));
        String name = toolUseId != null ? toolNamesById.get(toolUseId) : null;

        Map<String, Object> parameters = new LinkedHashMap<>();
        JsonNode structured = block.path("toolUseResult");
        if (!structured.isObject()) {
            structured = toolUseResult;
        }
        if (structured.isObject()) {
            parameters.putAll(toMap(structured));
        }

        return withEditDetection(ToolCall.builder()
                .id(toolUseId)
                .name(name != null ? name : ToolCall.UNKNOWN)
                .parameters(parameters)
                .result(resultOf(block.path("content")))
                .build());
    }

    /**
     * An edit is a call to a configured edit tool that carries both the text before
     * and after the change.
     */
    private ToolCall withEditDetection(ToolCall call) {
        Map<String, Object> params = call.getParameters();
        Object before = params.containsKey("old_string") ? params.get("old_string") : params.get("oldString");
        Object after = params.containsKey("new_string") ? params.get("new_string") : params.get("newString");
        if (!editTools.contains(call.getName()) || !(before instanceof String) || !(after instanceof String)) {
            return call;
        }
        return call.toBuilder()
                .edit(true)
                .diff(diffEngine.diff((String) before, (String) after))
                .build();
    }

    private Object resultOf(JsonNode content) {
        if (content.isMissingNode() || content.isNull()) {
            return null;
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            List<String> texts = new ArrayList<>();
            boolean allText = true;
            for (JsonNode part : content) {
                if (part.isTextual()) {
                    texts.add(part.asText());
                } else if ("text".equals(JsonValues.text(part.path("type")))) {
                    texts.add(part.path("text").asText(""));
                } else {
                    allText = false;
                }
            }
            if (allText) {
                return String.join("\n", texts);
            }
        }
        return objectMapper.convertValue(content, Object.class);
    }

    private String describeToolUse(ToolCall call) {
        StringBuilder sb = new StringBuilder();
        if (call.isEdit()) {
            sb.append("**Edit Tool: ").append(filePathOf(call)).append("**");
            return sb.toString();
        }
        sb.append("**Tool Used: ").append(call.getName()).append("**");
        if (call.getParameters().isEmpty()) {
            sb.append("\n  (no parameters)");
        }
        for (Map.Entry<String, Object> param : call.getParameters().entrySet()) {
            Object value = param.getValue();
            String shown = value instanceof String && ((String) value).length() > PARAMETER_PREVIEW_CHARS
                    ? ((String) value).substring(0, PARAMETER_PREVIEW_CHARS) + "..."
                    : String.valueOf(value);
            sb.append("\n  **").append(param.getKey()).append("**: ").append(shown);
        }
        return sb.toString();
    }

    private String describeToolResult(ToolCall call) {
        List<String> parts = new ArrayList<>();
        if (call.isEdit()) {
            parts.add("**Edit Result: " + filePathOf(call) + "**");
        }
        Object result = call.getResult();
        if (result instanceof String) {
            String output = (String) result;
            if (!call.isEdit() || !output.isBlank()) {
                if (output.length() > toolOutputMaxChars) {
                    output = output.substring(0, toolOutputMaxChars) + "\n... (output truncated by viewer)";
                }
                parts.add("**Tool Output:**\n```\n" + output + "\n```");
            }
        } else if (result != null) {
            parts.add("**Tool Output:**\n```json\n" + pretty(objectMapper.valueToTree(result)) + "\n```");
        }
        return parts.isEmpty() ? "**Tool Output:**\n```\n\n```" : String.join("\n\n", parts);
    }

    private static String filePathOf(ToolCall call) {
        Object path = call.getParameters().get("file_path");
        if (path == null) {
            path = call.getParameters().get("filePath");
        }
        return path != null ? path.toString() : "unknown_file";
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Collections.emptyMap();
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private String pretty(JsonNode node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return node.toString();
        }
    }

    private static final class RenderedContent {
        private String text = "";
        private final List<ToolCall> toolCalls = new ArrayList<>();
    }
}
