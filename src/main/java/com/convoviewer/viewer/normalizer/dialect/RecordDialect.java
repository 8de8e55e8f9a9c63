package com.convoviewer.viewer.normalizer.dialect;

import com.convoviewer.viewer.model.Role;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.time.Instant;
import java.util.Map;

/**
 * How one platform lays out a message record: where role, content and time live,
 * and how its role tokens map onto {@link Role}.
 *
 * Each source adapter supplies its dialect, and the normalizer registers them per
 * source at startup. Role is derived from record structure only, never from content.
 */
public interface RecordDialect {

    /** Platform role token of the record, or null when the record carries none. */
    String roleToken(JsonNode record);

    /** Role token to unified role. Tokens absent from the table make the record a placeholder. */
    Map<String, Role> roleTable();

    /** Content node: a string or an array of blocks. Missing when the record has no content. */
    JsonNode content(JsonNode record);

    Instant timestamp(JsonNode record);

    /** Record type as written by the platform, for display and diagnostics. */
    String rawType(JsonNode record);

    /** Platform-level structured result of a tool call attached to the whole record, if any. */
    default JsonNode toolUseResult(JsonNode record) {
        return MissingNode.getInstance();
    }
}
