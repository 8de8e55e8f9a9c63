package com.convoviewer.viewer.normalizer.dialect;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Lenient accessors for best-effort parsing of versionless log records.
 */
public final class JsonValues {

    private static final long EPOCH_SECONDS_CUTOFF = 100_000_000_000L;

    private JsonValues() {
    }

    /**
     * Textual value of a node, or null when the node is absent, null or not a scalar.
     */
    public static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    /**
     * First field among {@code names} holding a non-blank text value.
     */
    public static String firstText(JsonNode node, String... names) {
        for (String name : names) {
            String value = text(node.path(name));
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    /**
     * First field among {@code names} that is present and non-null, or a missing node.
     */
    public static JsonNode firstPresent(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.path(name);
            if (!value.isMissingNode() && !value.isNull()) {
                if (value.isTextual() && value.asText().isEmpty()) {
                    continue;
                }
                return value;
            }
        }
        return MissingNode.getInstance();
    }

    /**
     * Parse ISO-8601 text or epoch seconds/millis into an instant; null when unparseable.
     */
    public static Instant timestamp(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return fromEpoch(node.asLong());
        }
        String value = node.asText().trim();
        if (value.isEmpty()) {
            return null;
        }
        if (value.chars().allMatch(Character::isDigit)) {
            try {
                return fromEpoch(Long.parseLong(value));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value).toInstant();
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private static Instant fromEpoch(long value) {
        return value < EPOCH_SECONDS_CUTOFF ? Instant.ofEpochSecond(value) : Instant.ofEpochMilli(value);
    }

    /**
     * Plain text of a content node for titles and previews: the string itself, or the first
     * non-blank text block of a block array.
     */
    public static String plainText(JsonNode content) {
        if (content == null || content.isMissingNode() || content.isNull()) {
            return null;
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            for (JsonNode block : content) {
                if (block.isTextual() && !block.asText().isBlank()) {
                    return block.asText();
                }
                if ("text".equals(text(block.path("type")))) {
                    String t = text(block.path("text"));
                    if (t != null && !t.isBlank()) {
                        return t;
                    }
                }
            }
        }
        return null;
    }
}
