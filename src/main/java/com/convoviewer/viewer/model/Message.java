package com.convoviewer.viewer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One normalized turn of a session.
 *
 * <p>{@code lineIndex} is the record's position in the source log and doubles as the
 * message identity, so it stays the same across re-parses of an unchanged file.
 */
@Value
@Builder(toBuilder = true)
public class Message {

    int lineIndex;

    Role role;

    Instant timestamp;

    String content;

    @Singular
    List<ToolCall> toolCalls;

    /** Platform record type as written in the log, e.g. "user", "qwen", "summary". */
    String rawType;

    /** True when the record could not be normalized and this message stands in for it. */
    boolean placeholder;
}
