package com.convoviewer.viewer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Overview of one session: the platform's own summary text when it wrote one, plus counts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummary {

    private SessionRef session;

    private String title;

    /** Text of the first summary record, null when the session has none. */
    private String summary;

    private Integer messageCount;

    @Builder.Default
    private Map<Role, Integer> roleCounts = new EnumMap<>(Role.class);

    private Integer toolCallCount;

    private Integer editCount;

    private Integer placeholderCount;

    private Instant firstTimestamp;

    private Instant lastTimestamp;
}
