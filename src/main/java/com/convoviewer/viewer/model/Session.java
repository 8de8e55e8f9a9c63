package com.convoviewer.viewer.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Metadata of one conversation thread. Message bodies are read separately.
 */
@Value
@Builder
public class Session {

    Source source;

    String projectId;

    String sessionId;

    int messageCount;

    long sizeBytes;

    Instant createdAt;

    Instant modifiedAt;

    String title;

    public SessionRef ref() {
        return SessionRef.of(source, projectId, sessionId);
    }
}
