package com.convoviewer.viewer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A session matching a global search query.
 */
@Value
@Builder
public class SearchHit {

    Source source;

    String projectId;

    String projectDisplayName;

    String sessionId;

    String sessionTitle;

    Instant modifiedAt;

    /** Total occurrences of the query; the primary ranking key. */
    int matchCount;

    int matchingMessages;

    @Singular
    List<MessagePreview> previews;

    public SessionRef getRef() {
        return SessionRef.of(source, projectId, sessionId);
    }
}
