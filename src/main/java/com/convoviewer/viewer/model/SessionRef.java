package com.convoviewer.viewer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * Identity tuple used by external stores (favorites, bookmarks) as an opaque key.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionRef {

    Source source;

    String projectId;

    String sessionId;

    Integer lineIndex;

    public static SessionRef of(Source source, String projectId, String sessionId) {
        return new SessionRef(source, projectId, sessionId, null);
    }

    public SessionRef atLine(int lineIndex) {
        return new SessionRef(source, projectId, sessionId, lineIndex);
    }
}
