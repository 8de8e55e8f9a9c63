package com.convoviewer.viewer.exception;

import com.convoviewer.viewer.model.Source;
import lombok.Getter;

@Getter
public class SessionNotFoundException extends RuntimeException {

    private final Source source;

    private final String projectId;

    private final String sessionId;

    public SessionNotFoundException(Source source, String projectId, String sessionId) {
        super(sessionId == null
                ? "Project not found: " + source.id() + "/" + projectId
                : "Session not found: " + source.id() + "/" + projectId + "/" + sessionId);
        this.source = source;
        this.projectId = projectId;
        this.sessionId = sessionId;
    }
}
