package com.convoviewer.viewer.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A group of sessions for one source, usually one workspace or repository.
 * Rebuilt on every scan of the source's root directory.
 */
@Value
@Builder
public class Project {

    Source source;

    String projectId;

    String displayName;

    int sessionCount;

    Instant lastModified;

    String path;
}
