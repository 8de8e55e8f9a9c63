package com.convoviewer.viewer.adapter;

import com.convoviewer.viewer.model.Project;
import com.convoviewer.viewer.model.Session;
import com.convoviewer.viewer.model.Source;
import com.convoviewer.viewer.normalizer.dialect.RecordDialect;

import java.nio.file.Path;
import java.util.List;

/**
 * Reads one platform's on-disk conversation logs.
 *
 * Adapters never write to the logs and hold no state between calls; caching is
 * done by the callers, keyed on the paths returned by the {@code *Paths} methods.
 */
public interface SourceAdapter {

    Source source();

    Path rootPath();

    /** Enabled in configuration. A disabled source is skipped by multi-source operations. */
    boolean isEnabled();

    /** Root directory exists and is readable. */
    boolean isAvailable();

    /**
     * @return Projects sorted by last modification, newest first
     * @throws com.convoviewer.viewer.exception.SourceUnavailableException if the root is missing or unreadable
     */
    List<Project> listProjects();

    /**
     * @return Session metadata sorted by last modification, newest first
     * @throws com.convoviewer.viewer.exception.SessionNotFoundException if the project does not exist
     */
    List<Session> listSessions(String projectId);

    /**
     * @return Lazy sequence over the session's records; nothing is read until it is opened
     * @throws com.convoviewer.viewer.exception.SessionNotFoundException if the session does not exist
     */
    RawRecordSequence readMessages(String projectId, String sessionId);

    /** Files whose change means the project listing must be rebuilt. */
    List<Path> projectListingPaths();

    /** Files whose change means the session listing of a project must be rebuilt. */
    List<Path> sessionListingPaths(String projectId);

    /** Files whose change means the session's messages must be re-read. */
    List<Path> sessionPaths(String projectId, String sessionId);

    RecordDialect dialect();
}
