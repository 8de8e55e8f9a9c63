package com.convoviewer.viewer.adapter;

import com.convoviewer.viewer.exception.SessionNotFoundException;
import com.convoviewer.viewer.model.Project;
import com.convoviewer.viewer.model.Session;
import com.convoviewer.viewer.model.Source;
import com.convoviewer.viewer.normalizer.dialect.ClaudeDialect;
import com.convoviewer.viewer.normalizer.dialect.RecordDialect;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Claude Code: {@code <root>/<project-dir>/<session-id>.jsonl}.
 *
 * Project directories are the workspace path with separators replaced by dashes,
 * e.g. {@code -Users-me-work-api}.
 */
@Slf4j
public class ClaudeSourceAdapter extends AbstractSourceAdapter {

    private static final String EXTENSION = ".jsonl";

    private final ClaudeDialect dialect = new ClaudeDialect();

    public ClaudeSourceAdapter(Path rootPath, boolean enabled, ObjectMapper objectMapper) {
        super(Source.CLAUDE, rootPath, enabled, objectMapper);
    }

    @Override
    public List<Project> listProjects() {
        requireAvailable();
        List<Project> projects = new ArrayList<>();
        for (Path dir : listDirectories(rootPath)) {
            String projectId = dir.getFileName().toString();
            projects.add(Project.builder()
                    .source(source)
                    .projectId(projectId)
                    .displayName(displayName(projectId))
                    .sessionCount(listFiles(dir, EXTENSION).size())
                    .lastModified(modifiedTime(dir))
                    .path(dir.toString())
                    .build());
        }
        projects.sort(Comparator.comparing(Project::getLastModified, AbstractSourceAdapter::compareNewestFirst)
                .thenComparing(Project::getProjectId));
        log.debug("Found {} claude projects under {}", projects.size(), rootPath);
        return projects;
    }

    @Override
    public List<Session> listSessions(String projectId) {
        Path dir = projectDir(projectId);
        List<Session> sessions = new ArrayList<>();
        for (Path file : listFiles(dir, EXTENSION)) {
            String sessionId = FilenameUtils.getBaseName(file.getFileName().toString());
            Session.SessionBuilder builder = Session.builder()
                    .source(source)
                    .projectId(projectId)
                    .sessionId(sessionId)
                    .sizeBytes(size(file))
                    .modifiedAt(modifiedTime(file));
            try {
                SessionScan scan = scan(new JsonLinesSequence(file, objectMapper));
                Instant created = scan.getFirstTimestamp();
                builder.messageCount(scan.getRecordCount())
                        .title(scan.title())
                        .createdAt(created != null ? created : creationTime(file));
            } catch (IOException | UncheckedIOException e) {
                log.warn("Failed to scan claude session {}: {}", file, e.getMessage());
                builder.title(UNTITLED).createdAt(creationTime(file));
            }
            sessions.add(builder.build());
        }
        sessions.sort(Comparator.comparing(Session::getModifiedAt, AbstractSourceAdapter::compareNewestFirst)
                .thenComparing(Session::getSessionId));
        return sessions;
    }

    @Override
    public RawRecordSequence readMessages(String projectId, String sessionId) {
        return new JsonLinesSequence(sessionFile(projectId, sessionId), objectMapper);
    }

    @Override
    public List<Path> projectListingPaths() {
        List<Path> paths = new ArrayList<>();
        paths.add(rootPath);
        if (isAvailable()) {
            paths.addAll(listDirectories(rootPath));
        }
        return paths;
    }

    @Override
    public List<Path> sessionListingPaths(String projectId) {
        Path dir = projectDir(projectId);
        List<Path> paths = new ArrayList<>();
        paths.add(dir);
        paths.addAll(listFiles(dir, EXTENSION));
        return paths;
    }

    @Override
    public List<Path> sessionPaths(String projectId, String sessionId) {
        return List.of(sessionFile(projectId, sessionId));
    }

    @Override
    public RecordDialect dialect() {
        return dialect;
    }

    /**
     * "-Users-me-work-acme-api" becomes "work/acme/api". Names without the leading dash are kept.
     */
    static String displayName(String projectId) {
        if (!projectId.startsWith("-")) {
            return projectId;
        }
        List<String> parts = Arrays.asList(projectId.substring(1).split("-"));
        if (parts.size() > 3) {
            parts = parts.subList(parts.size() - 3, parts.size());
        }
        return String.join("/", parts);
    }

    private Path sessionFile(String projectId, String sessionId) {
        Path dir = projectDir(projectId);
        if (!isPlainName(sessionId)) {
            throw new SessionNotFoundException(source, projectId, sessionId);
        }
        Path file = dir.resolve(sessionId + EXTENSION);
        if (!Files.isRegularFile(file)) {
            throw new SessionNotFoundException(source, projectId, sessionId);
        }
        return file;
    }
}
