package com.convoviewer.viewer.adapter;

import com.convoviewer.viewer.exception.SessionNotFoundException;
import com.convoviewer.viewer.model.Project;
import com.convoviewer.viewer.model.Session;
import com.convoviewer.viewer.model.Source;
import com.convoviewer.viewer.normalizer.dialect.JsonValues;
import com.convoviewer.viewer.normalizer.dialect.QwenDialect;
import com.convoviewer.viewer.normalizer.dialect.RecordDialect;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Qwen Code: {@code <root>/<project-hash>/chats/<session>.json}, each a document
 * {@code {sessionId, projectHash, startTime, lastUpdated, messages: [...]}}.
 */
@Slf4j
public class QwenSourceAdapter extends AbstractSourceAdapter {

    private static final String CHATS_DIR = "chats";
    private static final String EXTENSION = ".json";
    private static final String PROJECT_NOTES = "QWEN.md";
    private static final int SHORT_HASH_LENGTH = 12;

    private final QwenDialect dialect = new QwenDialect();

    public QwenSourceAdapter(Path rootPath, boolean enabled, ObjectMapper objectMapper) {
        super(Source.QWEN, rootPath, enabled, objectMapper);
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
                    .displayName(displayName(dir))
                    .sessionCount(listFiles(dir.resolve(CHATS_DIR), EXTENSION).size())
                    .lastModified(modifiedTime(dir))
                    .path(dir.toString())
                    .build());
        }
        projects.sort(Comparator.comparing(Project::getLastModified, AbstractSourceAdapter::compareNewestFirst)
                .thenComparing(Project::getProjectId));
        return projects;
    }

    @Override
    public List<Session> listSessions(String projectId) {
        Path chats = projectDir(projectId).resolve(CHATS_DIR);
        List<Session> sessions = new ArrayList<>();
        for (Path file : listFiles(chats, EXTENSION)) {
            String sessionId = FilenameUtils.getBaseName(file.getFileName().toString());
            Session.SessionBuilder builder = Session.builder()
                    .source(source)
                    .projectId(projectId)
                    .sessionId(sessionId)
                    .sizeBytes(size(file))
                    .modifiedAt(modifiedTime(file));
            try {
                SessionScan scan = scan(messagesOf(file));
                Instant created = startTime(file);
                builder.messageCount(scan.getRecordCount())
                        .title(scan.title())
                        .createdAt(created != null ? created : scan.getFirstTimestamp());
            } catch (IOException | UncheckedIOException e) {
                log.warn("Failed to scan qwen session {}: {}", file, e.getMessage());
                builder.title(UNTITLED);
            }
            sessions.add(builder.build());
        }
        sessions.sort(Comparator.comparing(Session::getModifiedAt, AbstractSourceAdapter::compareNewestFirst)
                .thenComparing(Session::getSessionId));
        return sessions;
    }

    @Override
    public RawRecordSequence readMessages(String projectId, String sessionId) {
        return messagesOf(sessionFile(projectId, sessionId));
    }

    @Override
    public List<Path> projectListingPaths() {
        List<Path> paths = new ArrayList<>();
        paths.add(rootPath);
        if (isAvailable()) {
            for (Path dir : listDirectories(rootPath)) {
                paths.add(dir);
                paths.add(dir.resolve(CHATS_DIR));
                paths.add(dir.resolve(PROJECT_NOTES));
            }
        }
        return paths;
    }

    @Override
    public List<Path> sessionListingPaths(String projectId) {
        Path chats = projectDir(projectId).resolve(CHATS_DIR);
        List<Path> paths = new ArrayList<>();
        paths.add(chats);
        paths.addAll(listFiles(chats, EXTENSION));
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
     * First line of QWEN.md without its heading marker, else the shortened hash.
     */
    String displayName(Path projectDir) {
        Path notes = projectDir.resolve(PROJECT_NOTES);
        if (Files.isRegularFile(notes)) {
            try (BufferedReader reader = Files.newBufferedReader(notes, StandardCharsets.UTF_8)) {
                String firstLine = reader.readLine();
                if (firstLine != null && !firstLine.isBlank()) {
                    String line = firstLine.strip();
                    return line.startsWith("# ") ? line.substring(2).strip() : line;
                }
            } catch (IOException e) {
                log.debug("Cannot read {}: {}", notes, e.getMessage());
            }
        }
        String hash = projectDir.getFileName().toString();
        return hash.length() > SHORT_HASH_LENGTH ? hash.substring(0, SHORT_HASH_LENGTH) : hash;
    }

    private RawRecordSequence messagesOf(Path file) {
        return new JsonDocumentSequence(file, objectMapper, root -> root.path("messages"));
    }

    private Instant startTime(Path file) {
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            return root == null ? null : JsonValues.timestamp(root.path("startTime"));
        } catch (IOException e) {
            return null;
        }
    }

    private Path sessionFile(String projectId, String sessionId) {
        Path dir = projectDir(projectId);
        if (!isPlainName(sessionId)) {
            throw new SessionNotFoundException(source, projectId, sessionId);
        }
        Path file = dir.resolve(CHATS_DIR).resolve(sessionId + EXTENSION);
        if (!Files.isRegularFile(file)) {
            throw new SessionNotFoundException(source, projectId, sessionId);
        }
        return file;
    }
}
