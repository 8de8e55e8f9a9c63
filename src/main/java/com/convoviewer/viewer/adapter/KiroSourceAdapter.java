package com.convoviewer.viewer.adapter;

import com.convoviewer.viewer.exception.SessionNotFoundException;
import com.convoviewer.viewer.model.Project;
import com.convoviewer.viewer.model.Session;
import com.convoviewer.viewer.model.Source;
import com.convoviewer.viewer.normalizer.dialect.JsonValues;
import com.convoviewer.viewer.normalizer.dialect.KiroDialect;
import com.convoviewer.viewer.normalizer.dialect.RecordDialect;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Kiro: workspaces are {@code <root>/<hash>/workspace.json} pointing at a folder; the
 * sessions of that folder live in {@code <sessionsRoot>/<encoded folder>/sessions.json}
 * and {@code <sessionId>.json}.
 */
@Slf4j
public class KiroSourceAdapter extends AbstractSourceAdapter {

    private static final String WORKSPACE_FILE = "workspace.json";
    private static final String SESSIONS_INDEX = "sessions.json";
    private static final String FILE_SCHEME = "file://";

    private final KiroDialect dialect = new KiroDialect();
    private final Path sessionsRoot;

    /**
     * @param rootPath - Kiro's {@code workspaceStorage} directory
     * @param sessionsRoot - {@code workspace-sessions} directory; null derives it from the root
     */
    public KiroSourceAdapter(Path rootPath, Path sessionsRoot, boolean enabled, ObjectMapper objectMapper) {
        super(Source.KIRO, rootPath, enabled, objectMapper);
        this.sessionsRoot = sessionsRoot != null ? sessionsRoot : defaultSessionsRoot(rootPath);
    }

    static Path defaultSessionsRoot(Path workspaceStorage) {
        Path absolute = workspaceStorage.toAbsolutePath();
        Path userDir = absolute.getParent() != null ? absolute.getParent() : absolute;
        return userDir.resolve("globalStorage").resolve("kiro.kiroagent").resolve("workspace-sessions");
    }

    public Path sessionsRoot() {
        return sessionsRoot;
    }

    @Override
    public List<Project> listProjects() {
        requireAvailable();
        List<Project> projects = new ArrayList<>();
        for (Path dir : listDirectories(rootPath)) {
            String folder = workspaceFolder(dir);
            if (folder == null) {
                continue;
            }
            projects.add(Project.builder()
                    .source(source)
                    .projectId(dir.getFileName().toString())
                    .displayName(lastSegments(folder, 3))
                    .sessionCount(sessionIndex(sessionsDir(folder)).size())
                    .lastModified(modifiedTime(dir))
                    .path(folder)
                    .build());
        }
        projects.sort(Comparator.comparing(Project::getLastModified, AbstractSourceAdapter::compareNewestFirst)
                .thenComparing(Project::getProjectId));
        return projects;
    }

    @Override
    public List<Session> listSessions(String projectId) {
        Path sessionsDir = sessionsDirOf(projectId);
        List<Session> sessions = new ArrayList<>();
        for (Map.Entry<String, JsonNode> indexed : sessionIndex(sessionsDir).entrySet()) {
            String sessionId = indexed.getKey();
            JsonNode entry = indexed.getValue();
            Path file = sessionsDir.resolve(sessionId + ".json");
            String title = truncateTitle(JsonValues.text(entry.path("title")));
            Session.SessionBuilder builder = Session.builder()
                    .source(source)
                    .projectId(projectId)
                    .sessionId(sessionId)
                    .createdAt(JsonValues.timestamp(entry.path("dateCreated")))
                    .sizeBytes(size(file))
                    .modifiedAt(modifiedTime(file));
            try {
                SessionScan scan = scan(historyOf(file));
                builder.messageCount(scan.getRecordCount());
                if (title == null) {
                    title = scan.title();
                }
            } catch (IOException | UncheckedIOException e) {
                log.warn("Failed to scan kiro session {}: {}", file, e.getMessage());
            }
            sessions.add(builder.title(title != null ? title : UNTITLED).build());
        }
        sessions.sort(Comparator.comparing(Session::getModifiedAt, AbstractSourceAdapter::compareNewestFirst)
                .thenComparing(Session::getSessionId));
        return sessions;
    }

    @Override
    public RawRecordSequence readMessages(String projectId, String sessionId) {
        return historyOf(sessionFile(projectId, sessionId));
    }

    @Override
    public List<Path> projectListingPaths() {
        List<Path> paths = new ArrayList<>();
        paths.add(rootPath);
        if (isAvailable()) {
            for (Path dir : listDirectories(rootPath)) {
                Path workspaceFile = dir.resolve(WORKSPACE_FILE);
                paths.add(workspaceFile);
                String folder = workspaceFolder(dir);
                if (folder != null) {
                    paths.add(sessionsDir(folder).resolve(SESSIONS_INDEX));
                }
            }
        }
        return paths;
    }

    @Override
    public List<Path> sessionListingPaths(String projectId) {
        Path sessionsDir = sessionsDirOf(projectId);
        List<Path> paths = new ArrayList<>();
        paths.add(sessionsDir.resolve(SESSIONS_INDEX));
        paths.addAll(listFiles(sessionsDir, ".json"));
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
     * Kiro's directory name for a workspace folder: base64 of the path with each
     * '=' pad replaced, one pad by "__" and two pads by "_".
     */
    static String encodeFolder(String folderPath) {
        String clean = folderPath.replace(FILE_SCHEME, "");
        byte[] bytes = clean.getBytes(StandardCharsets.UTF_8);
        String encoded = Base64.getEncoder().withoutPadding().encodeToString(bytes);
        int padding = (3 - bytes.length % 3) % 3;
        if (padding == 1) {
            return encoded + "__";
        }
        if (padding == 2) {
            return encoded + "_";
        }
        return encoded;
    }

    private Path sessionsDir(String folder) {
        return sessionsRoot.resolve(encodeFolder(folder));
    }

    private Path sessionsDirOf(String projectId) {
        Path dir = projectDir(projectId);
        String folder = workspaceFolder(dir);
        if (folder == null) {
            throw new SessionNotFoundException(source, projectId, null);
        }
        return sessionsDir(folder);
    }

    private String workspaceFolder(Path workspaceDir) {
        Path workspaceFile = workspaceDir.resolve(WORKSPACE_FILE);
        if (!Files.isRegularFile(workspaceFile)) {
            return null;
        }
        try {
            String folder = JsonValues.text(objectMapper.readTree(workspaceFile.toFile()).path("folder"));
            return folder == null || folder.isBlank() ? null : folder.replace(FILE_SCHEME, "");
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", workspaceFile, e.getMessage());
            return null;
        }
    }

    /**
     * Entries of {@code sessions.json} by session id, in index order. The first entry of a
     * repeated id wins; entries without a plain id or a session file are left out.
     */
    private Map<String, JsonNode> sessionIndex(Path sessionsDir) {
        Path index = sessionsDir.resolve(SESSIONS_INDEX);
        Map<String, JsonNode> entries = new LinkedHashMap<>();
        if (!Files.isRegularFile(index)) {
            return entries;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(index.toFile());
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", index, e.getMessage());
            return entries;
        }
        if (root == null || !root.isArray()) {
            return entries;
        }
        for (JsonNode entry : root) {
            String sessionId = entry.isObject() ? JsonValues.text(entry.path("sessionId")) : null;
            if (sessionId == null || !isPlainName(sessionId) || entries.containsKey(sessionId)) {
                continue;
            }
            if (!Files.isRegularFile(sessionsDir.resolve(sessionId + ".json"))) {
                log.debug("Skipping kiro session {} without a session file in {}", sessionId, sessionsDir);
                continue;
            }
            entries.put(sessionId, entry);
        }
        return entries;
    }

    private RawRecordSequence historyOf(Path file) {
        return new JsonDocumentSequence(file, objectMapper, root -> root.path("history"));
    }

    private Path sessionFile(String projectId, String sessionId) {
        Path sessionsDir = sessionsDirOf(projectId);
        if (!isPlainName(sessionId)) {
            throw new SessionNotFoundException(source, projectId, sessionId);
        }
        Path file = sessionsDir.resolve(sessionId + ".json");
        if (!Files.isRegularFile(file)) {
            throw new SessionNotFoundException(source, projectId, sessionId);
        }
        return file;
    }
}
