package com.convoviewer.viewer.adapter;

import com.convoviewer.viewer.exception.SessionNotFoundException;
import com.convoviewer.viewer.model.Project;
import com.convoviewer.viewer.model.RawRecord;
import com.convoviewer.viewer.model.Session;
import com.convoviewer.viewer.model.Source;
import com.convoviewer.viewer.normalizer.dialect.JsonValues;
import com.convoviewer.viewer.normalizer.dialect.RecordDialect;
import com.convoviewer.viewer.normalizer.dialect.StateItemDialect;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * VS Code based editors: {@code <root>/<workspace-hash>/state.vscdb}, a SQLite database
 * with table {@code ItemTable(key, value)}. One workspace is one project with a single
 * session, whose id is the state key holding the chat items.
 *
 * Databases are opened read-only for every call and never kept open.
 */
@Slf4j
public abstract class AbstractStateDbSourceAdapter extends AbstractSourceAdapter {

    static final String STATE_DB = "state.vscdb";
    static final String WORKSPACE_FILE = "workspace.json";

    private static final List<String> KEY_PATTERNS = List.of(
            "%prompt%", "%ai%", "%chat%", "%chatHistory%", "%message%", "%history%",
            "%conversation%", "%threads%", "%sessions%", "%kiro%");

    private static final List<String> KEY_BLACKLIST = List.of(
            "memento/", "workbench.", "terminal", "scm.", "debug.", "vscode.", "output.");

    private static final int LARGEST_VALUES_FALLBACK = 50;

    private final StateItemDialect dialect = new StateItemDialect();
    private final StateItemExtractor extractor;

    protected AbstractStateDbSourceAdapter(Source source, Path rootPath, boolean enabled, ObjectMapper objectMapper) {
        super(source, rootPath, enabled, objectMapper);
        this.extractor = new StateItemExtractor(objectMapper, dialect);
    }

    /**
     * State keys known to hold the platform's chat items, tried in order.
     */
    protected abstract List<String> knownKeys();

    /**
     * Whether to search the database for a chat-like key when no known key exists.
     */
    protected abstract boolean discoverKeys();

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
                    .sessionCount(Files.isRegularFile(dir.resolve(STATE_DB)) ? 1 : 0)
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
        Path db = projectDir(projectId).resolve(STATE_DB);
        List<Session> sessions = new ArrayList<>();
        if (!Files.isRegularFile(db)) {
            return sessions;
        }
        try (Connection connection = openReadOnly(db)) {
            String key = resolveStateKey(connection);
            if (key == null) {
                log.debug("No chat state key in {}", db);
                return sessions;
            }
            List<ObjectNode> items = extractor.extract(readValue(connection, key));
            SessionScan scan = scan(sequenceOf(items));
            sessions.add(Session.builder()
                    .source(source)
                    .projectId(projectId)
                    .sessionId(key)
                    .messageCount(scan.getRecordCount())
                    .sizeBytes(size(db))
                    .createdAt(scan.getFirstTimestamp() != null ? scan.getFirstTimestamp() : creationTime(db))
                    .modifiedAt(modifiedTime(db))
                    .title(scan.title())
                    .build());
        } catch (SQLException | IOException | UncheckedIOException e) {
            log.warn("Failed to read {} state from {}: {}", source.id(), db, e.getMessage());
        }
        return sessions;
    }

    @Override
    public RawRecordSequence readMessages(String projectId, String sessionId) {
        Path db = stateDb(projectId, sessionId);
        try (Connection connection = openReadOnly(db)) {
            if (readValue(connection, sessionId) == null) {
                throw new SessionNotFoundException(source, projectId, sessionId);
            }
        } catch (SQLException e) {
            log.warn("Failed to open {}: {}", db, e.getMessage());
            throw new SessionNotFoundException(source, projectId, sessionId);
        }
        return () -> {
            try (Connection connection = openReadOnly(db)) {
                return sequenceOf(extractor.extract(readValue(connection, sessionId))).open();
            } catch (SQLException e) {
                throw new IOException("Failed to read " + sessionId + " from " + db, e);
            }
        };
    }

    @Override
    public List<Path> projectListingPaths() {
        List<Path> paths = new ArrayList<>();
        paths.add(rootPath);
        if (isAvailable()) {
            for (Path dir : listDirectories(rootPath)) {
                paths.add(dir.resolve(WORKSPACE_FILE));
                paths.add(dir.resolve(STATE_DB));
            }
        }
        return paths;
    }

    @Override
    public List<Path> sessionListingPaths(String projectId) {
        Path db = projectDir(projectId).resolve(STATE_DB);
        return List.of(db, walOf(db));
    }

    @Override
    public List<Path> sessionPaths(String projectId, String sessionId) {
        Path db = stateDb(projectId, sessionId);
        return List.of(db, walOf(db));
    }

    @Override
    public RecordDialect dialect() {
        return dialect;
    }

    /**
     * Known keys first; else, if enabled, the best scoring key whose name looks like
     * chat storage; else the first of the largest values that holds item-like objects.
     */
    String resolveStateKey(Connection connection) throws SQLException {
        for (String key : knownKeys()) {
            if (readValue(connection, key) != null) {
                return key;
            }
        }
        if (!discoverKeys()) {
            return null;
        }

        Set<String> candidates = new LinkedHashSet<>();
        try (PreparedStatement ps = connection.prepareStatement("SELECT key FROM ItemTable WHERE key LIKE ? LIMIT 100")) {
            for (String pattern : KEY_PATTERNS) {
                ps.setString(1, pattern);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(rs.getString(1));
                    }
                }
            }
        }
        candidates.removeIf(AbstractStateDbSourceAdapter::isBlacklisted);

        String bestKey = null;
        int bestScore = -1;
        for (String key : candidates) {
            int score = extractor.score(readValue(connection, key));
            if (score > bestScore) {
                bestScore = score;
                bestKey = key;
            }
        }
        if (bestKey != null) {
            return bestKey;
        }

        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT key, value FROM ItemTable ORDER BY LENGTH(value) DESC LIMIT " + LARGEST_VALUES_FALLBACK);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String key = rs.getString(1);
                if (!isBlacklisted(key) && extractor.looksLikeItems(rs.getString(2))) {
                    return key;
                }
            }
        }
        return null;
    }

    /**
     * Workspace folder from {@code workspace.json}, last three segments; the directory name otherwise.
     */
    String displayName(Path workspaceDir) {
        String fallback = workspaceDir.getFileName().toString();
        Path workspaceFile = workspaceDir.resolve(WORKSPACE_FILE);
        if (!Files.isRegularFile(workspaceFile)) {
            return fallback;
        }
        try {
            String folder = workspacePath(objectMapper.readTree(workspaceFile.toFile()));
            if (folder == null) {
                return fallback;
            }
            String path = folder;
            if (folder.startsWith("file:")) {
                try {
                    path = URI.create(folder).getPath();
                } catch (IllegalArgumentException e) {
                    path = folder.substring("file://".length());
                }
            }
            String name = lastSegments(path, 3);
            return name.isEmpty() ? fallback : name;
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", workspaceFile, e.getMessage());
            return fallback;
        }
    }

    private static String workspacePath(JsonNode data) {
        if (data == null) {
            return null;
        }
        if (data.isTextual()) {
            return data.asText();
        }
        JsonNode candidate = JsonValues.firstPresent(data, "folder", "path", "workspace", "workspacePath", "name");
        if (candidate.isObject()) {
            return JsonValues.firstText(candidate, "path", "folder");
        }
        if (candidate.isTextual()) {
            return candidate.asText();
        }
        JsonNode first = data.path("folders").path(0);
        if (first.isTextual()) {
            return first.asText();
        }
        if (first.isObject()) {
            return JsonValues.firstText(first, "path", "folder", "name");
        }
        return null;
    }

    private Path stateDb(String projectId, String sessionId) {
        Path db = projectDir(projectId).resolve(STATE_DB);
        if (sessionId == null || sessionId.isEmpty() || !Files.isRegularFile(db)) {
            throw new SessionNotFoundException(source, projectId, sessionId);
        }
        return db;
    }

    private static RawRecordSequence sequenceOf(List<ObjectNode> items) {
        return () -> IntStream.range(0, items.size()).mapToObj(i -> new RawRecord(i, items.get(i)));
    }

    private static boolean isBlacklisted(String key) {
        return KEY_BLACKLIST.stream().anyMatch(key::startsWith);
    }

    private static Path walOf(Path db) {
        return db.resolveSibling(db.getFileName() + "-wal");
    }

    private static String readValue(Connection connection, String key) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement("SELECT value FROM ItemTable WHERE key = ?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    static Connection openReadOnly(Path db) throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        return DriverManager.getConnection("jdbc:sqlite:" + db.toAbsolutePath(), config.toProperties());
    }
}
