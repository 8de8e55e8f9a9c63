package com.convoviewer.viewer.adapter;

import com.convoviewer.viewer.exception.SessionNotFoundException;
import com.convoviewer.viewer.exception.SourceUnavailableException;
import com.convoviewer.viewer.model.RawRecord;
import com.convoviewer.viewer.model.Source;
import com.convoviewer.viewer.normalizer.dialect.JsonValues;
import com.convoviewer.viewer.normalizer.dialect.RecordDialect;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Shared plumbing for source adapters: root checks, safe id resolution, directory
 * listing, file times and session title extraction.
 */
@Slf4j
public abstract class AbstractSourceAdapter implements SourceAdapter {

    public static final String UNTITLED = "Untitled Session";
    public static final int MAX_TITLE_LENGTH = 100;

    protected final Source source;
    protected final Path rootPath;
    protected final boolean enabled;
    protected final ObjectMapper objectMapper;

    protected AbstractSourceAdapter(Source source, Path rootPath, boolean enabled, ObjectMapper objectMapper) {
        this.source = source;
        this.rootPath = rootPath;
        this.enabled = enabled;
        this.objectMapper = objectMapper;
    }

    @Override
    public Source source() {
        return source;
    }

    @Override
    public Path rootPath() {
        return rootPath;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public boolean isAvailable() {
        return Files.isDirectory(rootPath) && Files.isReadable(rootPath);
    }

    protected void requireAvailable() {
        if (!Files.exists(rootPath)) {
            throw new SourceUnavailableException(source, rootPath.toString(), "root directory does not exist");
        }
        if (!Files.isDirectory(rootPath)) {
            throw new SourceUnavailableException(source, rootPath.toString(), "root path is not a directory");
        }
        if (!Files.isReadable(rootPath)) {
            throw new SourceUnavailableException(source, rootPath.toString(), "root directory is not readable");
        }
    }

    /**
     * Resolve a project directory directly under the root. Ids that would escape
     * the root are treated as unknown.
     */
    protected Path projectDir(String projectId) {
        requireAvailable();
        if (!isPlainName(projectId)) {
            throw new SessionNotFoundException(source, projectId, null);
        }
        Path dir = rootPath.resolve(projectId);
        if (!Files.isDirectory(dir)) {
            throw new SessionNotFoundException(source, projectId, null);
        }
        return dir;
    }

    protected static boolean isPlainName(String name) {
        return name != null
                && !name.isEmpty()
                && !name.equals(".")
                && !name.equals("..")
                && name.indexOf('/') < 0
                && name.indexOf('\\') < 0
                && name.indexOf('\0') < 0;
    }

    /**
     * Direct sub-directories of {@code dir}, sorted by name.
     */
    protected static List<Path> listDirectories(Path dir) {
        return listChildren(dir, Files::isDirectory);
    }

    /**
     * Regular files directly under {@code dir} with the given suffix, sorted by name.
     * A missing directory has no files.
     */
    protected static List<Path> listFiles(Path dir, String suffix) {
        return listChildren(dir, p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(suffix));
    }

    private static List<Path> listChildren(Path dir, Predicate<Path> filter) {
        if (!Files.isDirectory(dir)) {
            return new ArrayList<>();
        }
        try (Stream<Path> children = Files.list(dir)) {
            return children.filter(filter)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }

    protected static Instant modifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            return null;
        }
    }

    protected static Instant creationTime(Path path) {
        try {
            return Files.readAttributes(path, BasicFileAttributes.class).creationTime().toInstant();
        } catch (IOException e) {
            return null;
        }
    }

    protected static long size(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            return 0L;
        }
    }

    /**
     * Keep the last {@code count} segments of a path, e.g. "work/acme/api" for "/home/me/work/acme/api".
     */
    protected static String lastSegments(String path, int count) {
        List<String> parts = Arrays.stream(path.split("[/\\\\]"))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        if (parts.isEmpty()) {
            return path;
        }
        return String.join("/", parts.subList(Math.max(0, parts.size() - count), parts.size()));
    }

    protected static String truncateTitle(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > MAX_TITLE_LENGTH ? trimmed.substring(0, MAX_TITLE_LENGTH) : trimmed;
    }

    protected static int compareNewestFirst(Instant a, Instant b) {
        if (a == null && b == null) {
            return 0;
        }
        if (a == null) {
            return 1;
        }
        if (b == null) {
            return -1;
        }
        return b.compareTo(a);
    }

    /**
     * Read a session once to count its records and derive its title: the first summary
     * record, else the first user message, else {@link #UNTITLED}.
     */
    protected SessionScan scan(RawRecordSequence records) throws IOException {
        SessionScan scan = new SessionScan();
        RecordDialect dialect = dialect();
        try (Stream<RawRecord> stream = records.open()) {
            stream.forEach(record -> {
                scan.recordCount++;
                JsonNode payload = record.getPayload();
                if (payload == null || !payload.isObject()) {
                    return;
                }
                Instant ts = dialect.timestamp(payload);
                if (ts != null) {
                    if (scan.firstTimestamp == null) {
                        scan.firstTimestamp = ts;
                    }
                    scan.lastTimestamp = ts;
                }
                String token = dialect.roleToken(payload);
                if (scan.summary == null && "summary".equals(token)) {
                    scan.summary = truncateTitle(JsonValues.plainText(dialect.content(payload)));
                } else if (scan.firstUserMessage == null && "user".equals(token)) {
                    scan.firstUserMessage = truncateTitle(JsonValues.plainText(dialect.content(payload)));
                }
            });
        }
        return scan;
    }

    /**
     * Result of {@link #scan(RawRecordSequence)}.
     */
    protected static final class SessionScan {
        int recordCount;
        String summary;
        String firstUserMessage;
        Instant firstTimestamp;
        Instant lastTimestamp;

        public int getRecordCount() {
            return recordCount;
        }

        public String title() {
            if (summary != null) {
                return summary;
            }
            return firstUserMessage != null ? firstUserMessage : UNTITLED;
        }

        public Instant getFirstTimestamp() {
            return firstTimestamp;
        }

        public Instant getLastTimestamp() {
            return lastTimestamp;
        }
    }
}
