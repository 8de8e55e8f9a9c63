package com.convoviewer.viewer.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported AI assistant platforms whose logs are ingested.
 */
public enum Source {

    CLAUDE("claude", "Claude Code", "CLAUDE_PROJECTS_PATH"),
    QWEN("qwen", "Qwen Code", "QWEN_PROJECTS_PATH"),
    CURSOR("cursor", "Cursor", "CURSOR_WORKSPACE_STORAGE_PATH"),
    TRAE("trae", "Trae", "TRAE_WORKSPACE_STORAGE_PATH"),
    KIRO("kiro", "Kiro", "KIRO_WORKSPACE_STORAGE_PATH");

    private final String id;
    private final String displayName;
    private final String pathEnvVariable;

    Source(String id, String displayName, String pathEnvVariable) {
        this.id = id;
        this.displayName = displayName;
        this.pathEnvVariable = pathEnvVariable;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Environment variable conventionally used to override the root path.
     */
    public String pathEnvVariable() {
        return pathEnvVariable;
    }

    public static Optional<Source> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.id.equals(normalized))
                .findFirst();
    }
}
