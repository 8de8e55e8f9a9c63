package com.convoviewer.viewer.adapter;

import com.convoviewer.viewer.model.Source;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.List;

/**
 * Trae's input history key moved between releases, so other chat-like keys are searched
 * when the known one is absent.
 */
public class TraeSourceAdapter extends AbstractStateDbSourceAdapter {

    static final String INPUT_HISTORY_KEY = "icube-ai-agent-storage-input-history";

    public TraeSourceAdapter(Path rootPath, boolean enabled, ObjectMapper objectMapper) {
        super(Source.TRAE, rootPath, enabled, objectMapper);
    }

    @Override
    protected List<String> knownKeys() {
        return List.of(INPUT_HISTORY_KEY);
    }

    @Override
    protected boolean discoverKeys() {
        return true;
    }
}
