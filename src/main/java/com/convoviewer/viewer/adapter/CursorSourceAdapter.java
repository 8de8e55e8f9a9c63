package com.convoviewer.viewer.adapter;

import com.convoviewer.viewer.model.Source;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.List;

/**
 * Cursor keeps its prompt history under {@code aiService.prompts}.
 */
public class CursorSourceAdapter extends AbstractStateDbSourceAdapter {

    static final String PROMPTS_KEY = "aiService.prompts";

    public CursorSourceAdapter(Path rootPath, boolean enabled, ObjectMapper objectMapper) {
        super(Source.CURSOR, rootPath, enabled, objectMapper);
    }

    @Override
    protected List<String> knownKeys() {
        return List.of(PROMPTS_KEY);
    }

    @Override
    protected boolean discoverKeys() {
        return false;
    }
}
