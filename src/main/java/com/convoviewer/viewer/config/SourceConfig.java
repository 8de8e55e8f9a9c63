package com.convoviewer.viewer.config;

import com.convoviewer.viewer.adapter.ClaudeSourceAdapter;
import com.convoviewer.viewer.adapter.CursorSourceAdapter;
import com.convoviewer.viewer.adapter.KiroSourceAdapter;
import com.convoviewer.viewer.adapter.PlatformPaths;
import com.convoviewer.viewer.adapter.QwenSourceAdapter;
import com.convoviewer.viewer.adapter.SourceAdapterRegistry;
import com.convoviewer.viewer.adapter.TraeSourceAdapter;
import com.convoviewer.viewer.diff.DiffEngine;
import com.convoviewer.viewer.normalizer.MessageNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Source adapters, the normalizer and the diff engine.
 *
 * Each source root comes from {@code app.sources.<id>.path}, which application.properties
 * binds to the source's environment variable; an empty value means the platform default.
 */
@Slf4j
@Configuration
public class SourceConfig {

    @Value("${app.sources.claude.path:}")
    private String claudePath;

    @Value("${app.sources.claude.enabled:true}")
    private boolean claudeEnabled;

    @Value("${app.sources.qwen.path:}")
    private String qwenPath;

    @Value("${app.sources.qwen.enabled:true}")
    private boolean qwenEnabled;

    @Value("${app.sources.cursor.path:}")
    private String cursorPath;

    @Value("${app.sources.cursor.enabled:true}")
    private boolean cursorEnabled;

    @Value("${app.sources.trae.path:}")
    private String traePath;

    @Value("${app.sources.trae.enabled:true}")
    private boolean traeEnabled;

    @Value("${app.sources.kiro.path:}")
    private String kiroPath;

    @Value("${app.sources.kiro.sessions-path:}")
    private String kiroSessionsPath;

    @Value("${app.sources.kiro.enabled:true}")
    private boolean kiroEnabled;

    @Bean
    public SourceAdapterRegistry sourceAdapterRegistry(ObjectMapper objectMapper) {
        return new SourceAdapterRegistry(List.of(
                new ClaudeSourceAdapter(
                        PlatformPaths.resolve(claudePath, PlatformPaths.claudeProjects()), claudeEnabled, objectMapper),
                new QwenSourceAdapter(
                        PlatformPaths.resolve(qwenPath, PlatformPaths.qwenTmp()), qwenEnabled, objectMapper),
                new CursorSourceAdapter(
                        PlatformPaths.resolve(cursorPath, PlatformPaths.workspaceStorage("Cursor")), cursorEnabled, objectMapper),
                new TraeSourceAdapter(
                        PlatformPaths.resolve(traePath, PlatformPaths.workspaceStorage("Trae")), traeEnabled, objectMapper),
                new KiroSourceAdapter(
                        PlatformPaths.resolve(kiroPath, PlatformPaths.workspaceStorage("Kiro")),
                        StringUtils.hasText(kiroSessionsPath) ? PlatformPaths.resolve(kiroSessionsPath, null) : null,
                        kiroEnabled,
                        objectMapper)));
    }

    @Bean
    public DiffEngine diffEngine(@Value("${app.diff.max-lines:4000}") int maxLines,
                                 @Value("${app.diff.max-output-lines:2000}") int maxOutputLines) {
        return new DiffEngine(maxLines, maxOutputLines);
    }

    @Bean
    public MessageNormalizer messageNormalizer(SourceAdapterRegistry registry,
                                               DiffEngine diffEngine,
                                               ObjectMapper objectMapper,
                                               @Value("${app.normalizer.edit-tools}") String[] editTools,
                                               @Value("${app.normalizer.tool-output-max-chars:5000}") int toolOutputMaxChars) {
        Set<String> tools = Arrays.stream(editTools)
                .map(String::trim)
                .filter(StringUtils::hasText)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        log.info("Edit tools: {}", tools);
        return new MessageNormalizer(registry, diffEngine, objectMapper, tools, toolOutputMaxChars);
    }
}
