package com.convoviewer.viewer.service;

import com.convoviewer.viewer.adapter.ClaudeSourceAdapter;
import com.convoviewer.viewer.adapter.CursorSourceAdapter;
import com.convoviewer.viewer.adapter.QwenSourceAdapter;
import com.convoviewer.viewer.adapter.SourceAdapterRegistry;
import com.convoviewer.viewer.cache.CacheTier;
import com.convoviewer.viewer.cache.FileFingerprintService;
import com.convoviewer.viewer.cache.TieredCacheManager;
import com.convoviewer.viewer.diff.DiffEngine;
import com.convoviewer.viewer.exception.SessionNotFoundException;
import com.convoviewer.viewer.exception.SourceUnavailableException;
import com.convoviewer.viewer.model.ConversationPage;
import com.convoviewer.viewer.model.HealthReport;
import com.convoviewer.viewer.model.IndexedMessage;
import com.convoviewer.viewer.model.Message;
import com.convoviewer.viewer.model.Role;
import com.convoviewer.viewer.model.SessionSearchPage;
import com.convoviewer.viewer.model.SessionSummary;
import com.convoviewer.viewer.model.Source;
import com.convoviewer.viewer.model.SourceHealth;
import com.convoviewer.viewer.normalizer.MessageNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConversationServiceTest {

    private static final String PROJECT = "-Users-me-work-acme-api";

    @TempDir
    Path tempDir;

    private Path claudeRoot;
    private TieredCacheManager cache;
    private ConversationService conversationService;

    @BeforeEach
    void setUp() throws IOException {
        ObjectMapper objectMapper = new ObjectMapper();
        claudeRoot = Files.createDirectory(tempDir.resolve("claude"));
        SourceAdapterRegistry registry = new SourceAdapterRegistry(List.of(
                new ClaudeSourceAdapter(claudeRoot, true, objectMapper),
                new QwenSourceAdapter(tempDir.resolve("qwen-missing"), true, objectMapper),
                new CursorSourceAdapter(tempDir.resolve("cursor"), false, objectMapper)));
        MessageNormalizer normalizer = new MessageNormalizer(registry, new DiffEngine(4000, 2000), objectMapper,
                Set.of("Edit"), 5000);
        cache = new TieredCacheManager(100, 100, 100, Duration.ofSeconds(30), new FileFingerprintService(), Clock.systemUTC());
        conversationService = new ConversationService(registry, normalizer, cache);

        Path project = Files.createDirectory(claudeRoot.resolve(PROJECT));
        StringBuilder log = new StringBuilder();
        for (int i = 0; i < 50; i++) {
            String type = i % 2 == 0 ? "user" : "assistant";
            log.append("{\"type\":\"").append(type).append("\",\"message\":{\"content\":\"message ")
                    .append(i).append("\"}}\n");
        }
        Files.writeString(project.resolve("long.jsonl"), log.toString());
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    void testPagination() {
        ConversationPage page = conversationService.getConversation(Source.CLAUDE, PROJECT, "long", 3, 20, null, null);

        assertEquals(50, page.getTotal());
        assertEquals(3, page.getTotalPages());
        assertEquals(3, page.getPage());
        assertEquals(10, page.getMessages().size());
        assertEquals(40, page.getMessages().get(0).getLineIndex());
    }

    @Test
    void testPagePastTheEndIsClamped() {
        ConversationPage page = conversationService.getConversation(Source.CLAUDE, PROJECT, "long", 9, 20, null, null);

        assertEquals(3, page.getPage());
        assertEquals(10, page.getMessages().size());
    }

    @Test
    void testRoleAndSearchFilters() {
        ConversationPage users = conversationService.getConversation(Source.CLAUDE, PROJECT, "long", 1, 100, null, Role.USER);
        assertEquals(25, users.getTotal());
        assertTrue(users.getMessages().stream().allMatch(m -> m.getRole() == Role.USER));

        ConversationPage searched = conversationService.getConversation(Source.CLAUDE, PROJECT, "long", 1, 100, "MESSAGE 1", null);
        assertEquals(11, searched.getTotal());
        assertEquals("MESSAGE 1", searched.getSearch());
    }

    @Test
    void testEmptyFilterResultIsOnePage() {
        ConversationPage page = conversationService.getConversation(Source.CLAUDE, PROJECT, "long", 1, 20, "no such text", null);

        assertEquals(0, page.getTotal());
        assertEquals(1, page.getTotalPages());
        assertTrue(page.getMessages().isEmpty());
    }

    @Test
    void testInvalidPagingIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> conversationService.getConversation(Source.CLAUDE, PROJECT, "long", 0, 20, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> conversationService.getConversation(Source.CLAUDE, PROJECT, "long", 1, 0, null, null));
    }

    @Test
    void testSearchSessionWindow() {
        SessionSearchPage result = conversationService.searchSession(Source.CLAUDE, PROJECT, "long", "message 4", 5, 3);

        assertEquals(11, result.getTotal());
        assertEquals(11, result.getTotalOccurrences());
        assertEquals(3, result.getMatches().size());
        assertEquals(44, result.getMatches().get(0).getLineIndex());
        assertEquals(0, result.getMatches().get(0).getSpans().get(0).getStart());
        assertEquals(9, result.getMatches().get(0).getSpans().get(0).getEnd());
    }

    @Test
    void testSearchSessionRejectsBlankQuery() {
        assertThrows(IllegalArgumentException.class,
                () -> conversationService.searchSession(Source.CLAUDE, PROJECT, "long", "  ", 0, 20));
        assertThrows(IllegalArgumentException.class,
                () -> conversationService.searchSession(Source.CLAUDE, PROJECT, "long", "x", -1, 20));
    }

    @Test
    void testMessagesAreCachedUntilTheFileChanges() throws IOException {
        List<Message> first = conversationService.getMessages(Source.CLAUDE, PROJECT, "long");
        List<Message> second = conversationService.getMessages(Source.CLAUDE, PROJECT, "long");
        assertSame(first, second);

        Path file = claudeRoot.resolve(PROJECT).resolve("long.jsonl");
        Files.writeString(file, "{\"type\":\"user\",\"message\":{\"content\":\"one more\"}}\n", StandardOpenOption.APPEND);
        Files.setLastModifiedTime(file, FileTime.fromMillis(Files.getLastModifiedTime(file).toMillis() + 10_000));

        List<Message> third = conversationService.getMessages(Source.CLAUDE, PROJECT, "long");
        assertNotSame(first, third);
        assertEquals(51, third.size());
    }

    @Test
    void testSearchTextIsKeptOutOfTheHotTier() throws IOException {
        List<IndexedMessage> first = conversationService.getSearchText(Source.CLAUDE, PROJECT, "long");
        assertEquals(50, first.size());
        assertEquals(new IndexedMessage(7, Role.ASSISTANT, "message 7"), first.get(7));
        assertSame(first, conversationService.getSearchText(Source.CLAUDE, PROJECT, "long"));
        assertEquals(0, conversationService.cacheStats().getTiers().get(CacheTier.HOT).getEntryCount());
        assertEquals(1, conversationService.cacheStats().getTiers().get(CacheTier.INDEX).getEntryCount());

        Path file = claudeRoot.resolve(PROJECT).resolve("long.jsonl");
        Files.writeString(file, "{\"type\":\"user\",\"message\":{\"content\":\"one more\"}}\n", StandardOpenOption.APPEND);
        Files.setLastModifiedTime(file, FileTime.fromMillis(Files.getLastModifiedTime(file).toMillis() + 10_000));

        assertEquals(51, conversationService.getSearchText(Source.CLAUDE, PROJECT, "long").size());
    }

    @Test
    void testUnknownSessionIsNotFound() {
        assertThrows(SessionNotFoundException.class,
                () -> conversationService.getMessages(Source.CLAUDE, PROJECT, "missing"));
    }

    @Test
    void testMissingSourceRootIsUnavailable() {
        assertThrows(SourceUnavailableException.class, () -> conversationService.listProjects(Source.QWEN));
        assertThrows(SourceUnavailableException.class, () -> conversationService.listProjects(Source.KIRO));
    }

    @Test
    void testSessionSummary() throws IOException {
        Files.writeString(claudeRoot.resolve(PROJECT).resolve("edit.jsonl"),
                "{\"type\":\"summary\",\"summary\":\"Bump the version\"}\n"
                        + "{\"type\":\"user\",\"timestamp\":\"2024-05-01T10:00:00Z\",\"message\":{\"content\":\"Bump it\"}}\n"
                        + "{\"type\":\"assistant\",\"timestamp\":\"2024-05-01T10:01:00Z\",\"message\":{\"content\":["
                        + "{\"type\":\"tool_use\",\"id\":\"e1\",\"name\":\"Edit\",\"input\":{\"file_path\":\"pom.xml\","
                        + "\"old_string\":\"1.0\",\"new_string\":\"1.1\"}}]}}\n"
                        + "{\"type\":\"file-history-snapshot\"}\n");

        SessionSummary summary = conversationService.getSessionSummary(Source.CLAUDE, PROJECT, "edit");

        assertEquals("Bump the version", summary.getTitle());
        assertEquals("Bump the version", summary.getSummary());
        assertEquals(4, summary.getMessageCount());
        assertEquals(1, summary.getToolCallCount());
        assertEquals(1, summary.getEditCount());
        assertEquals(1, summary.getPlaceholderCount());
        assertEquals(1, summary.getRoleCounts().get(Role.USER));
        assertNotNull(summary.getFirstTimestamp());
        assertTrue(summary.getLastTimestamp().isAfter(summary.getFirstTimestamp()));
    }

    @Test
    void testHealthReportsEachSourceIndependently() throws IOException {
        Path other = Files.createDirectory(claudeRoot.resolve("-Users-me-work-acme-web"));
        Files.writeString(other.resolve("a.jsonl"), "{}\n");
        Files.writeString(other.resolve("b.jsonl"), "{}\n");

        HealthReport report = conversationService.health();

        assertEquals(ConversationService.STATUS_DEGRADED, report.getStatus());
        assertEquals(3, report.getSources().size());

        SourceHealth claude = find(report, Source.CLAUDE);
        assertTrue(claude.getAvailable());
        assertEquals(2, claude.getProjectCount());
        assertEquals(3, claude.getSessionCount());

        SourceHealth qwen = find(report, Source.QWEN);
        assertFalse(qwen.getAvailable());
        assertEquals(0, qwen.getSessionCount());
        assertNotNull(qwen.getError());

        SourceHealth cursor = find(report, Source.CURSOR);
        assertFalse(cursor.getEnabled());
        assertEquals("disabled", cursor.getError());

        assertEquals(3, report.getTotalSessions());
    }

    @Test
    void testClearCache() {
        conversationService.getMessages(Source.CLAUDE, PROJECT, "long");
        assertTrue(conversationService.cacheStats().getEntryCount() > 0);

        conversationService.clearCache(CacheTier.HOT);
        assertEquals(0, conversationService.cacheStats().getTiers().get(CacheTier.HOT).getEntryCount());

        conversationService.health();
        conversationService.clearCache(null);
        assertEquals(0, conversationService.cacheStats().getEntryCount());
    }

    private static SourceHealth find(HealthReport report, Source source) {
        return report.getSources().stream()
                .filter(h -> h.getSource() == source)
                .findFirst()
                .orElseThrow();
    }
}
