package com.convoviewer.viewer.service;

import com.convoviewer.viewer.adapter.AbstractSourceAdapter;
import com.convoviewer.viewer.adapter.RawRecordSequence;
import com.convoviewer.viewer.adapter.SourceAdapter;
import com.convoviewer.viewer.adapter.SourceAdapterRegistry;
import com.convoviewer.viewer.cache.CacheKeys;
import com.convoviewer.viewer.cache.CacheStats;
import com.convoviewer.viewer.cache.CacheTier;
import com.convoviewer.viewer.cache.TieredCacheManager;
import com.convoviewer.viewer.exception.SourceUnavailableException;
import com.convoviewer.viewer.model.ConversationPage;
import com.convoviewer.viewer.model.HealthReport;
import com.convoviewer.viewer.model.IndexedMessage;
import com.convoviewer.viewer.model.MatchSpan;
import com.convoviewer.viewer.model.Message;
import com.convoviewer.viewer.model.Project;
import com.convoviewer.viewer.model.RawRecord;
import com.convoviewer.viewer.model.Role;
import com.convoviewer.viewer.model.Session;
import com.convoviewer.viewer.model.SessionMatch;
import com.convoviewer.viewer.model.SessionRef;
import com.convoviewer.viewer.model.SessionSearchPage;
import com.convoviewer.viewer.model.SessionSummary;
import com.convoviewer.viewer.model.Source;
import com.convoviewer.viewer.model.SourceHealth;
import com.convoviewer.viewer.model.ToolCall;
import com.convoviewer.viewer.normalizer.MessageNormalizer;
import com.convoviewer.viewer.search.TextMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Entry point for browsing: projects, sessions and messages of every source, read
 * through the cache, plus in-session search and health diagnostics.
 */
@Slf4j
@Service
public class ConversationService {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_DEGRADED = "degraded";
    public static final String STATUS_UNAVAILABLE = "unavailable";

    private final SourceAdapterRegistry registry;
    private final MessageNormalizer normalizer;
    private final TieredCacheManager cache;

    public ConversationService(SourceAdapterRegistry registry,
                               MessageNormalizer normalizer,
                               TieredCacheManager cache) {
        this.registry = registry;
        this.normalizer = normalizer;
        this.cache = cache;
    }

    /**
     * List the projects of a source, newest first.
     *
     * @param source - Source to list
     * @return Projects, cached until the source's listing files change
     * @throws SourceUnavailableException if the source root is missing or unreadable
     */
    public List<Project> listProjects(Source source) {
        SourceAdapter adapter = registry.get(source);
        return cache.getOrCompute(
                CacheKeys.projects(source),
                CacheTier.HOT,
                null,
                adapter.projectListingPaths(),
                adapter::listProjects);
    }

    public List<Session> listSessions(Source source, String projectId) {
        SourceAdapter adapter = registry.get(source);
        return cache.getOrCompute(
                CacheKeys.sessions(source, projectId),
                CacheTier.HOT,
                null,
                adapter.sessionListingPaths(projectId),
                () -> adapter.listSessions(projectId));
    }

    /**
     * All messages of a session in log order. Parsed once per change of the session's files.
     */
    public List<Message> getMessages(Source source, String projectId, String sessionId) {
        SourceAdapter adapter = registry.get(source);
        return cache.getOrCompute(
                CacheKeys.messages(source, projectId, sessionId),
                CacheTier.HOT,
                null,
                adapter.sessionPaths(projectId, sessionId),
                () -> parseMessages(adapter, projectId, sessionId));
    }

    /**
     * Searchable text of a session, held in the index tier and re-read only when the
     * session's files change. Never reads or fills the hot tier.
     */
    public List<IndexedMessage> getSearchText(Source source, String projectId, String sessionId) {
        SourceAdapter adapter = registry.get(source);
        return cache.getOrCompute(
                CacheKeys.searchText(source, projectId, sessionId),
                CacheTier.INDEX,
                null,
                adapter.sessionPaths(projectId, sessionId),
                () -> parseMessages(adapter, projectId, sessionId).stream()
                        .map(IndexedMessage::of)
                        .collect(Collectors.toUnmodifiableList()));
    }

    private List<Message> parseMessages(SourceAdapter adapter, String projectId, String sessionId) throws IOException {
        RawRecordSequence records = adapter.readMessages(projectId, sessionId);
        try (Stream<RawRecord> stream = records.open()) {
            List<Message> messages = normalizer.normalizeAll(adapter.source(), stream);
            log.debug("Parsed {} messages from {}/{}/{}", messages.size(), adapter.source().id(), projectId, sessionId);
            return messages;
        }
    }

    /**
     * One page of a session, optionally filtered by role and by a case-insensitive search term.
     *
     * @param page - 1-based page number; pages past the end return the last page
     * @param perPage - Messages per page
     * @param search - Filter term, null or blank for none
     * @param role - Role filter, null for all roles
     */
    public ConversationPage getConversation(Source source,
                                            String projectId,
                                            String sessionId,
                                            int page,
                                            int perPage,
                                            String search,
                                            Role role) {
        if (page < 1 || perPage < 1) {
            throw new IllegalArgumentException("page and perPage must be positive");
        }
        List<Message> filtered = getMessages(source, projectId, sessionId).stream()
                .filter(m -> role == null || m.getRole() == role)
                .filter(m -> !StringUtils.hasText(search) || TextMatcher.contains(m.getContent(), search))
                .collect(Collectors.toList());

        int total = filtered.size();
        int totalPages = Math.max(1, (total + perPage - 1) / perPage);
        int current = Math.min(page, totalPages);
        int from = Math.min((current - 1) * perPage, total);
        int to = Math.min(from + perPage, total);

        return ConversationPage.builder()
                .session(SessionRef.of(source, projectId, sessionId))
                .messages(new ArrayList<>(filtered.subList(from, to)))
                .total(total)
                .page(current)
                .perPage(perPage)
                .totalPages(totalPages)
                .search(StringUtils.hasText(search) ? search : null)
                .role(role)
                .build();
    }

    /**
     * Search one session and return a window of the matching messages.
     *
     * @param offset - Index of the first match to return
     * @param limit - Maximum number of matches to return
     * @return Window of matches with totals over the whole session
     */
    public SessionSearchPage searchSession(Source source,
                                           String projectId,
                                           String sessionId,
                                           String query,
                                           int offset,
                                           int limit) {
        if (!StringUtils.hasText(query)) {
            throw new IllegalArgumentException("Search query must not be blank");
        }
        if (offset < 0 || limit < 1) {
            throw new IllegalArgumentException("offset must be >= 0 and limit >= 1");
        }

        List<SessionMatch> matches = new ArrayList<>();
        int occurrences = 0;
        for (Message message : getMessages(source, projectId, sessionId)) {
            List<MatchSpan> spans = TextMatcher.findAll(message.getContent(), query);
            if (spans.isEmpty()) {
                continue;
            }
            occurrences += spans.size();
            matches.add(SessionMatch.builder()
                    .lineIndex(message.getLineIndex())
                    .role(message.getRole())
                    .timestamp(message.getTimestamp())
                    .occurrences(spans.size())
                    .snippet(TextMatcher.snippet(message.getContent(), spans.get(0)))
                    .spans(spans)
                    .build());
        }

        int from = Math.min(offset, matches.size());
        int to = Math.min(from + limit, matches.size());
        return SessionSearchPage.builder()
                .session(SessionRef.of(source, projectId, sessionId))
                .query(query)
                .total(matches.size())
                .totalOccurrences(occurrences)
                .offset(offset)
                .limit(limit)
                .matches(new ArrayList<>(matches.subList(from, to)))
                .build();
    }

    /**
     * The session's own summary record, if any, and counts by role, tool calls and edits.
     */
    public SessionSummary getSessionSummary(Source source, String projectId, String sessionId) {
        List<Message> messages = getMessages(source, projectId, sessionId);

        String summary = null;
        String firstUser = null;
        Map<Role, Integer> roleCounts = new EnumMap<>(Role.class);
        int toolCalls = 0;
        int edits = 0;
        int placeholders = 0;
        for (Message message : messages) {
            roleCounts.merge(message.getRole(), 1, Integer::sum);
            toolCalls += message.getToolCalls().size();
            edits += (int) message.getToolCalls().stream().filter(ToolCall::isEdit).count();
            if (message.isPlaceholder()) {
                placeholders++;
                continue;
            }
            if (summary == null && message.getRole() == Role.SUMMARY && "summary".equals(message.getRawType())
                    && StringUtils.hasText(message.getContent())) {
                summary = message.getContent().strip();
            }
            if (firstUser == null && message.getRole() == Role.USER && StringUtils.hasText(message.getContent())) {
                firstUser = message.getContent().strip();
            }
        }

        String title = summary != null ? summary : firstUser;
        if (title != null && title.length() > AbstractSourceAdapter.MAX_TITLE_LENGTH) {
            title = title.substring(0, AbstractSourceAdapter.MAX_TITLE_LENGTH);
        }

        return SessionSummary.builder()
                .session(SessionRef.of(source, projectId, sessionId))
                .title(title != null ? title : AbstractSourceAdapter.UNTITLED)
                .summary(summary)
                .messageCount(messages.size())
                .roleCounts(roleCounts)
                .toolCallCount(toolCalls)
                .editCount(edits)
                .placeholderCount(placeholders)
                .firstTimestamp(messages.stream().map(Message::getTimestamp).filter(t -> t != null).findFirst().orElse(null))
                .lastTimestamp(messages.stream().map(Message::getTimestamp).filter(t -> t != null)
                        .reduce((a, b) -> b).orElse(null))
                .build();
    }

    /**
     * Per-source availability and counts. A failing source is reported, never thrown.
     */
    public HealthReport health() {
        return cache.getOrCompute(CacheKeys.HEALTH, CacheTier.WARM, null, this::buildHealth);
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    /**
     * @param tier - Tier to clear, null for all tiers
     */
    public void clearCache(CacheTier tier) {
        if (tier == null) {
            cache.clearAll();
        } else {
            cache.clear(tier);
        }
    }

    private HealthReport buildHealth() {
        List<SourceHealth> sources = new ArrayList<>();
        int totalProjects = 0;
        int totalSessions = 0;
        int enabled = 0;
        int available = 0;

        for (SourceAdapter adapter : registry.all()) {
            SourceHealth.SourceHealthBuilder health = SourceHealth.builder()
                    .source(adapter.source())
                    .enabled(adapter.isEnabled())
                    .rootPath(adapter.rootPath().toString())
                    .projectCount(0)
                    .sessionCount(0);
            if (!adapter.isEnabled()) {
                sources.add(health.available(false).error("disabled").build());
                continue;
            }
            enabled++;
            try {
                List<Project> projects = listProjects(adapter.source());
                int sessions = projects.stream().mapToInt(Project::getSessionCount).sum();
                health.available(true).projectCount(projects.size()).sessionCount(sessions);
                totalProjects += projects.size();
                totalSessions += sessions;
                available++;
            } catch (SourceUnavailableException e) {
                log.info("Source {} unavailable: {}", adapter.source().id(), e.getMessage());
                health.available(false).error(e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Health check failed for {}", adapter.source().id(), e);
                health.available(false).error(e.getMessage());
            }
            sources.add(health.build());
        }

        String status = available == enabled ? STATUS_OK : (available == 0 ? STATUS_UNAVAILABLE : STATUS_DEGRADED);
        return HealthReport.builder()
                .status(status)
                .sources(sources)
                .totalProjects(totalProjects)
                .totalSessions(totalSessions)
                .generatedAt(System.currentTimeMillis())
                .build();
    }
}
