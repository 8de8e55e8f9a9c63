package com.convoviewer.viewer.search;

import com.convoviewer.viewer.adapter.SourceAdapter;
import com.convoviewer.viewer.adapter.SourceAdapterRegistry;
import com.convoviewer.viewer.cache.CacheKeys;
import com.convoviewer.viewer.cache.CacheTier;
import com.convoviewer.viewer.cache.TieredCacheManager;
import com.convoviewer.viewer.exception.SourceUnavailableException;
import com.convoviewer.viewer.model.GlobalSearchResult;
import com.convoviewer.viewer.model.IndexedMessage;
import com.convoviewer.viewer.model.MatchSpan;
import com.convoviewer.viewer.model.MessagePreview;
import com.convoviewer.viewer.model.Project;
import com.convoviewer.viewer.model.SearchHit;
import com.convoviewer.viewer.model.Session;
import com.convoviewer.viewer.model.Source;
import com.convoviewer.viewer.service.ConversationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Searches every enabled source in parallel and merges the hits into one ranking.
 *
 * Each source has the same deadline, counted from the start of the request; a source
 * that misses it is cancelled and reported as unavailable. Cancellation is cooperative:
 * a worker may be computing a cache entry other callers are waiting on, so it is asked
 * to stop between sessions and never interrupted. Hits are ranked over all sources
 * before the limit is applied, so the completion order never shows in the result.
 */
@Slf4j
public class SearchAggregator {

    /**
     * Ranking: most occurrences first, then most recently modified, then identity.
     */
    public static final Comparator<SearchHit> RANKING = Comparator
            .comparingInt(SearchHit::getMatchCount).reversed()
            .thenComparing(SearchHit::getModifiedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(hit -> hit.getSource().id())
            .thenComparing(SearchHit::getProjectId)
            .thenComparing(SearchHit::getSessionId);

    private final SourceAdapterRegistry registry;
    private final ConversationService conversationService;
    private final TieredCacheManager cache;
    private final AsyncTaskExecutor executor;
    private final long sourceTimeoutMs;
    private final int previewCount;

    public SearchAggregator(SourceAdapterRegistry registry,
                            ConversationService conversationService,
                            TieredCacheManager cache,
                            AsyncTaskExecutor executor,
                            long sourceTimeoutMs,
                            int previewCount) {
        this.registry = registry;
        this.conversationService = conversationService;
        this.cache = cache;
        this.executor = executor;
        this.sourceTimeoutMs = sourceTimeoutMs;
        this.previewCount = previewCount;
    }

    /**
     * Search all sessions of the given sources.
     *
     * @param query - Case-insensitive search term
     * @param limit - Maximum number of hits returned
     * @param sources - Sources to search; null or empty means every enabled source
     * @return Ranked hits and the sources that could not be searched
     */
    public GlobalSearchResult searchGlobal(String query, int limit, Collection<Source> sources) {
        if (!StringUtils.hasText(query)) {
            throw new IllegalArgumentException("Search query must not be blank");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        long started = System.currentTimeMillis();
        Map<Source, String> unavailable = new EnumMap<>(Source.class);

        // Step 1: Pick the adapters to search
        List<SourceAdapter> targets = new ArrayList<>();
        if (sources == null || sources.isEmpty()) {
            targets.addAll(registry.enabled());
        } else {
            for (Source source : sources) {
                try {
                    SourceAdapter adapter = registry.get(source);
                    if (adapter.isEnabled()) {
                        targets.add(adapter);
                    } else {
                        unavailable.put(source, "disabled");
                    }
                } catch (SourceUnavailableException e) {
                    unavailable.put(source, e.getMessage());
                }
            }
        }

        // Step 2: Fan out, one task per source
        Map<Source, Future<List<SearchHit>>> running = new LinkedHashMap<>();
        Map<Source, AtomicBoolean> cancelled = new EnumMap<>(Source.class);
        for (SourceAdapter adapter : targets) {
            AtomicBoolean stop = new AtomicBoolean();
            try {
                running.put(adapter.source(), executor.submit(() -> searchSource(adapter, query, stop)));
                cancelled.put(adapter.source(), stop);
            } catch (TaskRejectedException e) {
                log.warn("Search in {} rejected: {}", adapter.source().id(), e.getMessage());
                unavailable.put(adapter.source(), "search executor saturated");
            }
        }

        // Step 3: Collect within the shared deadline
        long deadline = started + sourceTimeoutMs;
        List<SearchHit> candidates = new ArrayList<>();
        for (Map.Entry<Source, Future<List<SearchHit>>> entry : running.entrySet()) {
            Source source = entry.getKey();
            Future<List<SearchHit>> future = entry.getValue();
            try {
                long remaining = Math.max(0, deadline - System.currentTimeMillis());
                candidates.addAll(future.get(remaining, TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                cancelled.get(source).set(true);
                future.cancel(false);
                log.warn("Search in {} timed out after {}ms", source.id(), sourceTimeoutMs);
                unavailable.put(source, "timed out after " + sourceTimeoutMs + "ms");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof SourceUnavailableException) {
                    log.info("Skipping {} in search: {}", source.id(), cause.getMessage());
                } else {
                    log.warn("Search in {} failed", source.id(), cause);
                }
                unavailable.put(source, cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelled.get(source).set(true);
                future.cancel(false);
                unavailable.put(source, "interrupted");
            }
        }

        // Step 4: Rank globally, then truncate
        candidates.sort(RANKING);
        List<SearchHit> hits = new ArrayList<>(candidates.subList(0, Math.min(limit, candidates.size())));

        long elapsed = System.currentTimeMillis() - started;
        log.info("Global search '{}' found {} sessions in {}ms ({} sources unavailable)",
                query, candidates.size(), elapsed, unavailable.size());

        return GlobalSearchResult.builder()
                .query(query)
                .limit(limit)
                .totalCandidates(candidates.size())
                .hits(hits)
                .unavailableSources(unavailable)
                .elapsedMs(elapsed)
                .build();
    }

    /**
     * Scan every session of one source. A session whose messages cannot be read is skipped.
     *
     * @param cancelled - Set by the caller once the deadline has passed; checked between sessions
     */
    List<SearchHit> searchSource(SourceAdapter adapter, String query, AtomicBoolean cancelled) {
        Source source = adapter.source();
        List<SearchableSession> sessions = cache.getOrCompute(
                CacheKeys.searchSources(source), CacheTier.WARM, null, () -> searchableSessions(source));

        List<SearchHit> hits = new ArrayList<>();
        for (SearchableSession candidate : sessions) {
            if (cancelled.get() || Thread.currentThread().isInterrupted()) {
                log.debug("Search in {} cancelled", source.id());
                break;
            }
            Session session = candidate.session;
            List<IndexedMessage> messages;
            try {
                messages = conversationService.getSearchText(source, session.getProjectId(), session.getSessionId());
            } catch (RuntimeException e) {
                log.debug("Skipping {}/{}/{} in search: {}", source.id(), session.getProjectId(),
                        session.getSessionId(), e.getMessage());
                continue;
            }
            SearchHit hit = match(candidate, messages, query);
            if (hit != null) {
                hits.add(hit);
            }
        }
        return hits;
    }

    private SearchHit match(SearchableSession candidate, List<IndexedMessage> messages, String query) {
        Session session = candidate.session;
        int occurrences = 0;
        int matchingMessages = 0;
        List<MessagePreview> previews = new ArrayList<>();
        for (IndexedMessage message : messages) {
            List<MatchSpan> spans = TextMatcher.findAll(message.getContent(), query);
            if (spans.isEmpty()) {
                continue;
            }
            occurrences += spans.size();
            matchingMessages++;
            if (previews.size() < previewCount) {
                previews.add(new MessagePreview(message.getLineIndex(), message.getRole(),
                        TextMatcher.snippet(message.getContent(), spans.get(0))));
            }
        }
        if (occurrences == 0) {
            occurrences = TextMatcher.count(session.getTitle(), query);
            if (occurrences == 0) {
                return null;
            }
        }
        return SearchHit.builder()
                .source(session.getSource())
                .projectId(session.getProjectId())
                .projectDisplayName(candidate.projectDisplayName)
                .sessionId(session.getSessionId())
                .sessionTitle(session.getTitle())
                .modifiedAt(session.getModifiedAt())
                .matchCount(occurrences)
                .matchingMessages(matchingMessages)
                .previews(previews)
                .build();
    }

    private List<SearchableSession> searchableSessions(Source source) {
        List<SearchableSession> sessions = new ArrayList<>();
        for (Project project : conversationService.listProjects(source)) {
            try {
                for (Session session : conversationService.listSessions(source, project.getProjectId())) {
                    sessions.add(new SearchableSession(project.getDisplayName(), session));
                }
            } catch (RuntimeException e) {
                log.debug("Skipping project {}/{} in search: {}", source.id(), project.getProjectId(), e.getMessage());
            }
        }
        return sessions;
    }

    private static final class SearchableSession {
        private final String projectDisplayName;
        private final Session session;

        SearchableSession(String projectDisplayName, Session session) {
            this.projectDisplayName = projectDisplayName;
            this.session = session;
        }
    }
}
