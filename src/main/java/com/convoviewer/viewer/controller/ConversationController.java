package com.convoviewer.viewer.controller;

import com.convoviewer.viewer.model.ConversationPage;
import com.convoviewer.viewer.model.GlobalSearchResult;
import com.convoviewer.viewer.model.Project;
import com.convoviewer.viewer.model.Session;
import com.convoviewer.viewer.model.SessionSearchPage;
import com.convoviewer.viewer.model.SessionSummary;
import com.convoviewer.viewer.search.SearchAggregator;
import com.convoviewer.viewer.service.ConversationService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API Controller for browsing and searching conversations.
 *
 * Endpoints:
 * - GET /api/projects - Projects of a source
 * - GET /api/projects/{projectId}/sessions - Sessions of a project
 * - GET /api/conversation/{projectId}/{sessionId} - Paginated messages
 * - GET /api/conversation/{projectId}/{sessionId}/search - In-session search
 * - GET /api/conversation/{projectId}/{sessionId}/summary - Session summary
 * - GET /api/search/global - Search across all sources
 *
 * Every endpoint takes {@code source} (claude, qwen, cursor, trae, kiro), default claude.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class ConversationController {

    private static final String DEFAULT_SOURCE = "claude";

    private final ConversationService conversationService;
    private final SearchAggregator searchAggregator;

    public ConversationController(ConversationService conversationService, SearchAggregator searchAggregator) {
        this.conversationService = conversationService;
        this.searchAggregator = searchAggregator;
    }

    /**
     * List projects, newest first.
     *
     * GET /api/projects?source=claude
     */
    @GetMapping("/projects")
    public ResponseEntity<List<Project>> listProjects(
            @RequestParam(defaultValue = DEFAULT_SOURCE) String source) {
        return ResponseEntity.ok(conversationService.listProjects(RequestParams.source(source)));
    }

    /**
     * List sessions of a project, newest first.
     *
     * GET /api/projects/{projectId}/sessions?source=claude
     */
    @GetMapping("/projects/{projectId}/sessions")
    public ResponseEntity<List<Session>> listSessions(
            @PathVariable String projectId,
            @RequestParam(defaultValue = DEFAULT_SOURCE) String source) {
        return ResponseEntity.ok(conversationService.listSessions(RequestParams.source(source), projectId));
    }

    /**
     * One page of a conversation.
     *
     * Example Request:
     * GET /api/conversation/-Users-me-api/3f2a.../?page=2&perPage=50&search=error&role=assistant
     *
     * @param page - 1-based page
     * @param perPage - Messages per page
     * @param search - Only messages containing this text
     * @param role - Only messages with this role
     * @return ConversationPage with messages and paging totals
     */
    @GetMapping("/conversation/{projectId}/{sessionId}")
    public ResponseEntity<ConversationPage> getConversation(
            @PathVariable String projectId,
            @PathVariable String sessionId,
            @RequestParam(defaultValue = DEFAULT_SOURCE) String source,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "50") @Min(1) @Max(1000) int perPage,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String role) {
        return ResponseEntity.ok(conversationService.getConversation(
                RequestParams.source(source), projectId, sessionId, page, perPage, search, RequestParams.role(role)));
    }

    /**
     * Search inside one session.
     *
     * GET /api/conversation/{projectId}/{sessionId}/search?q=NullPointer&offset=0&limit=20
     */
    @GetMapping("/conversation/{projectId}/{sessionId}/search")
    public ResponseEntity<SessionSearchPage> searchSession(
            @PathVariable String projectId,
            @PathVariable String sessionId,
            @RequestParam(defaultValue = DEFAULT_SOURCE) String source,
            @RequestParam("q") String query,
            @RequestParam(defaultValue = "0") @Min(0) int offset,
            @RequestParam(defaultValue = "20") @Min(1) @Max(500) int limit) {
        log.debug("Session search in {}/{}/{}: '{}'", source, projectId, sessionId, query);
        return ResponseEntity.ok(conversationService.searchSession(
                RequestParams.source(source), projectId, sessionId, query, offset, limit));
    }

    @GetMapping("/conversation/{projectId}/{sessionId}/summary")
    public ResponseEntity<SessionSummary> getSessionSummary(
            @PathVariable String projectId,
            @PathVariable String sessionId,
            @RequestParam(defaultValue = DEFAULT_SOURCE) String source) {
        return ResponseEntity.ok(conversationService.getSessionSummary(RequestParams.source(source), projectId, sessionId));
    }

    /**
     * Search all sessions of the given sources, or of every enabled source.
     *
     * GET /api/search/global?q=docker&limit=50&sources=claude,qwen
     */
    @GetMapping("/search/global")
    public ResponseEntity<GlobalSearchResult> searchGlobal(
            @RequestParam("q") String query,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit,
            @RequestParam(required = false) List<String> sources) {
        log.info("Global search: '{}' (limit {}, sources {})", query, limit, sources);
        return ResponseEntity.ok(searchAggregator.searchGlobal(query, limit, RequestParams.sources(sources)));
    }
}
