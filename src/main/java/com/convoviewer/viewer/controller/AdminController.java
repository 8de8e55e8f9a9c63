package com.convoviewer.viewer.controller;

import com.convoviewer.viewer.cache.CacheStats;
import com.convoviewer.viewer.cache.CacheTier;
import com.convoviewer.viewer.model.HealthReport;
import com.convoviewer.viewer.service.ConversationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Diagnostics and cache control.
 *
 * Endpoints:
 * - GET /api/health - Per-source availability and counts
 * - GET /api/cache/stats - Cache hit/miss/entry counts
 * - POST /api/cache/clear?tier=hot|warm|index|all - Drop cached entries
 */
@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class AdminController {

    private final ConversationService conversationService;

    public AdminController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        return ResponseEntity.ok(conversationService.health());
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStats> cacheStats() {
        return ResponseEntity.ok(conversationService.cacheStats());
    }

    /**
     * Clear one cache tier, or all of them.
     *
     * POST /api/cache/clear?tier=warm
     *
     * @param tier - "hot", "warm", "index" or "all"; all when omitted
     * @return Which tiers were cleared
     */
    @PostMapping("/cache/clear")
    public ResponseEntity<Map<String, String>> clearCache(@RequestParam(required = false) String tier) {
        CacheTier parsed = RequestParams.tier(tier);
        log.info("Clearing cache tier: {}", parsed == null ? "all" : parsed);
        conversationService.clearCache(parsed);
        return ResponseEntity.ok(Map.of("cleared", parsed == null ? "all" : parsed.name().toLowerCase()));
    }
}
