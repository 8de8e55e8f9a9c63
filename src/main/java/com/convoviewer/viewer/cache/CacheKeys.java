package com.convoviewer.viewer.cache;

import com.convoviewer.viewer.model.Source;

/**
 * Cache key derivation. Keys are prefix-structured so a whole source or project
 * can be invalidated with {@link TieredCacheManager#invalidate(String)}.
 */
public final class CacheKeys {

    public static final String HEALTH = "health";

    private CacheKeys() {
    }

    public static String projects(Source source) {
        return "projects:" + source.id();
    }

    public static String sessions(Source source, String projectId) {
        return "sessions:" + source.id() + ":" + projectId;
    }

    public static String messages(Source source, String projectId, String sessionId) {
        return "messages:" + source.id() + ":" + projectId + ":" + sessionId;
    }

    public static String searchText(Source source, String projectId, String sessionId) {
        return "search-text:" + source.id() + ":" + projectId + ":" + sessionId;
    }

    public static String searchSources(Source source) {
        return "search-sources:" + source.id();
    }
}
