package com.convoviewer.viewer.cache;

import java.util.Locale;
import java.util.Optional;

public enum CacheTier {

    /** Entry-count bounded, least-recently-used eviction. Normalized sessions, messages and project listings. */
    HOT,

    /** Time bounded. Aggregates that may be a few seconds stale: health counts, search source listings. */
    WARM,

    /**
     * Entry-count bounded, sized for every session of every source. Compact searchable text
     * read by global search, kept apart so a full scan never evicts browsing entries.
     */
    INDEX;

    public static Optional<CacheTier> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
