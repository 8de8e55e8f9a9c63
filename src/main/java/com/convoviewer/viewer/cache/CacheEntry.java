package com.convoviewer.viewer.cache;

import lombok.Value;

import java.time.Instant;

@Value
public class CacheEntry {

    String key;

    Object value;

    Instant insertedAt;

    /** Null when the entry never expires. */
    Instant expiresAt;

    /** Null when the entry has no backing files. */
    FileFingerprint fingerprint;

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
