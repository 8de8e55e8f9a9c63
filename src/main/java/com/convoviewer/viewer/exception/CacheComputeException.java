package com.convoviewer.viewer.exception;

import lombok.Getter;

/**
 * The loader behind a cache key failed. Delivered to every caller waiting on that key;
 * nothing is cached, so the next request retries.
 */
@Getter
public class CacheComputeException extends RuntimeException {

    private final String key;

    public CacheComputeException(String key, Throwable cause) {
        super("Failed to compute cache entry '" + key + "': " + cause.getMessage(), cause);
        this.key = key;
    }
}
