package com.convoviewer.viewer.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TierStats {

    private Long hitCount;

    private Long missCount;

    private Long loadCount;

    private Long loadFailureCount;

    /** Entries dropped for capacity, expiry or a changed fingerprint. */
    private Long evictionCount;

    private Integer entryCount;

    private Integer capacity;
}
