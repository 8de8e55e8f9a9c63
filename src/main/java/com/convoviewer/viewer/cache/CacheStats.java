package com.convoviewer.viewer.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private Long hitCount;

    private Long missCount;

    private Integer entryCount;

    private Integer inFlightCount;

    @Builder.Default
    private Map<CacheTier, TierStats> tiers = new EnumMap<>(CacheTier.class);
}
