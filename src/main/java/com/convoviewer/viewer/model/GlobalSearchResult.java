package com.convoviewer.viewer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GlobalSearchResult {

    private String query;

    private Integer limit;

    /** Number of matching sessions before truncation to {@code limit}. */
    private Integer totalCandidates;

    @Builder.Default
    private List<SearchHit> hits = new ArrayList<>();

    /** Sources skipped for this request, with the reason. */
    @Builder.Default
    private Map<Source, String> unavailableSources = new EnumMap<>(Source.class);

    private Long elapsedMs;
}
