package com.convoviewer.viewer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A window of in-session search matches plus the totals over the whole session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSearchPage {

    private SessionRef session;

    private String query;

    /** Messages containing the query. */
    private Integer total;

    private Integer totalOccurrences;

    private Integer offset;

    private Integer limit;

    @Builder.Default
    private List<SessionMatch> matches = new ArrayList<>();
}
