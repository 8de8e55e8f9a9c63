package com.convoviewer.viewer.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class SessionMatch {

    int lineIndex;

    Role role;

    Instant timestamp;

    int occurrences;

    String snippet;

    List<MatchSpan> spans;
}
