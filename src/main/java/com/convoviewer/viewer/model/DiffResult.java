package com.convoviewer.viewer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DiffResult {

    List<DiffLine> lines;

    /** Output was cut at the configured line limit. */
    boolean truncated;

    /** Input was too large for a minimal diff; changed region shown as one removed and one added block. */
    boolean coarse;

    public boolean hasChanges() {
        return lines.stream().anyMatch(l -> l.getKind() != DiffLine.Kind.CONTEXT);
    }
}
