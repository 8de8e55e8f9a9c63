package com.convoviewer.viewer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthReport {

    private String status;

    @Builder.Default
    private List<SourceHealth> sources = new ArrayList<>();

    private Integer totalProjects;

    private Integer totalSessions;

    private Long generatedAt;
}
