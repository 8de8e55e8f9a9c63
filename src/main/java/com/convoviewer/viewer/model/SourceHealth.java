package com.convoviewer.viewer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceHealth {

    private Source source;

    private Boolean enabled;

    private Boolean available;

    private String rootPath;

    private Integer projectCount;

    private Integer sessionCount;

    private String error;
}
