package com.convoviewer.viewer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolCall {

    public static final String UNKNOWN = "unknown";

    String id;

    String name;

    @Singular
    Map<String, Object> parameters;

    /** Text output or a structured payload, whatever the platform recorded. */
    Object result;

    boolean edit;

    DiffResult diff;
}
