package com.convoviewer.viewer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.util.Locale;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiffLine {

    public enum Kind {
        CONTEXT,
        ADDED,
        REMOVED;

        @JsonValue
        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    Kind kind;

    Integer oldLineNo;

    Integer newLineNo;

    String text;
}
