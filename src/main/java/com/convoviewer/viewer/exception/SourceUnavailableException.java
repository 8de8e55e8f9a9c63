package com.convoviewer.viewer.exception;

import com.convoviewer.viewer.model.Source;
import lombok.Getter;

/**
 * A source's root directory is missing or unreadable. Callers spanning several
 * sources skip the source and carry on with the others.
 */
@Getter
public class SourceUnavailableException extends RuntimeException {

    private final Source source;

    private final String rootPath;

    public SourceUnavailableException(Source source, String rootPath, String reason) {
        super(source.id() + " is unavailable: " + reason + " (" + rootPath + ")");
        this.source = source;
        this.rootPath = rootPath;
    }
}
