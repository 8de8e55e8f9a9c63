package com.convoviewer.viewer.model;

import lombok.Value;

/**
 * The searchable part of a {@link Message}: where it is, who said it and its text.
 */
@Value
public class IndexedMessage {

    int lineIndex;

    Role role;

    String content;

    public static IndexedMessage of(Message message) {
        return new IndexedMessage(message.getLineIndex(), message.getRole(), message.getContent());
    }
}
