package com.convoviewer.viewer.model;

import lombok.Value;

@Value
public class MessagePreview {

    int lineIndex;

    Role role;

    String snippet;
}
