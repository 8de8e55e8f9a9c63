package com.convoviewer.viewer.model;

import lombok.Value;

/**
 * Character range [start, end) of one query occurrence inside message content.
 */
@Value
public class MatchSpan {

    int start;

    int end;
}
