package com.convoviewer.viewer.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * An undecoded record as read from a platform log, tagged with its position in that log.
 */
@Value
public class RawRecord {

    int lineIndex;

    JsonNode payload;
}
