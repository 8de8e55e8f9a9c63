package com.convoviewer.viewer.cache;

import lombok.Value;

import java.util.List;

/**
 * Modification time and size of every backing file of a cache entry, in a fixed order.
 * Two fingerprints are equal only when every file is unchanged.
 */
@Value
public class FileFingerprint {

    @Value
    public static class FileStamp {
        String path;
        boolean exists;
        long modifiedMillis;
        long sizeBytes;
    }

    List<FileStamp> stamps;
}
