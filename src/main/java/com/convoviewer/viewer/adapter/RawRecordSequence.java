package com.convoviewer.viewer.adapter;

import com.convoviewer.viewer.model.RawRecord;

import java.io.IOException;
import java.util.stream.Stream;

/**
 * Restartable, lazy sequence of raw records in log order.
 *
 * Every call to {@link #open()} reads the log again from the start. The returned
 * stream holds an open file or connection and must be closed, typically with
 * try-with-resources.
 */
@FunctionalInterface
public interface RawRecordSequence {

    Stream<RawRecord> open() throws IOException;
}
