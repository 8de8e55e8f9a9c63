package com.convoviewer.viewer.adapter;

import com.convoviewer.viewer.model.RawRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * One JSON record per line. The record's index is its 0-based physical line number,
 * so skipped blank or malformed lines leave gaps rather than shifting later records.
 */
@Slf4j
public class JsonLinesSequence implements RawRecordSequence {

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonLinesSequence(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public Stream<RawRecord> open() throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(
                Files.newInputStream(file),
                StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPLACE)
                        .onUnmappableCharacter(CodingErrorAction.REPLACE)));
        LineIterator iterator = new LineIterator(reader);
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(() -> {
                    try {
                        reader.close();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
    }

    private final class LineIterator implements Iterator<RawRecord> {

        private final BufferedReader reader;
        private int lineNumber = -1;
        private RawRecord next;
        private boolean done;

        LineIterator(BufferedReader reader) {
            this.reader = reader;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (done) {
                return false;
            }
            try {
                String line;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    try {
                        JsonNode node = objectMapper.readTree(line);
                        next = new RawRecord(lineNumber, node);
                        return true;
                    } catch (JsonProcessingException e) {
                        log.debug("Skipping malformed record at {}:{}: {}", file, lineNumber, e.getOriginalMessage());
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + file, e);
            }
            done = true;
            return false;
        }

        @Override
        public RawRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            RawRecord record = next;
            next = null;
            return record;
        }
    }
}
