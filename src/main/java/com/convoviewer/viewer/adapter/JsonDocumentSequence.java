package com.convoviewer.viewer.adapter;

import com.convoviewer.viewer.model.RawRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Function;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Records held in an array inside a single JSON document. The record's index is its
 * position in that array. A document that cannot be parsed yields no records.
 */
@Slf4j
public class JsonDocumentSequence implements RawRecordSequence {

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Function<JsonNode, JsonNode> recordsSelector;

    /**
     * @param file - Document to read
     * @param objectMapper - Shared mapper
     * @param recordsSelector - Picks the record array out of the document root
     */
    public JsonDocumentSequence(Path file, ObjectMapper objectMapper, Function<JsonNode, JsonNode> recordsSelector) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.recordsSelector = recordsSelector;
    }

    @Override
    public Stream<RawRecord> open() throws IOException {
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            log.debug("Skipping malformed document {}: {}", file, e.getOriginalMessage());
            return Stream.empty();
        }
        if (root == null) {
            return Stream.empty();
        }
        JsonNode records = recordsSelector.apply(root);
        if (records == null || !records.isArray()) {
            return Stream.empty();
        }
        return IntStream.range(0, records.size())
                .mapToObj(i -> new RawRecord(i, records.get(i)));
    }
}
