package com.paramvault.api.generator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses one generator response line. The generator may print diagnostics before the
 * payload, so parsing starts at the first '['. Nothing may follow the array.
 */
public class BatchParser {

    private static final int PREVIEW_LENGTH = 200;

    private final ObjectReader reader;

    public BatchParser(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public List<String> parse(String line) throws IOException {
        int arrayStart = line.indexOf('[');
        if (arrayStart == -1) {
            throw new IOException("No JSON array in generator output: " + preview(line));
        }

        JsonNode root;
        try {
            root = reader.readTree(line.substring(arrayStart));
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed JSON in generator output: " + preview(line), e);
        }
        if (root == null || !root.isArray()) {
            throw new IOException("Generator output is not a JSON array: " + preview(line));
        }

        List<String> credentials = new ArrayList<>(root.size());
        for (JsonNode element : root) {
            if (!element.isTextual()) {
                throw new IOException("Generator emitted a non-string credential: " + element);
            }
            credentials.add(element.asText());
        }
        return credentials;
    }

    static String preview(String line) {
        return line.length() <= PREVIEW_LENGTH ? line : line.substring(0, PREVIEW_LENGTH) + "...";
    }
}
