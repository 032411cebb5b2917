package com.creditrust.rag.ingest;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.creditrust.rag.error.DataException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads complaints from a UTF-8 JSON-lines file, one complaint per line:
 *
 * <pre>
 * {"id":"3198084","product":"Credit card","company":"ACME BANK","submittedOn":"2023-01-05","text":"..."}
 * </pre>
 *
 * Lines that cannot be parsed or lack an id or narrative are logged and
 * skipped.
 */
public class JsonLinesDocumentSource implements DocumentSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonLinesDocumentSource.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonLinesDocumentSource(Path path, ObjectMapper objectMapper) {
        this.path = Objects.requireNonNull(path, "path");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public List<Document> load() {
        List<Document> documents = new ArrayList<>();
        int rejected = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    documents.add(parse(line));
                } catch (DataException ex) {
                    rejected++;
                    LOGGER.warn("Skipping line {} of {}: {}", lineNumber, path, ex.getMessage());
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read corpus " + path, ex);
        }
        LOGGER.info("Loaded {} documents from {} ({} rejected)", documents.size(), path, rejected);
        return documents;
    }

    Document parse(String line) {
        JsonNode node;
        try {
            node = objectMapper.readTree(line);
        } catch (JsonProcessingException ex) {
            throw new DataException("Malformed JSON: " + ex.getOriginalMessage(), ex);
        }
        if (node == null || !node.isObject()) {
            throw new DataException("Expected a JSON object");
        }
        String id = text(node, "id");
        if (id == null || id.isBlank()) {
            throw new DataException("Missing complaint id");
        }
        String narrative = text(node, "text");
        if (narrative == null || narrative.isBlank()) {
            throw new DataException("Complaint " + id + " has no narrative");
        }
        SourceMetadata source = new SourceMetadata(text(node, "product"), date(node, id), text(node, "company"));
        return new Document(id.strip(), source, narrative);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static LocalDate date(JsonNode node, String id) {
        String value = text(node, "submittedOn");
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.strip());
        } catch (DateTimeParseException ex) {
            throw new DataException("Complaint " + id + " has an invalid submission date '" + value + "'", ex);
        }
    }
}
