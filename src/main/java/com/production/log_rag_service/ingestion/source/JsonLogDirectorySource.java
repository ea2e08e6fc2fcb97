package com.production.log_rag_service.ingestion.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.production.log_rag_service.ingestion.ContentSource;
import com.production.log_rag_service.ingestion.EmbeddingGateway;
import com.production.log_rag_service.ingestion.LedgerView;
import com.production.log_rag_service.ingestion.MalformedContentException;
import com.production.log_rag_service.ingestion.SourceDocument;
import com.production.log_rag_service.model.IndexChunk;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON log files in a directory. Each file holds a JSON array of log entries;
 * consecutive entries are packed into chunks of at most {@value #MAX_ENTRIES_PER_CHUNK}
 * entries, closing a chunk early once its text passes {@value #MAX_CHUNK_CHARS} characters.
 */
@Slf4j
public class JsonLogDirectorySource implements ContentSource {

    static final int MAX_ENTRIES_PER_CHUNK = 10;
    static final int MAX_CHUNK_CHARS = 1000;

    private final DirectoryScanner scanner;
    private final ObjectMapper objectMapper;
    private final String sourceId;

    public JsonLogDirectorySource(Path directory) {
        this.scanner = new DirectoryScanner(directory, ".json");
        this.objectMapper = new ObjectMapper();
        this.sourceId = "JsonLogDirectorySource:" + scanner.directory();
    }

    @Override
    public String identify() {
        return sourceId;
    }

    @Override
    public List<SourceDocument> diff(LedgerView existing) throws IOException {
        return scanner.diff(sourceId, existing);
    }

    @Override
    public List<SourceDocument> findDeleted(LedgerView existing) throws IOException {
        return scanner.findDeleted(existing);
    }

    @Override
    public List<IndexChunk> materialize(EmbeddingGateway embeddingGateway, String documentId) throws IOException {
        List<IndexChunk> chunks = chunk(documentId, readEntries(documentId));
        List<float[]> vectors = embeddingGateway.embedAll(chunks.stream().map(IndexChunk::getText).toList());
        for (int i = 0; i < chunks.size(); i++) {
            chunks.get(i).setVector(vectors.get(i));
        }
        log.debug("Materialized {} into {} chunks", documentId, chunks.size());
        return chunks;
    }

    /**
     * Packs log entries into chunks without embedding them.
     */
    List<IndexChunk> chunk(String documentId, List<String> entries) {
        String keyPrefix = DirectoryScanner.baseName(documentId);
        List<IndexChunk> chunks = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int page = 1;

        for (String entry : entries) {
            current.add(entry);
            if (current.size() >= MAX_ENTRIES_PER_CHUNK || String.join("\n", current).length() > MAX_CHUNK_CHARS) {
                chunks.add(buildChunk(keyPrefix, documentId, page++, current));
                current.clear();
            }
        }
        if (!current.isEmpty()) {
            chunks.add(buildChunk(keyPrefix, documentId, page, current));
        }
        return chunks;
    }

    private List<String> readEntries(String documentId) throws IOException {
        Path file = scanner.resolve(documentId);
        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(file));
        } catch (JsonProcessingException e) {
            throw new MalformedContentException("Invalid JSON in " + documentId + ": " + e.getOriginalMessage(), e);
        }

        if (root == null || root.isMissingNode() || root.isNull()) {
            return List.of();
        }
        if (!root.isArray()) {
            throw new MalformedContentException("Expected a JSON array of log entries in " + documentId
                    + " but found " + root.getNodeType());
        }

        List<String> entries = new ArrayList<>(root.size());
        for (JsonNode entry : root) {
            // Strings contribute their value, everything else its compact JSON form
            entries.add(entry.isTextual() ? entry.asText() : entry.toString());
        }
        return entries;
    }

    private static IndexChunk buildChunk(String keyPrefix, String documentId, int page, List<String> entries) {
        return IndexChunk.builder()
                .key(keyPrefix + "_" + page)
                .documentId(documentId)
                .sourceFileName(documentId)
                .pageNumber(page)
                .text(String.join("\n", entries))
                .build();
    }
}
