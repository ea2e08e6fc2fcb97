package com.production.log_rag_service.model;

import lombok.Builder;
import lombok.Data;

/**
 * One embedded text span as stored in the semantic index. Produced fresh
 * every time its document is (re-)indexed.
 */
@Data
@Builder
public class IndexChunk {
    private String key;
    private String documentId;
    private String sourceFileName;
    private int pageNumber;
    private String text;
    private float[] vector;
}
