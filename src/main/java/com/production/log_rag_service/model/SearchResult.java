package com.production.log_rag_service.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SearchResult {
    private String chunkKey;
    private String documentId;
    private String sourceFileName;
    private String content;
    private int pageNumber;
    private float score;
}
