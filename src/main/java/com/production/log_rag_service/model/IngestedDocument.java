package com.production.log_rag_service.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * Ledger row for one document of one source. Its records live in
 * {@link IngestedRecord} and point back by (documentId, documentSourceId).
 */
@Entity
@Table(name = "ingested_documents")
@IdClass(IngestedDocument.DocumentKey.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestedDocument {

    @Id
    @Column(length = 1000)
    private String id;

    @Id
    @Column(length = 1000)
    private String sourceId;

    @Column(name = "document_version", nullable = false, length = 200)
    private String version;

    private Integer recordCount;

    private LocalDateTime ingestedAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DocumentKey implements Serializable {
        private String id;
        private String sourceId;
    }
}
