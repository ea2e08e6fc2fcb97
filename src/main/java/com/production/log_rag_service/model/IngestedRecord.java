package com.production.log_rag_service.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Ledger pointer from a document to one chunk key in the semantic index.
 */
@Entity
@Table(name = "ingested_records")
@IdClass(IngestedRecord.RecordKey.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestedRecord {

    /** The chunk key in the semantic index. */
    @Id
    @Column(length = 1000)
    private String id;

    @Id
    @Column(length = 1000)
    private String documentId;

    @Id
    @Column(length = 1000)
    private String documentSourceId;

    @Column(nullable = false)
    private int ordinal;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecordKey implements Serializable {
        private String id;
        private String documentId;
        private String documentSourceId;
    }
}
