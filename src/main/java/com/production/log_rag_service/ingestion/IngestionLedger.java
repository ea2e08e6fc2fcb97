package com.production.log_rag_service.ingestion;

import com.production.log_rag_service.model.IngestedDocument;
import com.production.log_rag_service.model.IngestedRecord;
import com.production.log_rag_service.repository.IngestedDocumentRepository;
import com.production.log_rag_service.repository.IngestedRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable record of every document ingested per source and the index keys it owns.
 * A document and its records are always written or removed in one transaction.
 */
@Service
@Slf4j
public class IngestionLedger {

    private final IngestedDocumentRepository documentRepository;
    private final IngestedRecordRepository recordRepository;

    public IngestionLedger(IngestedDocumentRepository documentRepository,
                           IngestedRecordRepository recordRepository) {
        this.documentRepository = documentRepository;
        this.recordRepository = recordRepository;
    }

    /**
     * Snapshot of the source's rows, taken once per pass.
     */
    @Transactional(readOnly = true)
    public LedgerView viewOf(String sourceId) {
        Map<String, SourceDocument> documents = new LinkedHashMap<>();
        for (IngestedDocument row : documentRepository.findBySourceIdOrderByIdAsc(sourceId)) {
            documents.put(row.getId(), toSourceDocument(row));
        }
        return new Snapshot(sourceId, Collections.unmodifiableMap(documents));
    }

    @Transactional(readOnly = true)
    public Optional<SourceDocument> find(String documentId, String sourceId) {
        return documentRepository.findById(new IngestedDocument.DocumentKey(documentId, sourceId))
                .map(IngestionLedger::toSourceDocument);
    }

    @Transactional(readOnly = true)
    public List<String> recordKeys(String documentId, String sourceId) {
        return recordRepository.findByDocumentIdAndDocumentSourceIdOrderByOrdinalAsc(documentId, sourceId)
                .stream()
                .map(IngestedRecord::getId)
                .toList();
    }

    /**
     * Stores the document's new version and replaces its whole record set.
     */
    @Transactional
    public void commit(SourceDocument document, List<String> recordKeys) {
        int removed = recordRepository.deleteByDocument(document.id(), document.sourceId());

        IngestedDocument row = documentRepository
                .findById(new IngestedDocument.DocumentKey(document.id(), document.sourceId()))
                .orElseGet(() -> IngestedDocument.builder()
                        .id(document.id())
                        .sourceId(document.sourceId())
                        .build());
        row.setVersion(document.version());
        row.setRecordCount(recordKeys.size());
        row.setIngestedAt(LocalDateTime.now());
        documentRepository.save(row);

        List<IngestedRecord> records = new ArrayList<>(recordKeys.size());
        for (int ordinal = 0; ordinal < recordKeys.size(); ordinal++) {
            records.add(IngestedRecord.builder()
                    .id(recordKeys.get(ordinal))
                    .documentId(document.id())
                    .documentSourceId(document.sourceId())
                    .ordinal(ordinal)
                    .build());
        }
        recordRepository.saveAll(records);

        log.debug("Committed {} [{}] version {}: {} records (replaced {})",
                document.id(), document.sourceId(), document.version(), records.size(), removed);
    }

    /**
     * Removes the document and all of its records.
     */
    @Transactional
    public void delete(SourceDocument document) {
        int removed = recordRepository.deleteByDocument(document.id(), document.sourceId());
        documentRepository.deleteById(new IngestedDocument.DocumentKey(document.id(), document.sourceId()));
        log.debug("Deleted {} [{}] with {} records", document.id(), document.sourceId(), removed);
    }

    @Transactional(readOnly = true)
    public List<IngestedDocument> listDocuments(String sourceId) {
        if (sourceId == null || sourceId.isBlank()) {
            return documentRepository.findAll();
        }
        return documentRepository.findBySourceIdOrderByIdAsc(sourceId);
    }

    @Transactional(readOnly = true)
    public long documentCount() {
        return documentRepository.count();
    }

    @Transactional(readOnly = true)
    public long recordCount() {
        return recordRepository.count();
    }

    private static SourceDocument toSourceDocument(IngestedDocument row) {
        return new SourceDocument(row.getId(), row.getSourceId(), row.getVersion());
    }

    private record Snapshot(String sourceId, Map<String, SourceDocument> rows) implements LedgerView {

        @Override
        public Optional<SourceDocument> find(String documentId) {
            return Optional.ofNullable(rows.get(documentId));
        }

        @Override
        public Collection<SourceDocument> documents() {
            return rows.values();
        }
    }
}
