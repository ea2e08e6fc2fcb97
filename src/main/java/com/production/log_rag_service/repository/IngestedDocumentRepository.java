package com.production.log_rag_service.repository;

import com.production.log_rag_service.model.IngestedDocument;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface IngestedDocumentRepository extends JpaRepository<IngestedDocument, IngestedDocument.DocumentKey> {

    List<IngestedDocument> findBySourceIdOrderByIdAsc(String sourceId);
}
