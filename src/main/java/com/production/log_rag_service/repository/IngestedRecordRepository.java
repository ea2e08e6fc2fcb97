package com.production.log_rag_service.repository;

import com.production.log_rag_service.model.IngestedRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface IngestedRecordRepository extends JpaRepository<IngestedRecord, IngestedRecord.RecordKey> {

    List<IngestedRecord> findByDocumentIdAndDocumentSourceIdOrderByOrdinalAsc(String documentId, String documentSourceId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from IngestedRecord r where r.documentId = :documentId and r.documentSourceId = :sourceId")
    int deleteByDocument(@Param("documentId") String documentId, @Param("sourceId") String sourceId);
}
