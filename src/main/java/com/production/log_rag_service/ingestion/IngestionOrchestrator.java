package com.production.log_rag_service.ingestion;

import com.production.log_rag_service.lucene.LuceneIndexService;
import com.production.log_rag_service.model.IndexChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drives one ingestion pass per source: purge deleted documents, then
 * re-chunk, re-embed and re-index every new or modified one.
 *
 * <p>A document is committed to the ledger only after its full chunk set is in
 * the index, so any failure leaves the ledger on the previous version and the
 * document is retried whole on the next pass. Any other exception fails only
 * its document or source, except ledger failures ({@link DataAccessException}),
 * which end the pass.
 */
@Service
@Slf4j
public class IngestionOrchestrator {

    private final IngestionLedger ledger;
    private final LuceneIndexService indexService;
    private final EmbeddingGateway embeddingGateway;

    public IngestionOrchestrator(IngestionLedger ledger,
                                 LuceneIndexService indexService,
                                 EmbeddingGateway embeddingGateway) {
        this.ledger = ledger;
        this.indexService = indexService;
        this.embeddingGateway = embeddingGateway;
    }

    /**
     * Runs every source in order. An aborted source does not stop the ones after it.
     */
    public List<IngestionReport> ingestAll(List<ContentSource> sources) {
        List<IngestionReport> reports = new ArrayList<>(sources.size());
        for (ContentSource source : sources) {
            reports.add(ingest(source));
        }
        return reports;
    }

    public IngestionReport ingest(ContentSource source) {
        String sourceId = source.identify();
        long start = System.currentTimeMillis();
        Counters counters = new Counters();

        log.info("[{}] Ingestion pass started", sourceId);
        LedgerView existing = ledger.viewOf(sourceId);

        List<SourceDocument> deleted;
        List<SourceDocument> changed;
        try {
            deleted = source.findDeleted(existing);
            purge(sourceId, deleted, counters);
            changed = source.diff(existing);
        } catch (IngestionException | IOException e) {
            long durationMs = System.currentTimeMillis() - start;
            log.error("[{}] Source enumeration failed, skipping source: {}", sourceId, e.getMessage());
            return counters.toReport(sourceId, durationMs, true, e.getMessage());
        } catch (DataAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            long durationMs = System.currentTimeMillis() - start;
            log.error("[{}] Source enumeration failed, skipping source", sourceId, e);
            return counters.toReport(sourceId, durationMs, true, e.toString());
        }

        log.info("[{}] {} deleted, {} new or modified (ledger holds {})",
                sourceId, deleted.size(), changed.size(), existing.documents().size());

        for (SourceDocument document : changed) {
            ingestDocument(source, existing, document, counters);
        }

        long durationMs = System.currentTimeMillis() - start;
        IngestionReport report = counters.toReport(sourceId, durationMs, false, null);
        log.info("[{}] Pass finished in {}ms: {} added, {} updated, {} deleted, {} failed, {} chunks written",
                sourceId, durationMs, report.added(), report.updated(), report.deleted(),
                report.failed(), report.chunksWritten());
        return report;
    }

    private void purge(String sourceId, List<SourceDocument> deleted, Counters counters) {
        for (SourceDocument document : deleted) {
            List<String> keys = ledger.recordKeys(document.id(), sourceId);
            try {
                indexService.deleteChunks(keys);
            } catch (IOException | RuntimeException e) {
                // Ledger row stays so the purge is retried next pass
                counters.failed++;
                log.warn("[{}] Could not remove {} chunks of deleted {}: {}",
                        sourceId, keys.size(), document.id(), e.getMessage());
                continue;
            }
            ledger.delete(document);
            counters.deleted++;
            log.debug("[{}] Purged {} ({} chunks)", sourceId, document.id(), keys.size());
        }
    }

    private void ingestDocument(ContentSource source, LedgerView existing,
                                SourceDocument document, Counters counters) {
        String sourceId = source.identify();
        Optional<SourceDocument> previous = existing.find(document.id());
        try {
            List<IndexChunk> chunks = source.materialize(embeddingGateway, document.id());

            List<String> staleKeys = previous.isPresent()
                    ? ledger.recordKeys(document.id(), sourceId)
                    : List.of();
            indexService.replaceChunks(staleKeys, chunks);

            List<String> newKeys = chunks.stream().map(IndexChunk::getKey).toList();
            ledger.commit(document, newKeys);

            if (previous.isPresent()) {
                counters.updated++;
            } else {
                counters.added++;
            }
            counters.chunksWritten += chunks.size();
            log.debug("[{}] {} {} -> {} chunks (version {})", sourceId,
                    previous.isPresent() ? "Updated" : "Added", document.id(), chunks.size(), document.version());

        } catch (MalformedContentException e) {
            counters.failed++;
            log.warn("[{}] Skipping malformed document {}: {}", sourceId, document.id(), e.getMessage());
        } catch (IngestionException | IOException e) {
            counters.failed++;
            log.error("[{}] Failed to ingest {}, will retry next pass: {}", sourceId, document.id(), e.getMessage());
        } catch (DataAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            counters.failed++;
            log.error("[{}] Unexpected error ingesting {}, will retry next pass", sourceId, document.id(), e);
        }
    }

    private static final class Counters {
        private int added;
        private int updated;
        private int deleted;
        private int failed;
        private int chunksWritten;

        private IngestionReport toReport(String sourceId, long durationMs, boolean aborted, String errorMessage) {
            return new IngestionReport(sourceId, added, updated, deleted, failed, chunksWritten,
                    durationMs, aborted, errorMessage);
        }
    }
}
