package com.production.log_rag_service.lucene;

import com.production.log_rag_service.config.AppConfig;
import com.production.log_rag_service.model.IndexChunk;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.*;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Write side of the semantic index. Every chunk is keyed by {@code chunk_key};
 * writing a key again fully replaces the stored chunk.
 */
@Service
@Slf4j
public class LuceneIndexService {

    static final String FIELD_CHUNK_KEY = "chunk_key";
    static final String FIELD_DOCUMENT_ID = "document_id";
    static final String FIELD_SOURCE_FILE = "source_file_name";
    static final String FIELD_CONTENT = "content";
    static final String FIELD_PAGE_NUMBER = "page_number";
    static final String FIELD_PAGE_NUMBER_STORED = "page_number_stored";
    static final String FIELD_VECTOR = "vector";

    private final IndexWriter indexWriter;
    private final AppConfig appConfig;
    private final ReentrantLock writeLock = new ReentrantLock();

    public LuceneIndexService(IndexWriter indexWriter, AppConfig appConfig) {
        this.indexWriter = indexWriter;
        this.appConfig = appConfig;
    }

    public void upsertChunks(List<IndexChunk> chunks) throws IOException {
        replaceChunks(List.of(), chunks);
    }

    public void deleteChunks(Collection<String> keys) throws IOException {
        if (keys.isEmpty()) {
            return;
        }
        writeLock.lock();
        try {
            indexWriter.deleteDocuments(toTerms(keys));
            indexWriter.commit();
            log.info("Deleted {} chunks from index", keys.size());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Deletes {@code staleKeys} and upserts {@code chunks}, made visible by a single commit.
     */
    public void replaceChunks(Collection<String> staleKeys, List<IndexChunk> chunks) throws IOException {
        for (IndexChunk chunk : chunks) {
            validate(chunk);
        }
        if (staleKeys.isEmpty() && chunks.isEmpty()) {
            return;
        }

        writeLock.lock();
        try {
            if (!staleKeys.isEmpty()) {
                indexWriter.deleteDocuments(toTerms(staleKeys));
            }

            int batchSize = appConfig.getLucene().getBatchCommitSize();
            int indexed = 0;
            for (IndexChunk chunk : chunks) {
                indexWriter.updateDocument(new Term(FIELD_CHUNK_KEY, chunk.getKey()), createDocument(chunk));
                indexed++;

                if (indexed % batchSize == 0) {
                    log.debug("Indexed {} chunks so far...", indexed);
                }
            }

            indexWriter.commit();
            log.info("Indexed {} chunks for document {} (removed {} stale keys)",
                    chunks.size(),
                    chunks.isEmpty() ? "N/A" : chunks.get(0).getDocumentId(),
                    staleKeys.size());
        } finally {
            writeLock.unlock();
        }
    }

    public long getChunkCount() throws IOException {
        return indexWriter.getDocStats().numDocs;
    }

    private void validate(IndexChunk chunk) throws IOException {
        if (chunk.getKey() == null || chunk.getKey().isBlank()) {
            throw new IOException("Chunk without key for document " + chunk.getDocumentId());
        }
        int expected = appConfig.getLucene().getVectorDimensions();
        if (chunk.getVector() == null || chunk.getVector().length != expected) {
            throw new IOException(String.format("Chunk %s has %d vector dimensions, index expects %d",
                    chunk.getKey(), chunk.getVector() == null ? 0 : chunk.getVector().length, expected));
        }
    }

    private static Term[] toTerms(Collection<String> keys) {
        return keys.stream()
                .map(key -> new Term(FIELD_CHUNK_KEY, key))
                .toArray(Term[]::new);
    }

    private Document createDocument(IndexChunk chunk) {
        Document doc = new Document();

        // Chunk key - exact match, the upsert/delete handle
        doc.add(new StringField(FIELD_CHUNK_KEY, chunk.getKey(), Field.Store.YES));

        // Document ID - exact match filtering
        doc.add(new StringField(FIELD_DOCUMENT_ID, chunk.getDocumentId(), Field.Store.YES));

        doc.add(new StoredField(FIELD_SOURCE_FILE, chunk.getSourceFileName()));

        doc.add(new TextField(FIELD_CONTENT, chunk.getText(), Field.Store.YES));

        // Page number - IntPoint for range queries + StoredField for retrieval
        doc.add(new IntPoint(FIELD_PAGE_NUMBER, chunk.getPageNumber()));
        doc.add(new StoredField(FIELD_PAGE_NUMBER_STORED, chunk.getPageNumber()));

        doc.add(new KnnFloatVectorField(FIELD_VECTOR, chunk.getVector(), VectorSimilarityFunction.COSINE));

        return doc;
    }
}
