package com.production.log_rag_service.lucene;

import com.production.log_rag_service.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.*;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Nearest-neighbour retrieval over the chunk vectors.
 */
@Service
@Slf4j
public class LuceneSearchService {

    private final IndexWriter indexWriter;

    public LuceneSearchService(IndexWriter indexWriter) {
        this.indexWriter = indexWriter;
    }

    public List<SearchResult> search(float[] queryVector, int topK) throws IOException {
        return execute(new KnnFloatVectorQuery(LuceneIndexService.FIELD_VECTOR, queryVector, topK), topK);
    }

    public List<SearchResult> searchByDocumentId(float[] queryVector, String documentId, int topK) throws IOException {
        Query filter = new TermQuery(new Term(LuceneIndexService.FIELD_DOCUMENT_ID, documentId));
        return execute(new KnnFloatVectorQuery(LuceneIndexService.FIELD_VECTOR, queryVector, topK, filter), topK);
    }

    private List<SearchResult> execute(Query query, int topK) throws IOException {
        // Get a reader from the writer (ensures we see latest commits)
        try (IndexReader reader = DirectoryReader.open(indexWriter)) {
            IndexSearcher searcher = new IndexSearcher(reader);
            TopDocs topDocs = searcher.search(query, topK);

            List<SearchResult> results = new ArrayList<>();
            for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
                Document doc = searcher.storedFields().document(scoreDoc.doc);

                results.add(SearchResult.builder()
                        .chunkKey(doc.get(LuceneIndexService.FIELD_CHUNK_KEY))
                        .documentId(doc.get(LuceneIndexService.FIELD_DOCUMENT_ID))
                        .sourceFileName(doc.get(LuceneIndexService.FIELD_SOURCE_FILE))
                        .content(doc.get(LuceneIndexService.FIELD_CONTENT))
                        .pageNumber(doc.getField(LuceneIndexService.FIELD_PAGE_NUMBER_STORED).numericValue().intValue())
                        .score(scoreDoc.score)
                        .build());
            }

            log.debug("kNN query returned {} of {} requested chunks", results.size(), topK);
            return results;
        }
    }
}
