package com.production.log_rag_service.lucene;

import com.production.log_rag_service.config.AppConfig;
import com.production.log_rag_service.model.IndexChunk;
import com.production.log_rag_service.model.SearchResult;
import com.production.log_rag_service.support.FakeEmbeddingModel;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LuceneIndexServiceTest {

    private IndexWriter indexWriter;
    private LuceneIndexService indexService;
    private LuceneSearchService searchService;

    @BeforeEach
    void setUp() throws IOException {
        AppConfig appConfig = new AppConfig();
        appConfig.getLucene().setVectorDimensions(FakeEmbeddingModel.DIMENSIONS);
        indexWriter = new IndexWriter(new ByteBuffersDirectory(), new IndexWriterConfig(new StandardAnalyzer()));
        indexService = new LuceneIndexService(indexWriter, appConfig);
        searchService = new LuceneSearchService(indexWriter);
    }

    @AfterEach
    void tearDown() throws IOException {
        indexWriter.close();
    }

    @Test
    void upsertReplacesChunkWithSameKey() throws IOException {
        indexService.upsertChunks(List.of(chunk("a_1", "a.json", "disk full on node 3")));
        indexService.upsertChunks(List.of(chunk("a_1", "a.json", "disk cleaned on node 3")));

        assertThat(indexService.getChunkCount()).isEqualTo(1);
        List<SearchResult> hits = searchService.search(FakeEmbeddingModel.vectorFor("disk cleaned on node 3"), 5);
        assertThat(hits).singleElement().satisfies(hit -> {
            assertThat(hit.getChunkKey()).isEqualTo("a_1");
            assertThat(hit.getContent()).isEqualTo("disk cleaned on node 3");
            assertThat(hit.getPageNumber()).isEqualTo(1);
        });
    }

    @Test
    void replaceDropsStaleKeysAndWritesNewOnes() throws IOException {
        indexService.upsertChunks(List.of(
                chunk("a_1", "a.json", "one"), chunk("a_2", "a.json", "two"), chunk("b_1", "b.json", "other")));

        indexService.replaceChunks(List.of("a_1", "a_2"), List.of(chunk("a_1", "a.json", "rewritten")));

        assertThat(indexService.getChunkCount()).isEqualTo(2);
        assertThat(searchService.search(FakeEmbeddingModel.vectorFor("rewritten"), 10))
                .extracting(SearchResult::getChunkKey)
                .containsExactlyInAnyOrder("a_1", "b_1");
    }

    @Test
    void deleteRemovesOnlyNamedKeys() throws IOException {
        indexService.upsertChunks(List.of(chunk("a_1", "a.json", "one"), chunk("b_1", "b.json", "two")));

        indexService.deleteChunks(List.of("a_1"));

        assertThat(searchService.search(FakeEmbeddingModel.vectorFor("one"), 10))
                .extracting(SearchResult::getChunkKey)
                .containsExactly("b_1");
    }

    @Test
    void nearestChunkRanksFirst() throws IOException {
        indexService.upsertChunks(List.of(
                chunk("x_1", "x.json", "connection refused by upstream"),
                chunk("y_1", "y.json", "user login successful"),
                chunk("z_1", "z.json", "cache refreshed")));

        List<SearchResult> hits = searchService.search(FakeEmbeddingModel.vectorFor("user login successful"), 3);

        assertThat(hits.get(0).getChunkKey()).isEqualTo("y_1");
        assertThat(hits.get(0).getScore()).isGreaterThanOrEqualTo(hits.get(hits.size() - 1).getScore());
    }

    @Test
    void searchCanBeRestrictedToOneDocument() throws IOException {
        indexService.upsertChunks(List.of(
                chunk("x_1", "x.json", "alpha"), chunk("x_2", "x.json", "beta"), chunk("y_1", "y.json", "alpha")));

        List<SearchResult> hits = searchService.searchByDocumentId(FakeEmbeddingModel.vectorFor("alpha"), "x.json", 10);

        assertThat(hits).extracting(SearchResult::getDocumentId).containsOnly("x.json");
        assertThat(hits).hasSize(2);
    }

    @Test
    void wrongVectorLengthIsRejectedBeforeAnyWrite() throws IOException {
        IndexChunk bad = chunk("a_1", "a.json", "text");
        bad.setVector(new float[3]);

        assertThatThrownBy(() -> indexService.upsertChunks(List.of(bad)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("vector dimensions");
        assertThat(indexService.getChunkCount()).isZero();
    }

    private static IndexChunk chunk(String key, String documentId, String text) {
        return IndexChunk.builder()
                .key(key)
                .documentId(documentId)
                .sourceFileName(documentId)
                .pageNumber(1)
                .text(text)
                .vector(FakeEmbeddingModel.vectorFor(text))
                .build();
    }
}
