package com.production.log_rag_service.ingestion;

import com.production.log_rag_service.config.AppConfig;
import com.production.log_rag_service.ingestion.source.JsonLogDirectorySource;
import com.production.log_rag_service.lucene.LuceneIndexService;
import com.production.log_rag_service.lucene.LuceneSearchService;
import com.production.log_rag_service.model.IndexChunk;
import com.production.log_rag_service.model.IngestedDocument;
import com.production.log_rag_service.model.SearchResult;
import com.production.log_rag_service.support.FakeEmbeddingModel;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

@DataJpaTest
@Import(IngestionLedger.class)
class IngestionOrchestratorTest {

    @Autowired
    private IngestionLedger ledger;

    @TempDir
    Path dir;

    private FakeEmbeddingModel embeddingModel;
    private EmbeddingGateway gateway;
    private IndexWriter indexWriter;
    private LuceneIndexService indexService;
    private LuceneSearchService searchService;
    private IngestionOrchestrator orchestrator;
    private JsonLogDirectorySource source;

    @BeforeEach
    void setUp() throws IOException {
        AppConfig appConfig = new AppConfig();
        appConfig.getLucene().setVectorDimensions(FakeEmbeddingModel.DIMENSIONS);
        indexWriter = new IndexWriter(new ByteBuffersDirectory(), new IndexWriterConfig(new StandardAnalyzer()));
        indexService = spy(new LuceneIndexService(indexWriter, appConfig));
        searchService = new LuceneSearchService(indexWriter);

        embeddingModel = new FakeEmbeddingModel();
        gateway = new EmbeddingGateway(embeddingModel, 2);
        orchestrator = new IngestionOrchestrator(ledger, indexService, gateway);
        source = new JsonLogDirectorySource(dir);
    }

    @AfterEach
    void tearDown() throws IOException {
        gateway.close();
        indexWriter.close();
    }

    @Test
    void firstPassIndexesOneChunkPerSmallFile() throws IOException {
        writeLog("a.json", 10, "2024-05-01T10:00:00Z");

        IngestionReport report = orchestrator.ingest(source);

        assertThat(report.added()).isEqualTo(1);
        assertThat(report.chunksWritten()).isEqualTo(1);
        assertThat(report.aborted()).isFalse();
        assertThat(ledger.listDocuments(source.identify())).extracting(IngestedDocument::getId)
                .containsExactly("a.json");
        assertThat(ledger.recordKeys("a.json", source.identify())).containsExactly("a_1");
        assertThat(indexedKeys("a.json")).containsExactly("a_1");
        assertThat(embeddingModel.calls()).isEqualTo(1);
    }

    @Test
    void secondPassWithoutChangesDoesNothing() throws IOException {
        writeLog("a.json", 10, "2024-05-01T10:00:00Z");
        writeLog("b.json", 25, "2024-05-01T10:00:00Z");
        orchestrator.ingest(source);
        embeddingModel.resetCalls();
        clearInvocations(indexService);

        IngestionReport report = orchestrator.ingest(source);

        assertThat(report.documentsChanged()).isZero();
        assertThat(report.failed()).isZero();
        assertThat(embeddingModel.calls()).isZero();
        verify(indexService, never()).replaceChunks(anyCollection(), anyList());
        verify(indexService, never()).deleteChunks(anyCollection());
    }

    @Test
    void modifiedFileFullyReplacesItsChunks() throws IOException {
        writeLog("a.json", 25, "2024-05-01T10:00:00Z");
        orchestrator.ingest(source);
        assertThat(indexedKeys("a.json")).containsExactlyInAnyOrder("a_1", "a_2", "a_3");

        writeLog("a.json", 5, "2024-05-01T11:00:00Z");
        IngestionReport report = orchestrator.ingest(source);

        assertThat(report.updated()).isEqualTo(1);
        assertThat(report.added()).isZero();
        assertThat(ledger.find("a.json", source.identify())).map(SourceDocument::version)
                .contains("2024-05-01T11:00:00Z");
        assertThat(ledger.recordKeys("a.json", source.identify())).containsExactly("a_1");
        assertThat(indexedKeys("a.json")).containsExactly("a_1");
        assertThat(indexService.getChunkCount()).isEqualTo(1);
    }

    @Test
    void deletedFileLosesExactlyItsRecordsAndChunks() throws IOException {
        writeLog("a.json", 15, "2024-05-01T10:00:00Z");
        writeLog("b.json", 5, "2024-05-01T10:00:00Z");
        orchestrator.ingest(source);

        Files.delete(dir.resolve("a.json"));
        IngestionReport report = orchestrator.ingest(source);

        assertThat(report.deleted()).isEqualTo(1);
        assertThat(ledger.find("a.json", source.identify())).isEmpty();
        assertThat(ledger.recordKeys("a.json", source.identify())).isEmpty();
        assertThat(indexedKeys("a.json")).isEmpty();
        assertThat(ledger.recordKeys("b.json", source.identify())).containsExactly("b_1");
        assertThat(indexedKeys("b.json")).containsExactly("b_1");
    }

    @Test
    void embeddingFailureSkipsOnlyThatDocumentAndIsRetriedNextPass() throws IOException {
        writeLog("a.json", 5, "2024-05-01T10:00:00Z");
        Files.writeString(dir.resolve("b.json"), "[\"poison entry\", \"fine entry\"]");
        embeddingModel.failWhen(text -> text.contains("poison"));

        IngestionReport first = orchestrator.ingest(source);

        assertThat(first.added()).isEqualTo(1);
        assertThat(first.failed()).isEqualTo(1);
        assertThat(ledger.find("b.json", source.identify())).isEmpty();
        assertThat(indexedKeys("b.json")).isEmpty();

        embeddingModel.failWhen(text -> false);
        IngestionReport second = orchestrator.ingest(source);

        assertThat(second.added()).isEqualTo(1);
        assertThat(second.failed()).isZero();
        assertThat(indexedKeys("b.json")).containsExactly("b_1");
    }

    @Test
    void failedUpdateKeepsServingThePreviousVersion() throws IOException {
        writeLog("a.json", 5, "2024-05-01T10:00:00Z");
        orchestrator.ingest(source);
        String oldText = searchService.searchByDocumentId(FakeEmbeddingModel.vectorFor("x"), "a.json", 5)
                .get(0).getContent();

        Files.writeString(dir.resolve("a.json"), "[\"poison entry\"]");
        Files.setLastModifiedTime(dir.resolve("a.json"), FileTime.from(Instant.parse("2024-05-01T11:00:00Z")));
        embeddingModel.failWhen(text -> text.contains("poison"));
        IngestionReport report = orchestrator.ingest(source);

        assertThat(report.failed()).isEqualTo(1);
        assertThat(ledger.find("a.json", source.identify())).map(SourceDocument::version)
                .contains("2024-05-01T10:00:00Z");
        assertThat(searchService.searchByDocumentId(FakeEmbeddingModel.vectorFor("x"), "a.json", 5))
                .extracting(SearchResult::getContent)
                .containsExactly(oldText);
    }

    @Test
    void indexWriteFailureLeavesLedgerUntouched() throws IOException {
        writeLog("a.json", 5, "2024-05-01T10:00:00Z");
        doThrow(new IOException("disk full")).when(indexService).replaceChunks(anyCollection(), anyList());

        IngestionReport first = orchestrator.ingest(source);

        assertThat(first.failed()).isEqualTo(1);
        assertThat(ledger.find("a.json", source.identify())).isEmpty();

        doCallRealMethod().when(indexService).replaceChunks(anyCollection(), anyList());
        IngestionReport second = orchestrator.ingest(source);

        assertThat(second.added()).isEqualTo(1);
        assertThat(indexedKeys("a.json")).containsExactly("a_1");
    }

    @Test
    void failedIndexDeleteKeepsLedgerRowForRetry() throws IOException {
        writeLog("a.json", 5, "2024-05-01T10:00:00Z");
        orchestrator.ingest(source);
        Files.delete(dir.resolve("a.json"));
        doThrow(new IOException("index locked")).when(indexService).deleteChunks(anyCollection());

        IngestionReport first = orchestrator.ingest(source);

        assertThat(first.deleted()).isZero();
        assertThat(first.failed()).isEqualTo(1);
        assertThat(ledger.find("a.json", source.identify())).isPresent();

        doCallRealMethod().when(indexService).deleteChunks(anyCollection());
        IngestionReport second = orchestrator.ingest(source);

        assertThat(second.deleted()).isEqualTo(1);
        assertThat(ledger.find("a.json", source.identify())).isEmpty();
        assertThat(indexedKeys("a.json")).isEmpty();
    }

    @Test
    void malformedFileIsSkippedWhileSiblingsProceed() throws IOException {
        Files.writeString(dir.resolve("bad.json"), "{\"not\": \"an array\"}");
        writeLog("good.json", 3, "2024-05-01T10:00:00Z");

        IngestionReport report = orchestrator.ingest(source);

        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.added()).isEqualTo(1);
        assertThat(ledger.find("bad.json", source.identify())).isEmpty();
    }

    @Test
    void unreadableSourceAbortsOnlyThatSource() throws IOException {
        writeLog("a.json", 3, "2024-05-01T10:00:00Z");
        JsonLogDirectorySource missing = new JsonLogDirectorySource(dir.resolve("missing"));

        List<IngestionReport> reports = orchestrator.ingestAll(List.of(missing, source));

        assertThat(reports).hasSize(2);
        assertThat(reports.get(0).aborted()).isTrue();
        assertThat(reports.get(0).errorMessage()).contains("does not exist");
        assertThat(reports.get(1).aborted()).isFalse();
        assertThat(reports.get(1).added()).isEqualTo(1);
    }

    @Test
    void failureOnMiddleChunkOfModifiedFileKeepsPreviousVersionForRetry() throws IOException {
        writeLog("a.json", 25, "2024-05-01T10:00:00Z");
        orchestrator.ingest(source);

        String revised = IntStream.range(0, 25)
                .mapToObj(i -> String.format("{\"level\":\"warn\",\"msg\":\"revised %02d\"}", i))
                .collect(Collectors.joining(",", "[", "]"));
        Files.writeString(dir.resolve("a.json"), revised);
        Files.setLastModifiedTime(dir.resolve("a.json"), FileTime.from(Instant.parse("2024-05-01T11:00:00Z")));
        // Second chunk holds entries 10 to 19
        embeddingModel.failWhen(text -> text.contains("revised 12"));

        IngestionReport report = orchestrator.ingest(source);

        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.updated()).isZero();
        assertThat(ledger.find("a.json", source.identify())).map(SourceDocument::version)
                .contains("2024-05-01T10:00:00Z");
        assertThat(ledger.recordKeys("a.json", source.identify())).containsExactlyInAnyOrder("a_1", "a_2", "a_3");
        assertThat(searchService.searchByDocumentId(FakeEmbeddingModel.vectorFor("x"), "a.json", 10))
                .hasSize(3)
                .allSatisfy(hit -> assertThat(hit.getContent()).contains("a.json event"));
        assertThat(source.diff(ledger.viewOf(source.identify())))
                .extracting(SourceDocument::id)
                .containsExactly("a.json");
    }

    @Test
    void uncheckedFailureInOneDocumentSkipsOnlyThatDocument() throws IOException {
        writeLog("a.json", 3, "2024-05-01T10:00:00Z");
        writeLog("b.json", 3, "2024-05-01T10:00:00Z");
        ContentSource crashing = new CrashingSource(source, "a.json");
        JsonLogDirectorySource other = new JsonLogDirectorySource(Files.createDirectory(dir.resolve("other")));
        writeLog("other/c.json", 3, "2024-05-01T10:00:00Z");

        List<IngestionReport> reports = orchestrator.ingestAll(List.of(crashing, other));

        assertThat(reports.get(0).aborted()).isFalse();
        assertThat(reports.get(0).failed()).isEqualTo(1);
        assertThat(reports.get(0).added()).isEqualTo(1);
        assertThat(ledger.find("a.json", source.identify())).isEmpty();
        assertThat(indexedKeys("b.json")).containsExactly("b_1");
        assertThat(reports.get(1).added()).isEqualTo(1);
        assertThat(indexedKeys("c.json")).containsExactly("c_1");
    }

    @Test
    void uncheckedFailureWhileListingAbortsOnlyThatSource() throws IOException {
        writeLog("a.json", 3, "2024-05-01T10:00:00Z");
        ContentSource broken = new CrashingSource(source, "a.json") {
            @Override
            public List<SourceDocument> diff(LedgerView existing) {
                throw new IllegalStateException("listing crashed");
            }

            @Override
            public String identify() {
                return "broken";
            }
        };

        List<IngestionReport> reports = orchestrator.ingestAll(List.of(broken, source));

        assertThat(reports.get(0).aborted()).isTrue();
        assertThat(reports.get(0).errorMessage()).contains("listing crashed");
        assertThat(reports.get(1).added()).isEqualTo(1);
    }

    private void writeLog(String name, int entries, String modifiedAt) throws IOException {
        String json = IntStream.range(0, entries)
                .mapToObj(i -> String.format("{\"level\":\"info\",\"msg\":\"%s event %02d\"}", name, i))
                .collect(Collectors.joining(",", "[", "]"));
        Path file = Files.writeString(dir.resolve(name), json);
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse(modifiedAt)));
    }

    private List<String> indexedKeys(String documentId) throws IOException {
        return searchService.searchByDocumentId(FakeEmbeddingModel.vectorFor(documentId), documentId, 100)
                .stream()
                .map(SearchResult::getChunkKey)
                .toList();
    }

    /**
     * Delegates to a real source but fails one document with an unchecked exception.
     */
    private static class CrashingSource implements ContentSource {
        private final ContentSource delegate;
        private final String crashingId;

        CrashingSource(ContentSource delegate, String crashingId) {
            this.delegate = delegate;
            this.crashingId = crashingId;
        }

        @Override
        public String identify() {
            return delegate.identify();
        }

        @Override
        public List<SourceDocument> diff(LedgerView existing) throws IOException {
            return delegate.diff(existing);
        }

        @Override
        public List<SourceDocument> findDeleted(LedgerView existing) throws IOException {
            return delegate.findDeleted(existing);
        }

        @Override
        public List<IndexChunk> materialize(EmbeddingGateway embeddingGateway, String documentId) throws IOException {
            if (documentId.equals(crashingId)) {
                throw new IllegalStateException("stripper crashed on " + documentId);
            }
            return delegate.materialize(embeddingGateway, documentId);
        }
    }
}
