package com.production.log_rag_service.lucene;

import com.production.log_rag_service.config.AppConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.FieldInfo;
import org.apache.lucene.index.FieldInfos;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Opens the on-disk chunk index. One writer serves both ingestion and search
 * (search readers are opened from it).
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private final AppConfig appConfig;
    private Directory directory;
    private IndexWriter indexWriter;

    public LuceneConfig(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @Bean
    public Directory luceneDirectory() throws IOException {
        Path indexPath = Paths.get(appConfig.getLucene().getIndexPath()).toAbsolutePath();
        Files.createDirectories(indexPath);
        this.directory = FSDirectory.open(indexPath);
        log.info("Chunk index directory: {}", indexPath);
        return directory;
    }

    @Bean
    public StandardAnalyzer standardAnalyzer() {
        return new StandardAnalyzer();
    }

    @Bean
    public IndexWriter indexWriter(Directory luceneDirectory, StandardAnalyzer standardAnalyzer) throws IOException {
        IndexWriterConfig config = new IndexWriterConfig(standardAnalyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND)
                .setCommitOnClose(true);

        this.indexWriter = new IndexWriter(luceneDirectory, config);
        requireVectorDimensions(indexWriter, appConfig.getLucene().getVectorDimensions());

        log.info("Opened chunk index: {} chunks, {} vector dimensions",
                indexWriter.getDocStats().numDocs, appConfig.getLucene().getVectorDimensions());
        return indexWriter;
    }

    /**
     * Fails startup when the existing index was built with vectors of another length,
     * e.g. after switching embedding models. The index must then be rebuilt.
     */
    static void requireVectorDimensions(IndexWriter writer, int expected) throws IOException {
        try (DirectoryReader reader = DirectoryReader.open(writer)) {
            FieldInfo vectorField = FieldInfos.getMergedFieldInfos(reader).fieldInfo(LuceneIndexService.FIELD_VECTOR);
            if (vectorField != null && vectorField.getVectorDimension() != expected) {
                throw new IllegalStateException(String.format(
                        "Index holds %d-dimension vectors but lucene.vector-dimensions is %d; "
                                + "delete the index directory and the ledger to re-ingest",
                        vectorField.getVectorDimension(), expected));
            }
        }
    }

    @PreDestroy
    public void cleanup() {
        try {
            if (indexWriter != null && indexWriter.isOpen()) {
                indexWriter.close();
            }
            if (directory != null) {
                directory.close();
            }
            log.info("Chunk index closed");
        } catch (IOException e) {
            log.error("Error closing chunk index", e);
        }
    }
}
