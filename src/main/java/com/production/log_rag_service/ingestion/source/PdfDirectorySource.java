package com.production.log_rag_service.ingestion.source;

import com.production.log_rag_service.ingestion.ContentSource;
import com.production.log_rag_service.ingestion.EmbeddingGateway;
import com.production.log_rag_service.ingestion.LedgerView;
import com.production.log_rag_service.ingestion.MalformedContentException;
import com.production.log_rag_service.ingestion.SourceDocument;
import com.production.log_rag_service.model.IndexChunk;
import com.production.log_rag_service.model.PageContent;
import com.production.log_rag_service.service.ChunkingService;
import com.production.log_rag_service.service.TextCleaningService;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF files in a directory: page text is extracted, cleaned and split into
 * token windows attributed to the page they mostly cover.
 */
@Slf4j
public class PdfDirectorySource implements ContentSource {

    private final DirectoryScanner scanner;
    private final TextCleaningService textCleaningService;
    private final ChunkingService chunkingService;
    private final String sourceId;

    public PdfDirectorySource(Path directory,
                              TextCleaningService textCleaningService,
                              ChunkingService chunkingService) {
        this.scanner = new DirectoryScanner(directory, ".pdf");
        this.textCleaningService = textCleaningService;
        this.chunkingService = chunkingService;
        this.sourceId = "PdfDirectorySource:" + scanner.directory();
    }

    @Override
    public String identify() {
        return sourceId;
    }

    @Override
    public List<SourceDocument> diff(LedgerView existing) throws IOException {
        return scanner.diff(sourceId, existing);
    }

    @Override
    public List<SourceDocument> findDeleted(LedgerView existing) throws IOException {
        return scanner.findDeleted(existing);
    }

    @Override
    public List<IndexChunk> materialize(EmbeddingGateway embeddingGateway, String documentId) throws IOException {
        long extractStart = System.currentTimeMillis();
        List<PageContent> pages = extractPages(scanner.resolve(documentId), documentId);
        long extractMs = System.currentTimeMillis() - extractStart;

        List<String> cleanedTexts = new ArrayList<>(pages.size());
        for (PageContent page : pages) {
            page.setCleanedText(textCleaningService.fullClean(page.getRawText()));
            cleanedTexts.add(page.getCleanedText());
        }

        List<IndexChunk> chunks = chunkingService.chunkDocument(
                cleanedTexts, DirectoryScanner.baseName(documentId), documentId);

        long embedStart = System.currentTimeMillis();
        List<float[]> vectors = embeddingGateway.embedAll(chunks.stream().map(IndexChunk::getText).toList());
        for (int i = 0; i < chunks.size(); i++) {
            chunks.get(i).setVector(vectors.get(i));
        }
        long embedMs = System.currentTimeMillis() - embedStart;

        log.info("[TIMING] {} - extract: {}ms ({} pages), embed: {}ms ({} chunks)",
                documentId, extractMs, pages.size(), embedMs, chunks.size());
        return chunks;
    }

    private List<PageContent> extractPages(Path file, String documentId) throws IOException {
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString());
        }

        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            int totalPages = document.getNumberOfPages();
            List<PageContent> pages = new ArrayList<>(totalPages);

            for (int pageNum = 1; pageNum <= totalPages; pageNum++) {
                stripper.setStartPage(pageNum);
                stripper.setEndPage(pageNum);
                String rawText = stripper.getText(document);

                pages.add(PageContent.builder()
                        .pageNumber(pageNum)
                        .rawText(rawText)
                        .build());

                log.debug("Extracted page {}/{} of {}: {} characters", pageNum, totalPages, documentId, rawText.length());
            }
            return pages;
        } catch (IOException e) {
            // PDFBox reports unparseable or encrypted files as IOException
            throw new MalformedContentException("Cannot read PDF " + documentId + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // Corrupt content streams can fail inside the text stripper
            throw new MalformedContentException("Cannot extract text from PDF " + documentId + ": " + e, e);
        }
    }
}
