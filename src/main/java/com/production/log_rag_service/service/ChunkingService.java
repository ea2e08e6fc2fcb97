package com.production.log_rag_service.service;

import com.production.log_rag_service.config.AppConfig;
import com.production.log_rag_service.model.IndexChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits page text into overlapping whitespace-token windows. Windows may cross
 * page boundaries and are attributed to the page holding their midpoint.
 * The returned chunks carry no vector yet.
 */
@Service
@Slf4j
public class ChunkingService {

    private final AppConfig appConfig;

    public ChunkingService(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    /**
     * @param pageTexts   cleaned text of each page, page 1 first
     * @param keyPrefix   prefix of every chunk key, usually the file name without extension
     * @param documentId  ledger id of the document the chunks belong to
     */
    public List<IndexChunk> chunkDocument(List<String> pageTexts, String keyPrefix, String documentId) {
        List<IndexChunk> chunks = new ArrayList<>();

        // pageEndTokenIndex[i] = number of tokens up to and including page i+1
        List<Integer> pageEndTokenIndex = new ArrayList<>();
        List<String> allTokens = new ArrayList<>();

        for (String pageText : pageTexts) {
            if (pageText != null && !pageText.isBlank()) {
                allTokens.addAll(List.of(tokenize(pageText)));
            }
            pageEndTokenIndex.add(allTokens.size());
        }

        if (allTokens.isEmpty()) {
            return chunks;
        }

        String[] tokens = allTokens.toArray(String[]::new);
        int chunkSize = appConfig.getChunking().getChunkSizeTokens();
        int overlapSize = appConfig.getChunking().getChunkOverlapTokens();
        int minChunkSize = appConfig.getChunking().getMinChunkLengthTokens();

        int start = 0;
        int chunkIndex = 0;

        while (start < tokens.length) {
            int end = Math.min(start + chunkSize, tokens.length);

            if (end < tokens.length) {
                end = findSentenceBoundary(tokens, start, end, minChunkSize);
            }

            // Short windows are only allowed at the very end
            if (end - start < minChunkSize && end < tokens.length) {
                end = Math.min(start + minChunkSize, tokens.length);
            }

            int pageNumber = findPageNumber((start + end) / 2, pageEndTokenIndex);
            chunks.add(IndexChunk.builder()
                    .key(generateChunkKey(keyPrefix, pageNumber, chunkIndex))
                    .documentId(documentId)
                    .sourceFileName(documentId)
                    .pageNumber(pageNumber)
                    .text(String.join(" ", Arrays.asList(tokens).subList(start, end)))
                    .build());

            if (end >= tokens.length) {
                break;
            }

            int nextStart = end - overlapSize;
            start = nextStart <= start ? end : nextStart;
            chunkIndex++;
        }

        log.debug("Created {} chunks from {} tokens across {} pages for {}",
                chunks.size(), tokens.length, pageTexts.size(), documentId);
        return chunks;
    }

    public int countTokens(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return tokenize(text).length;
    }

    static String generateChunkKey(String keyPrefix, int pageNumber, int chunkIndex) {
        return String.format("%s_p%d_c%d", keyPrefix, pageNumber, chunkIndex);
    }

    private int findPageNumber(int tokenIndex, List<Integer> pageEndTokenIndex) {
        for (int i = 0; i < pageEndTokenIndex.size(); i++) {
            if (tokenIndex < pageEndTokenIndex.get(i)) {
                return i + 1;
            }
        }
        return pageEndTokenIndex.size();
    }

    private static String[] tokenize(String text) {
        return text.trim().split("\\s+");
    }

    private static int findSentenceBoundary(String[] tokens, int start, int targetEnd, int minChunkSize) {
        int searchStart = Math.max(start + minChunkSize, targetEnd - 50);

        for (int i = targetEnd - 1; i >= searchStart; i--) {
            String token = tokens[i];
            if (token.endsWith(".") || token.endsWith("!") || token.endsWith("?")) {
                return i + 1;
            }
        }
        return targetEnd;
    }
}
