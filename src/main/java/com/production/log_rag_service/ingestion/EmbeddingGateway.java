package com.production.log_rag_service.ingestion;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point to the embedding model. One call per chunk, at most
 * {@code concurrency} calls in flight across the whole process.
 */
@Slf4j
public class EmbeddingGateway implements AutoCloseable {

    private final EmbeddingModel embeddingModel;
    private final int concurrency;
    private final ExecutorService embeddingPool;

    public EmbeddingGateway(EmbeddingModel embeddingModel, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        this.embeddingModel = embeddingModel;
        this.concurrency = concurrency;
        AtomicInteger threadIndex = new AtomicInteger();
        this.embeddingPool = Executors.newFixedThreadPool(concurrency, runnable -> {
            Thread thread = new Thread(runnable, "embed-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info("Initialized embedding gateway with concurrency {}", concurrency);
    }

    public float[] embed(String text) {
        Response<Embedding> response;
        try {
            response = embeddingModel.embed(text);
        } catch (RuntimeException e) {
            throw new EmbeddingException("Embedding call failed: " + e.getMessage(), e);
        }
        if (response == null || response.content() == null) {
            throw new EmbeddingException("Embedding model returned no content");
        }
        float[] vector = response.content().vector();
        if (vector == null || vector.length == 0) {
            throw new EmbeddingException("Embedding model returned an empty vector");
        }
        return vector;
    }

    /**
     * Embeds every text, returning vectors in input order. The first failure
     * cancels the remaining calls and fails the whole batch.
     */
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        if (concurrency == 1 || texts.size() == 1) {
            List<float[]> vectors = new ArrayList<>(texts.size());
            for (String text : texts) {
                vectors.add(embed(text));
            }
            return vectors;
        }

        List<Future<float[]>> futures = new ArrayList<>(texts.size());
        for (String text : texts) {
            futures.add(embeddingPool.submit(() -> embed(text)));
        }

        List<float[]> vectors = new ArrayList<>(texts.size());
        try {
            for (Future<float[]> future : futures) {
                vectors.add(future.get());
            }
            return vectors;
        } catch (ExecutionException e) {
            cancelAll(futures);
            if (e.getCause() instanceof EmbeddingException) {
                throw (EmbeddingException) e.getCause();
            }
            throw new EmbeddingException("Embedding call failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while waiting for embeddings", e);
        } catch (CancellationException e) {
            cancelAll(futures);
            throw new EmbeddingException("Embedding call cancelled", e);
        }
    }

    private void cancelAll(List<Future<float[]>> futures) {
        for (Future<float[]> future : futures) {
            future.cancel(true);
        }
    }

    @Override
    public void close() {
        embeddingPool.shutdownNow();
        log.info("Embedding gateway shut down");
    }
}
