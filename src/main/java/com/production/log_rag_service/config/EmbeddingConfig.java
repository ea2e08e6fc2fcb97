package com.production.log_rag_service.config;

import com.production.log_rag_service.ingestion.EmbeddingGateway;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class EmbeddingConfig {

    @Bean
    public EmbeddingModel embeddingModel(AppConfig appConfig) {
        AppConfig.Embedding embedding = appConfig.getEmbedding();
        if (embedding.getDimensions() != appConfig.getLucene().getVectorDimensions()) {
            throw new IllegalStateException("embedding.dimensions (" + embedding.getDimensions()
                    + ") must equal lucene.vector-dimensions (" + appConfig.getLucene().getVectorDimensions() + ")");
        }
        log.info("Initialized embedding model {} at {} ({} dimensions)",
                embedding.getModelName(), embedding.getBaseUrl(), embedding.getDimensions());
        return OpenAiEmbeddingModel.builder()
                .baseUrl(embedding.getBaseUrl())
                .apiKey(embedding.getApiKey())
                .modelName(embedding.getModelName())
                .dimensions(embedding.getDimensions())
                .timeout(embedding.getTimeout())
                .maxRetries(embedding.getMaxRetries())
                .build();
    }

    @Bean(destroyMethod = "close")
    public EmbeddingGateway embeddingGateway(EmbeddingModel embeddingModel, IngestionConfig ingestionConfig) {
        return new EmbeddingGateway(embeddingModel, ingestionConfig.resolveThreadCount());
    }
}
