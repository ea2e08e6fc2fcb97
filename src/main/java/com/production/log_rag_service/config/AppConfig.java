package com.production.log_rag_service.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "")
@Validated
@Getter
@Setter
public class AppConfig {

    @Valid
    private Lucene lucene = new Lucene();
    @Valid
    private Chunking chunking = new Chunking();
    @Valid
    private Embedding embedding = new Embedding();
    @Valid
    private Loki loki = new Loki();

    @Getter
    @Setter
    public static class Lucene {
        @NotBlank
        private String indexPath = "./lucene-index";
        // Lucene rejects kNN vectors longer than 1024
        @Min(1)
        @Max(1024)
        private int vectorDimensions = 1024;
        @Min(1)
        private int batchCommitSize = 100;
    }

    @Getter
    @Setter
    public static class Chunking {
        @Min(1)
        private int chunkSizeTokens = 400;
        @Min(0)
        private int chunkOverlapTokens = 50;
        @Min(1)
        private int minChunkLengthTokens = 100;
    }

    @Getter
    @Setter
    public static class Embedding {
        private String apiKey = "demo";
        @NotBlank
        private String baseUrl = "https://models.inference.ai.azure.com";
        @NotBlank
        private String modelName = "text-embedding-3-small";
        /** Requested output size; must equal lucene.vector-dimensions. */
        private int dimensions = 1024;
        private Duration timeout = Duration.ofSeconds(60);
        private int maxRetries = 3;
    }

    @Getter
    @Setter
    public static class Loki {
        @NotBlank
        private String endpoint = "http://localhost:3100";
        private String username;
        private String password;
        @NotBlank
        private String query = "{app=~\".+\"}";
        private Duration lookback = Duration.ofHours(24);
        @Min(1)
        private int limit = 5000;
        private boolean useSampleData = false;
        private long sampleSeed = 42L;
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 30;
        private int maxRetries = 3;
    }
}
