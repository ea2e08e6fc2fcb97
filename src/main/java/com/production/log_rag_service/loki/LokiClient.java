package com.production.log_rag_service.loki;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.production.log_rag_service.config.AppConfig;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Client for the Grafana Loki HTTP API.
 *
 * Uses JDK built-in HttpClient with exponential backoff retry for 503/429
 * responses. When sample data is enabled no request leaves the process.
 */
@Service
@Slf4j
public class LokiClient {

    private static final String QUERY_RANGE_PATH = "/loki/api/v1/query_range";
    private static final String LABELS_PATH = "/loki/api/v1/labels";

    private final AppConfig appConfig;
    private final SampleLogDataService sampleLogDataService;
    private final ObjectMapper objectMapper;
    private HttpClient httpClient;
    private String authorizationHeader;

    public LokiClient(AppConfig appConfig, SampleLogDataService sampleLogDataService) {
        this.appConfig = appConfig;
        this.sampleLogDataService = sampleLogDataService;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @PostConstruct
    public void init() {
        var lokiConfig = appConfig.getLoki();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(lokiConfig.getConnectTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        if (lokiConfig.getUsername() != null && !lokiConfig.getUsername().isEmpty()
                && lokiConfig.getPassword() != null && !lokiConfig.getPassword().isEmpty()) {
            String credentials = lokiConfig.getUsername() + ":" + lokiConfig.getPassword();
            this.authorizationHeader = "Basic " + Base64.getEncoder()
                    .encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        }

        if (lokiConfig.isUseSampleData()) {
            log.info("LokiClient using generated sample data (seed {})", lokiConfig.getSampleSeed());
        } else {
            log.info("LokiClient initialized - endpoint={}, connectTimeout={}s, readTimeout={}s, maxRetries={}, auth={}",
                    lokiConfig.getEndpoint(),
                    lokiConfig.getConnectTimeoutSeconds(),
                    lokiConfig.getReadTimeoutSeconds(),
                    lokiConfig.getMaxRetries(),
                    authorizationHeader != null ? "basic" : "none");
        }
    }

    /**
     * Runs a LogQL stream query over [start, end], both in Unix seconds.
     */
    public LokiQueryResponse queryRange(String query, long start, long end, int limit, String direction)
            throws IOException, InterruptedException {
        if (appConfig.getLoki().isUseSampleData()) {
            String lowered = query.toLowerCase(Locale.ROOT);
            if (lowered.contains("anomaly") || lowered.contains("error")) {
                return sampleLogDataService.generateAnomalousLogs(limit);
            }
            return sampleLogDataService.generateSampleLogs(Math.min(limit, 50), true);
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", query);
        params.put("start", Long.toString(start));
        params.put("end", Long.toString(end));
        params.put("limit", Integer.toString(limit));
        params.put("direction", direction);

        String body = executeWithRetry(endpoint(QUERY_RANGE_PATH) + "?" + encode(params));
        LokiQueryResponse response = objectMapper.readValue(body, LokiQueryResponse.class);
        if (response == null) {
            throw new IOException("Empty Loki query response");
        }
        log.debug("Loki query '{}' [{}, {}] returned {} streams", query, start, end,
                response.getData() == null || response.getData().getResult() == null
                        ? 0 : response.getData().getResult().size());
        return response;
    }

    public LokiLabelsResponse labels() throws IOException, InterruptedException {
        if (appConfig.getLoki().isUseSampleData()) {
            return sampleLogDataService.generateSampleLabels();
        }
        return objectMapper.readValue(executeWithRetry(endpoint(LABELS_PATH)), LokiLabelsResponse.class);
    }

    public LokiLabelsResponse labelValues(String labelName) throws IOException, InterruptedException {
        if (appConfig.getLoki().isUseSampleData()) {
            return sampleLogDataService.generateSampleLabelValues(labelName);
        }
        String path = "/loki/api/v1/label/" + URLEncoder.encode(labelName, StandardCharsets.UTF_8) + "/values";
        return objectMapper.readValue(executeWithRetry(endpoint(path)), LokiLabelsResponse.class);
    }

    private String endpoint(String path) {
        String base = appConfig.getLoki().getEndpoint();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private static String encode(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    /**
     * Execute an HTTP GET with exponential backoff retry on 503/429.
     */
    private String executeWithRetry(String url) throws IOException, InterruptedException {
        var lokiConfig = appConfig.getLoki();
        int maxRetries = lokiConfig.getMaxRetries();
        IOException lastException = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                long backoffMs = (long) Math.pow(2, attempt) * 500;
                log.warn("Loki retry {}/{} - waiting {}ms", attempt, maxRetries, backoffMs);
                Thread.sleep(backoffMs);
            }

            HttpRequest.Builder request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(lokiConfig.getReadTimeoutSeconds()))
                    .header("Accept", "application/json")
                    .GET();
            if (authorizationHeader != null) {
                request.header("Authorization", authorizationHeader);
            }

            HttpResponse<String> response;
            try {
                response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                log.warn("Loki request failed: {}", e.getMessage());
                lastException = e;
                continue;
            }

            if (response.statusCode() == 200) {
                return response.body();
            } else if (response.statusCode() == 429 || response.statusCode() == 503) {
                log.warn("Loki returned {} - will retry", response.statusCode());
                lastException = new IOException("HTTP " + response.statusCode());
            } else {
                throw new IOException("Loki returned HTTP " + response.statusCode() + ": " + response.body());
            }
        }

        throw lastException != null ? lastException : new IOException("Failed after " + maxRetries + " retries");
    }
}
