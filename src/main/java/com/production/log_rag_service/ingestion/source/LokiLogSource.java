package com.production.log_rag_service.ingestion.source;

import com.production.log_rag_service.ingestion.ContentSource;
import com.production.log_rag_service.ingestion.EmbeddingGateway;
import com.production.log_rag_service.ingestion.LedgerView;
import com.production.log_rag_service.ingestion.MalformedContentException;
import com.production.log_rag_service.ingestion.SourceDocument;
import com.production.log_rag_service.ingestion.SourceUnavailableException;
import com.production.log_rag_service.loki.LogEntry;
import com.production.log_rag_service.loki.LokiClient;
import com.production.log_rag_service.loki.LokiQueryResponse;
import com.production.log_rag_service.model.IndexChunk;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Log streams pulled from Loki for a sliding time window.
 *
 * <p>Every label stream is cut into UTC hour buckets; one bucket is one document
 * with id {@code yyyyMMdd_HH_<k1>-<v1>_<k2>-<v2>...} (labels in ascending key
 * order). Its version is the Base64 SHA-256 of the bucket's rendered lines, so
 * a bucket is re-indexed exactly when lines were added or changed. Loki gives
 * no signal for removed logs, so nothing is ever reported deleted.
 */
@Slf4j
public class LokiLogSource implements ContentSource {

    static final int LINES_PER_CHUNK = 10;

    private static final DateTimeFormatter BUCKET_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HH").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter LINE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);
    private static final Comparator<TimedLine> LINE_ORDER =
            Comparator.comparing(TimedLine::timestamp).thenComparing(TimedLine::line);

    private final LokiClient lokiClient;
    private final String query;
    private final Duration lookback;
    private final int limit;
    private final Clock clock;
    private final String sourceId;

    // Buckets returned by the latest diff, so materialize embeds exactly what was hashed
    private final Map<String, LogBucket> pending = new ConcurrentHashMap<>();

    public LokiLogSource(LokiClient lokiClient, String query, Duration lookback, int limit, Clock clock) {
        this.lokiClient = lokiClient;
        this.query = query;
        this.lookback = lookback;
        this.limit = limit;
        this.clock = clock;
        this.sourceId = "LokiLogSource:" + query;
    }

    @Override
    public String identify() {
        return sourceId;
    }

    @Override
    public List<SourceDocument> diff(LedgerView existing) throws IOException {
        Instant end = clock.instant();
        // Start on an hour boundary so the oldest bucket is complete and hashes stably
        Instant start = end.minus(lookback).truncatedTo(ChronoUnit.HOURS);

        List<LogBucket> buckets = fetchBuckets(start, end);
        pending.clear();

        List<SourceDocument> results = new ArrayList<>();
        for (LogBucket bucket : buckets) {
            if (existing.isNewOrModified(bucket.documentId(), bucket.version())) {
                results.add(new SourceDocument(bucket.documentId(), sourceId, bucket.version()));
                pending.put(bucket.documentId(), bucket);
            }
        }

        log.info("Loki window {} .. {}: {} hour buckets, {} new or modified", start, end, buckets.size(), results.size());
        return results;
    }

    @Override
    public List<SourceDocument> findDeleted(LedgerView existing) {
        return List.of();
    }

    @Override
    public List<IndexChunk> materialize(EmbeddingGateway embeddingGateway, String documentId) throws IOException {
        LogBucket bucket = pending.remove(documentId);
        if (bucket == null) {
            bucket = refetch(documentId);
        }

        List<IndexChunk> chunks = chunk(bucket);
        List<float[]> vectors = embeddingGateway.embedAll(chunks.stream().map(IndexChunk::getText).toList());
        for (int i = 0; i < chunks.size(); i++) {
            chunks.get(i).setVector(vectors.get(i));
        }
        log.debug("Materialized {} ({} lines) into {} chunks", documentId, bucket.lines().size(), chunks.size());
        return chunks;
    }

    static List<IndexChunk> chunk(LogBucket bucket) {
        List<IndexChunk> chunks = new ArrayList<>();
        List<String> lines = bucket.lines();
        for (int start = 0, index = 0; start < lines.size(); start += LINES_PER_CHUNK, index++) {
            List<String> slice = lines.subList(start, Math.min(start + LINES_PER_CHUNK, lines.size()));
            chunks.add(IndexChunk.builder()
                    .key(bucket.documentId() + "_chunk_" + index)
                    .documentId(bucket.documentId())
                    .sourceFileName(bucket.documentId())
                    .pageNumber(index + 1)
                    .text(String.join("\n", slice))
                    .build());
        }
        return chunks;
    }

    /**
     * Groups every stream of the response into hour buckets.
     */
    static List<LogBucket> bucketize(LokiQueryResponse response) {
        if (response.getData() == null || response.getData().getResult() == null) {
            return List.of();
        }

        Map<String, BucketBuilder> builders = new LinkedHashMap<>();
        for (LokiQueryResponse.StreamResult stream : response.getData().getResult()) {
            if (stream.getValues() == null) {
                continue;
            }
            SortedMap<String, String> labels = stream.getStream() == null
                    ? new TreeMap<>()
                    : new TreeMap<>(stream.getStream());
            String labelSignature = labels.entrySet().stream()
                    .map(e -> e.getKey() + "-" + e.getValue())
                    .collect(Collectors.joining("_"));

            for (LogEntry entry : stream.getValues()) {
                Instant timestamp = parseTimestamp(entry);
                if (timestamp == null) {
                    continue;
                }
                Instant hour = timestamp.truncatedTo(ChronoUnit.HOURS);
                String documentId = BUCKET_FORMAT.format(hour) + "_" + labelSignature;
                builders.computeIfAbsent(documentId, id -> new BucketBuilder(id, hour, labels))
                        .lines.add(new TimedLine(timestamp, entry.getLogLine() == null ? "" : entry.getLogLine()));
            }
        }

        return builders.values().stream()
                .map(BucketBuilder::build)
                .sorted(Comparator.comparing(LogBucket::hourStart).thenComparing(LogBucket::documentId))
                .toList();
    }

    static String hash(String content) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return Base64.getEncoder().encodeToString(sha.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Buckets of [start, end]. When Loki hit {@code limit} the oldest returned hour
     * may be cut off part way, so it is left out until it falls out of the window.
     */
    private List<LogBucket> fetchBuckets(Instant start, Instant end) throws IOException {
        LokiQueryResponse response = query(start, end);
        List<LogBucket> buckets = bucketize(response);
        if (!isTruncated(response, limit)) {
            return buckets;
        }
        return withoutOldestHour(buckets);
    }

    static boolean isTruncated(LokiQueryResponse response, int limit) {
        if (response.getData() == null || response.getData().getResult() == null) {
            return false;
        }
        long entries = response.getData().getResult().stream()
                .filter(stream -> stream.getValues() != null)
                .mapToLong(stream -> stream.getValues().size())
                .sum();
        return entries >= limit;
    }

    static List<LogBucket> withoutOldestHour(List<LogBucket> buckets) {
        if (buckets.isEmpty()) {
            return buckets;
        }
        Instant oldest = buckets.get(0).hourStart();
        List<LogBucket> complete = buckets.stream()
                .filter(bucket -> bucket.hourStart().isAfter(oldest))
                .toList();
        log.warn("Loki returned the query limit; skipping {} possibly partial buckets of hour {}. "
                + "Raise loki.limit or shorten loki.lookback", buckets.size() - complete.size(), oldest);
        return complete;
    }

    private LokiQueryResponse query(Instant start, Instant end) throws IOException {
        LokiQueryResponse response;
        try {
            response = lokiClient.queryRange(query, start.getEpochSecond(), end.getEpochSecond(), limit, "backward");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("Interrupted while querying Loki", e);
        }
        if (response == null || !response.isSuccess()) {
            throw new SourceUnavailableException("Loki query '" + query + "' failed with status "
                    + (response == null ? "none" : response.getStatus()));
        }
        return response;
    }

    /**
     * Loads a bucket that was not produced by the latest diff, e.g. after a restart.
     */
    private LogBucket refetch(String documentId) throws IOException {
        Instant hour;
        try {
            hour = LocalDateTime.parse(documentId.substring(0, 11), DateTimeFormatter.ofPattern("yyyyMMdd_HH"))
                    .toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException | StringIndexOutOfBoundsException e) {
            throw new MalformedContentException("Not a Loki bucket id: " + documentId, e);
        }

        LokiQueryResponse response = query(hour, hour.plus(Duration.ofHours(1)));
        if (isTruncated(response, limit)) {
            throw new SourceUnavailableException("Hour of " + documentId + " holds more than "
                    + limit + " Loki entries and cannot be loaded whole");
        }
        return bucketize(response).stream()
                .filter(bucket -> bucket.documentId().equals(documentId))
                .findFirst()
                .orElseThrow(() -> new SourceUnavailableException("Loki no longer returns logs for " + documentId));
    }

    private static Instant parseTimestamp(LogEntry entry) {
        try {
            long nanos = Long.parseLong(entry.getTimestamp());
            return Instant.ofEpochMilli(nanos / 1_000_000L);
        } catch (NumberFormatException e) {
            log.warn("Skipping Loki entry with malformed timestamp '{}'", entry.getTimestamp());
            return null;
        }
    }

    /**
     * One hour of one label stream, lines rendered and ordered.
     */
    record LogBucket(String documentId, Instant hourStart, SortedMap<String, String> labels,
                     List<String> lines, String version) {
    }

    private record TimedLine(Instant timestamp, String line) {
    }

    private static final class BucketBuilder {
        private final String documentId;
        private final Instant hourStart;
        private final SortedMap<String, String> labels;
        private final List<TimedLine> lines = new ArrayList<>();

        private BucketBuilder(String documentId, Instant hourStart, SortedMap<String, String> labels) {
            this.documentId = documentId;
            this.hourStart = hourStart;
            this.labels = labels;
        }

        private LogBucket build() {
            List<String> rendered = lines.stream()
                    .sorted(LINE_ORDER)
                    .map(line -> "[" + LINE_FORMAT.format(line.timestamp()) + "] " + line.line())
                    .toList();
            return new LogBucket(documentId, hourStart, labels, rendered, hash(String.join("\n", rendered)));
        }
    }
}
