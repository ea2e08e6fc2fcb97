package com.production.log_rag_service.loki;

import com.production.log_rag_service.config.AppConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Stand-in for a Loki server during development. Output depends only on the
 * seed and the clock, so tests can pin both.
 */
@Service
@Slf4j
public class SampleLogDataService {

    private static final String[] ACTIONS = {
            "User login successful",
            "Data processed successfully",
            "API request completed",
            "Database query executed",
            "Cache refreshed",
            "Configuration loaded",
            "File uploaded",
            "Email notification sent",
            "Background task completed",
            "Health check passed"
    };

    private static final String[] ERRORS = {
            "Connection timeout",
            "Database query failed",
            "Validation error",
            "Authentication failed",
            "Permission denied",
            "Resource not found",
            "Out of memory",
            "Unexpected exception"
    };

    private static final String[] USERS = {"user123", "admin", "service_account", "guest_user", "john.doe"};
    private static final String[] COMPONENTS = {"AuthService", "DataProcessor", "ApiController", "DatabaseManager", "CacheService"};

    private static final List<String> LABELS = List.of(
            "app", "env", "level", "host", "namespace", "pod", "container", "job", "service", "region");

    private static final Map<String, List<String>> LABEL_VALUES = Map.of(
            "app", List.of("anomaly-detection", "authentication-service", "payment-processor", "api-gateway", "frontend"),
            "env", List.of("production", "staging", "development", "testing", "demo"),
            "level", List.of("debug", "info", "warning", "error", "critical"),
            "host", List.of("server-01", "server-02", "server-03", "worker-01", "worker-02"),
            "namespace", List.of("default", "kube-system", "monitoring", "logging", "application"),
            "service", List.of("api", "auth", "database", "cache", "worker", "scheduler"));

    private final Random random;
    private final Clock clock;

    @Autowired
    public SampleLogDataService(AppConfig appConfig) {
        this(appConfig.getLoki().getSampleSeed(), Clock.systemUTC());
    }

    public SampleLogDataService(long seed, Clock clock) {
        this.random = new Random(seed);
        this.clock = clock;
    }

    public synchronized LokiQueryResponse generateSampleLogs(int count, boolean includeErrors) {
        Instant timestamp = clock.instant().minus(Duration.ofHours(1));
        List<LogEntry> values = new ArrayList<>(count);

        for (int i = 0; i < count; i++) {
            timestamp = timestamp.plusSeconds(1 + random.nextInt(5));
            // 20% errors
            if (includeErrors && random.nextInt(10) < 2) {
                values.add(errorEntry(timestamp));
            } else {
                values.add(normalEntry(timestamp));
            }
        }

        Map<String, String> stream = new LinkedHashMap<>();
        stream.put("app", "anomaly-detection");
        stream.put("env", "demo");
        stream.put("level", "info");

        log.debug("Generated {} sample log entries", values.size());
        return LokiQueryResponse.builder()
                .status("success")
                .data(LokiQueryResponse.QueryData.builder()
                        .resultType("streams")
                        .result(new ArrayList<>(List.of(LokiQueryResponse.StreamResult.builder()
                                .stream(stream)
                                .values(values)
                                .build())))
                        .build())
                .build();
    }

    /**
     * Sample logs with bursts of failed logins, memory spikes and database timeouts mixed in.
     */
    public synchronized LokiQueryResponse generateAnomalousLogs(int count) {
        LokiQueryResponse response = generateSampleLogs(count, true);
        List<LogEntry> values = response.getData().getResult().get(0).getValues();

        Instant timestamp = clock.instant().minus(Duration.ofHours(1));
        for (int i = 0; i < 5; i++) {
            timestamp = timestamp.plus(Duration.ofMinutes(1 + random.nextInt(9)));
            values.add(new LogEntry(toNanos(timestamp), String.format(
                    "WARNING: Failed login attempt from IP %d.%d.%d.%d for user admin",
                    1 + random.nextInt(254), 1 + random.nextInt(254), 1 + random.nextInt(254), 1 + random.nextInt(254))));
        }
        for (int i = 0; i < 3; i++) {
            timestamp = timestamp.plus(Duration.ofMinutes(1 + random.nextInt(4)));
            values.add(new LogEntry(toNanos(timestamp),
                    "WARNING: Memory usage spike detected: " + (85 + random.nextInt(14)) + "% used"));
        }
        for (int i = 0; i < 4; i++) {
            timestamp = timestamp.plusSeconds(30 + random.nextInt(60));
            values.add(new LogEntry(toNanos(timestamp), "ERROR: Database query timeout after " + (28 + random.nextInt(7))
                    + "s for query 'SELECT * FROM large_table WHERE complex_condition'"));
        }

        values.sort(Comparator.comparing(entry -> Long.parseLong(entry.getTimestamp())));
        return response;
    }

    public LokiLabelsResponse generateSampleLabels() {
        return new LokiLabelsResponse("success", new ArrayList<>(LABELS));
    }

    public LokiLabelsResponse generateSampleLabelValues(String labelName) {
        List<String> values = LABEL_VALUES.getOrDefault(labelName, List.of("value1", "value2", "value3"));
        return new LokiLabelsResponse("success", new ArrayList<>(values));
    }

    private LogEntry normalEntry(Instant timestamp) {
        String component = pick(COMPONENTS);
        String action = pick(ACTIONS);
        String user = pick(USERS);
        int duration = 5 + random.nextInt(1495);
        return new LogEntry(toNanos(timestamp),
                String.format("%s - %s for %s in %dms", component, action, user, duration));
    }

    private LogEntry errorEntry(Instant timestamp) {
        String error = pick(ERRORS);
        String component = pick(COMPONENTS);
        int errorCode = 400 + random.nextInt(200);

        String line = String.format("ERROR in %s: %s (Code: %d)", component, error, errorCode);
        // One in three errors carries a stack trace
        if (random.nextInt(3) == 0) {
            line += String.format("\nStack trace:\n  at %s.ProcessRequest() in %s.java:line %d\n  at RequestHandler.Execute() in RequestHandler.java:line %d",
                    component, component, 50 + random.nextInt(450), 20 + random.nextInt(280));
        }
        return new LogEntry(toNanos(timestamp), line);
    }

    private String pick(String[] options) {
        return options[random.nextInt(options.length)];
    }

    private static String toNanos(Instant timestamp) {
        return Long.toString(timestamp.toEpochMilli() * 1_000_000L);
    }
}
