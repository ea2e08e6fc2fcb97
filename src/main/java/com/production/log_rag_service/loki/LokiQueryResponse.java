package com.production.log_rag_service.loki;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Body of {@code /loki/api/v1/query_range} for stream (log) queries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LokiQueryResponse {

    private String status;
    private QueryData data;

    public boolean isSuccess() {
        return "success".equals(status);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QueryData {
        private String resultType;
        @Builder.Default
        private List<StreamResult> result = new ArrayList<>();
    }

    /**
     * One label set and the entries logged under it.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StreamResult {
        @Builder.Default
        private Map<String, String> stream = new LinkedHashMap<>();
        @Builder.Default
        private List<LogEntry> values = new ArrayList<>();
    }
}
