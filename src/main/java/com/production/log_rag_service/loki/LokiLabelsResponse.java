package com.production.log_rag_service.loki;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of {@code /loki/api/v1/labels} and {@code /loki/api/v1/label/{name}/values}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LokiLabelsResponse {
    private String status;
    private List<String> data = new ArrayList<>();
}
