package com.production.log_rag_service.loki;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A {@code [timestamp, line]} pair as Loki returns it. The timestamp is a
 * decimal string of Unix nanoseconds. Trailing structured metadata is ignored.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"timestamp", "logLine"})
@JsonIgnoreProperties(ignoreUnknown = true)
public class LogEntry {
    private String timestamp;
    private String logLine;
}
