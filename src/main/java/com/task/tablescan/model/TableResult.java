package com.task.tablescan.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TableResult(
        @JsonProperty("success")
        boolean success,

        @JsonProperty("error")
        String error,

        @JsonProperty("error_kind")
        ExtractionErrorKind errorKind,

        @JsonProperty("rows_extracted")
        int rowsExtracted,

        @JsonProperty("columns_detected")
        int columnsDetected,

        @JsonProperty("table")
        Table table,

        @JsonProperty("preview")
        String preview,

        @JsonProperty("confidence")
        double confidence,

        // seconds
        @JsonProperty("elapsed_time")
        double elapsedTime,

        @JsonProperty("backend_name")
        String backendName
) {

    public static TableResult success(Table table, String preview, double confidence, double elapsedTime, String backendName) {
        return new TableResult(true, null, null, table.dataRowCount(), table.width(), table, preview,
                confidence, elapsedTime, backendName);
    }

    public static TableResult failure(ExtractionErrorKind kind, String error, double elapsedTime, String backendName) {
        return new TableResult(false, error, kind, 0, 0, null, null, 0.0, elapsedTime, backendName);
    }
}
