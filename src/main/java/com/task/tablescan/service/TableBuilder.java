package com.task.tablescan.service;

import com.task.tablescan.locator.LocatorChain;
import com.task.tablescan.model.ExtractionErrorKind;
import com.task.tablescan.model.Grid;
import com.task.tablescan.model.LocatedTokens;
import com.task.tablescan.model.Row;
import com.task.tablescan.model.Table;
import com.task.tablescan.model.TableResult;
import com.task.tablescan.model.Token;
import com.task.tablescan.reconstruct.ColumnClusterer;
import com.task.tablescan.reconstruct.GridAligner;
import com.task.tablescan.reconstruct.RowClusterer;
import com.task.tablescan.reconstruct.TableNormalizer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs OCR and table reconstruction for one image and reports the outcome as a
 * {@link TableResult}. Failures are returned in the result, never thrown.
 */
@Service
public class TableBuilder {

    static final String NO_TEXT_DETECTED = "No text detected";
    static final String NO_TABLE_STRUCTURE = "Could not detect table structure";

    private static final Logger log = LoggerFactory.getLogger(TableBuilder.class);

    private final LocatorChain locators;
    private final RowClusterer rowClusterer;
    private final ColumnClusterer columnClusterer;
    private final GridAligner gridAligner;
    private final TableNormalizer normalizer;
    private final Tracer tracer;
    private final int previewRows;

    public TableBuilder(
            LocatorChain locators,
            RowClusterer rowClusterer,
            ColumnClusterer columnClusterer,
            GridAligner gridAligner,
            TableNormalizer normalizer,
            Tracer tracer,
            @Value("${table.preview.rows:5}") int previewRows
    ) {
        this.locators = locators;
        this.rowClusterer = rowClusterer;
        this.columnClusterer = columnClusterer;
        this.gridAligner = gridAligner;
        this.normalizer = normalizer;
        this.tracer = tracer;
        this.previewRows = previewRows;
    }

    public List<String> backendNames() {
        return locators.backendNames();
    }

    public TableResult extract(Path image) {
        long t0 = System.nanoTime();

        Span root = tracer.spanBuilder("table.extract")
                .setAttribute("image.name", String.valueOf(image.getFileName()))
                .startSpan();

        String backend = locators.primaryBackend();
        try {
            Span ocrSpan = tracer.spanBuilder("ocr.locate").startSpan();
            LocatedTokens located;
            try {
                located = locators.locate(image);
            } finally {
                ocrSpan.end();
            }
            backend = located.backendName();
            root.setAttribute("ocr.backend", backend);
            root.setAttribute("ocr.tokens", located.tokens().size());

            TableResult result = reconstruct(located.tokens(), backend, t0);
            root.setAttribute("table.success", result.success());
            return result;
        } catch (Exception e) {
            root.setAttribute("error", true);
            root.setAttribute("error.message", String.valueOf(e.getMessage()));
            log.error("Table extraction failed for {}", image, e);
            return TableResult.failure(ExtractionErrorKind.RECONSTRUCTION_FAILURE, String.valueOf(e.getMessage()),
                    elapsedSeconds(t0), backend);
        } finally {
            root.end();
        }
    }

    public TableResult reconstruct(List<Token> tokens, String backendName) {
        return reconstruct(tokens, backendName, System.nanoTime());
    }

    private TableResult reconstruct(List<Token> tokens, String backendName, long t0) {
        if (tokens == null || tokens.isEmpty()) {
            log.info("No tokens from {}", backendName);
            return TableResult.failure(ExtractionErrorKind.NO_TOKENS_PRODUCED, NO_TEXT_DETECTED,
                    elapsedSeconds(t0), backendName);
        }

        Span span = tracer.spanBuilder("table.reconstruct").startSpan();
        try {
            List<Row> rows = rowClusterer.cluster(tokens);
            List<Double> anchors = columnClusterer.anchors(tokens);
            Grid grid = gridAligner.align(rows, anchors);
            span.setAttribute("table.rows", rows.size());
            span.setAttribute("table.anchors", anchors.size());

            if (grid.isEmpty()) {
                return TableResult.failure(ExtractionErrorKind.NO_TABLE_STRUCTURE_DETECTED, NO_TABLE_STRUCTURE,
                        elapsedSeconds(t0), backendName);
            }

            Table table = normalizer.normalize(grid);
            double confidence = round(meanConfidence(tokens), 4);

            log.info("Reconstructed {}x{} table from {} tokens ({})",
                    table.dataRowCount(), table.width(), tokens.size(), backendName);
            return TableResult.success(table, table.preview(previewRows), confidence, elapsedSeconds(t0), backendName);
        } catch (Exception e) {
            span.setAttribute("error", true);
            span.setAttribute("error.message", String.valueOf(e.getMessage()));
            log.error("Table reconstruction failed for {} tokens from {}", tokens.size(), backendName, e);
            return TableResult.failure(ExtractionErrorKind.RECONSTRUCTION_FAILURE, String.valueOf(e.getMessage()),
                    elapsedSeconds(t0), backendName);
        } finally {
            span.end();
        }
    }

    private static double meanConfidence(List<Token> tokens) {
        double sum = 0;
        for (Token token : tokens) {
            sum += token.confidence();
        }
        return sum / tokens.size();
    }

    private static double elapsedSeconds(long t0) {
        return round((System.nanoTime() - t0) / 1_000_000_000.0, 2);
    }

    static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
