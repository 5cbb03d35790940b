package com.task.tablescan.controller;

import com.task.tablescan.export.TableExcelExporter;
import com.task.tablescan.model.ReconstructRequest;
import com.task.tablescan.model.TableResult;
import com.task.tablescan.service.TableBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@RestController
@RequestMapping("/v1/tables")
@CrossOrigin(origins = "*")
public class TableController {

    static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private static final Logger log = LoggerFactory.getLogger(TableController.class);

    private final TableBuilder tableBuilder;
    private final TableExcelExporter exporter;

    public TableController(TableBuilder tableBuilder, TableExcelExporter exporter) {
        this.tableBuilder = tableBuilder;
        this.exporter = exporter;
    }

    @PostMapping(value = "/extract", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> extract(@RequestParam("file") MultipartFile file) {
        try {
            return ResponseEntity.ok(extractUpload(file));
        } catch (IOException e) {
            log.error("Could not store upload {}", file.getOriginalFilename(), e);
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "error", "Could not read upload: " + e.getMessage()
            ));
        }
    }

    @PostMapping(value = "/reconstruct", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> reconstruct(@RequestBody ReconstructRequest request) {
        try {
            String backend = request.backendName() == null ? "CLIENT" : request.backendName();
            return ResponseEntity.ok(tableBuilder.reconstruct(request.toTokens(), backend));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "error", e.getMessage()
            ));
        }
    }

    @PostMapping(value = "/export", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> export(@RequestParam("file") MultipartFile file) {
        try {
            TableResult result = extractUpload(file);
            if (!result.success()) {
                return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            exporter.export(result.table(), out);
            return ResponseEntity.ok()
                    .contentType(XLSX)
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=table.xlsx")
                    .body(out.toByteArray());
        } catch (IOException e) {
            log.error("Export failed for {}", file.getOriginalFilename(), e);
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "error", e.getMessage()
            ));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
                "status", "healthy",
                "backends", tableBuilder.backendNames()
        ));
    }

    private TableResult extractUpload(MultipartFile file) throws IOException {
        Path tmp = Files.createTempFile("table-scan-", suffix(file.getOriginalFilename()));
        try {
            file.transferTo(tmp);
            return tableBuilder.extract(tmp);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static String suffix(String filename) {
        if (filename == null) {
            return ".img";
        }
        int dot = filename.lastIndexOf('.');
        String ext = dot >= 0 ? filename.substring(dot) : "";
        return ext.matches("\\.[A-Za-z0-9]{1,8}") ? ext : ".img";
    }
}
