package com.task.tablescan.export;

import com.task.tablescan.model.Table;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link Table} to a single-sheet .xlsx workbook. Column widths follow
 * the longest rendered value plus two characters, capped.
 */
@Component
public class TableExcelExporter {

    private static final Logger log = LoggerFactory.getLogger(TableExcelExporter.class);

    private final String sheetName;
    private final int maxColumnWidth;

    public TableExcelExporter(
            @Value("${table.export.sheet-name:Laporan}") String sheetName,
            @Value("${table.export.max-column-width:50}") int maxColumnWidth
    ) {
        this.sheetName = sheetName;
        this.maxColumnWidth = maxColumnWidth;
    }

    public void export(Table table, Path output) throws IOException {
        try (OutputStream out = Files.newOutputStream(output)) {
            export(table, out);
        }
        log.info("Table written to {}", output);
    }

    public void export(Table table, OutputStream out) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(sheetName);

            CellStyle headerStyle = workbook.createCellStyle();
            Font bold = workbook.createFont();
            bold.setBold(true);
            headerStyle.setFont(bold);

            Row header = sheet.createRow(0);
            for (int c = 0; c < table.width(); c++) {
                Cell cell = header.createCell(c);
                cell.setCellValue(table.columnLabel(c));
                cell.setCellStyle(headerStyle);
            }

            for (int r = 0; r < table.dataRowCount(); r++) {
                Row row = sheet.createRow(r + 1);
                for (int c = 0; c < table.width(); c++) {
                    Object value = table.cell(r, c);
                    if (value == null) {
                        continue;
                    }
                    Cell cell = row.createCell(c);
                    if (value instanceof Number number) {
                        cell.setCellValue(number.doubleValue());
                    } else {
                        cell.setCellValue(value.toString());
                    }
                }
            }

            for (int c = 0; c < table.width(); c++) {
                sheet.setColumnWidth(c, columnWidth(table, c) * 256);
            }

            workbook.write(out);
        }
    }

    /**
     * Width in characters for column {@code c}.
     */
    int columnWidth(Table table, int c) {
        int longest = table.columnLabel(c).length();
        for (int r = 0; r < table.dataRowCount(); r++) {
            longest = Math.max(longest, Table.render(table.cell(r, c)).length());
        }
        return Math.min(longest + 2, maxColumnWidth);
    }
}
