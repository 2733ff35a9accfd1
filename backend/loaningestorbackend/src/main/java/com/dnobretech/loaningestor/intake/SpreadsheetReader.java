package com.dnobretech.loaningestor.intake;

import com.dnobretech.loaningestor.dto.SourceRow;
import com.dnobretech.loaningestor.dto.SourceSheet;
import com.dnobretech.loaningestor.exception.SpreadsheetFormatException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lê a primeira aba (xlsx/xls). Primeira linha = cabeçalho; toda célula vira texto,
 * sem coerção numérica (12 dígitos não viram 1.23457E+11).
 */
@Slf4j
@Component
public class SpreadsheetReader {

    public SourceSheet read(InputStream in) {
        try (Workbook wb = WorkbookFactory.create(in)) {
            if (wb.getNumberOfSheets() == 0) {
                return new SourceSheet(List.of(), List.of());
            }
            Sheet sh = wb.getSheetAt(0);
            DataFormatter fmt = new DataFormatter();
            Row header = sh.getRow(sh.getFirstRowNum());
            if (header == null || sh.getPhysicalNumberOfRows() == 0) {
                return new SourceSheet(List.of(), List.of());
            }

            List<String> headers = headerNames(header, fmt);
            List<SourceRow> rows = new ArrayList<>();
            // linhas vazias no meio da planilha continuam (viram registro só com id); as do fim são descartadas
            List<SourceRow> pendingBlank = new ArrayList<>();
            for (int r = header.getRowNum() + 1; r <= sh.getLastRowNum(); r++) {
                Row row = sh.getRow(r);
                Map<String, String> cells = new LinkedHashMap<>();
                boolean blank = true;
                for (int i = 0; i < headers.size(); i++) {
                    String v = row == null ? "" : text(row.getCell(i), fmt);
                    if (!v.isBlank()) blank = false;
                    cells.put(headers.get(i), v);
                }
                if (blank) {
                    pendingBlank.add(new SourceRow(r + 1, cells));
                    continue;
                }
                rows.addAll(pendingBlank);
                pendingBlank.clear();
                rows.add(new SourceRow(r + 1, cells));
            }
            log.info("[sheet] '{}': {} colunas, {} linhas", sh.getSheetName(), headers.size(), rows.size());
            return new SourceSheet(headers, rows);
        } catch (IOException | RuntimeException e) {
            throw new SpreadsheetFormatException("Planilha ilegível: " + e.getMessage(), e);
        }
    }

    // cabeçalho vazio vira "Unnamed: i"; repetidos ganham sufixo ".1", ".2"...
    private static List<String> headerNames(Row header, DataFormatter fmt) {
        List<String> names = new ArrayList<>();
        Map<String, Integer> seen = new HashMap<>();
        int last = Math.max(0, header.getLastCellNum());
        for (int i = 0; i < last; i++) {
            String h = text(header.getCell(i), fmt).trim();
            if (h.isEmpty()) h = "Unnamed: " + i;
            int n = seen.merge(h, 1, Integer::sum);
            names.add(n == 1 ? h : h + "." + (n - 1));
        }
        return names;
    }

    static String text(Cell c, DataFormatter fmt) {
        if (c == null) return "";
        CellType type = c.getCellType();
        if (type == CellType.FORMULA) {
            type = c.getCachedFormulaResultType();
        }
        return switch (type) {
            case STRING -> c.getStringCellValue();
            case NUMERIC -> DateUtil.isCellDateFormatted(c)
                    ? fmt.formatCellValue(c)
                    : plain(c.getNumericCellValue());
            case BOOLEAN -> c.getBooleanCellValue() ? "True" : "False";
            default -> "";
        };
    }

    private static String plain(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) return "";
        return new BigDecimal(Double.toString(d)).stripTrailingZeros().toPlainString();
    }
}
