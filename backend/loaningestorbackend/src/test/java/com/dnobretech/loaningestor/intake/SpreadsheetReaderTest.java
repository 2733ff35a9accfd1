package com.dnobretech.loaningestor.intake;

import com.dnobretech.loaningestor.dto.SourceSheet;
import com.dnobretech.loaningestor.exception.SpreadsheetFormatException;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpreadsheetReaderTest {

    private final SpreadsheetReader reader = new SpreadsheetReader();

    @Test
    void readsEveryCellAsPlainTextKeepingInnerBlankRows() throws IOException {
        byte[] bytes;
        try (Workbook wb = new XSSFWorkbook(); ByteArrayOutputStream bos = new ByteArrayOutputStream()) {
            Sheet sh = wb.createSheet("applicants");
            Row h = sh.createRow(0);
            String[] headers = {"Name", "Phone", "Aadhaar", "Income", "Name", "", "Active"};
            for (int i = 0; i < headers.length; i++) h.createCell(i).setCellValue(headers[i]);

            Row r = sh.createRow(1);
            r.createCell(0).setCellValue("john smith");
            r.createCell(1).setCellValue(9876543210d);
            r.createCell(2).setCellValue(123456789012d);
            r.createCell(3).setCellValue(450000d);
            r.createCell(4).setCellValue("dup");
            r.createCell(5).setCellValue(12.5d);
            r.createCell(6).setCellValue(true);

            sh.createRow(2); // vazia
            Row r3 = sh.createRow(3);
            r3.createCell(0).setCellValue("asha rao");
            sh.createRow(4); // vazia no fim

            wb.write(bos);
            bytes = bos.toByteArray();
        }

        SourceSheet sheet = reader.read(new ByteArrayInputStream(bytes));

        assertThat(sheet.headers()).containsExactly("Name", "Phone", "Aadhaar", "Income", "Name.1", "Unnamed: 5", "Active");
        assertThat(sheet.rows()).hasSize(3);
        assertThat(sheet.rows().get(0).rowNumber()).isEqualTo(2);
        assertThat(sheet.rows().get(0).cells())
                .containsEntry("Name", "john smith")
                .containsEntry("Phone", "9876543210")
                .containsEntry("Aadhaar", "123456789012")
                .containsEntry("Income", "450000")
                .containsEntry("Name.1", "dup")
                .containsEntry("Unnamed: 5", "12.5")
                .containsEntry("Active", "True");
        assertThat(sheet.rows().get(1).rowNumber()).isEqualTo(3);
        assertThat(sheet.rows().get(1).cells().values()).allMatch(String::isEmpty);
        assertThat(sheet.rows().get(2).rowNumber()).isEqualTo(4);
        assertThat(sheet.rows().get(2).get("Phone")).isEmpty();
    }

    @Test
    void headerOnlySheetHasNoRows() throws IOException {
        byte[] bytes;
        try (Workbook wb = new XSSFWorkbook(); ByteArrayOutputStream bos = new ByteArrayOutputStream()) {
            wb.createSheet("s").createRow(0).createCell(0).setCellValue("Col1");
            wb.write(bos);
            bytes = bos.toByteArray();
        }

        SourceSheet sheet = reader.read(new ByteArrayInputStream(bytes));

        assertThat(sheet.headers()).containsExactly("Col1");
        assertThat(sheet.isEmpty()).isTrue();
    }

    @Test
    void unreadableFileIsRejected() {
        byte[] junk = "applicant_id,name\nA1,x".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> reader.read(new ByteArrayInputStream(junk)))
                .isInstanceOf(SpreadsheetFormatException.class)
                .hasMessageContaining("Planilha ilegível");
    }
}
