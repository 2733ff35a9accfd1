package com.dnobretech.loaningestor.service.impl;

import com.dnobretech.loaningestor.client.MappingOracleClient;
import com.dnobretech.loaningestor.dto.AdvisoryMapping;
import com.dnobretech.loaningestor.dto.ApplicantRecord;
import com.dnobretech.loaningestor.dto.PreviewResponse;
import com.dnobretech.loaningestor.dto.RecordFailure;
import com.dnobretech.loaningestor.dto.UploadResponse;
import com.dnobretech.loaningestor.dto.UpsertResult;
import com.dnobretech.loaningestor.exception.SpreadsheetFormatException;
import com.dnobretech.loaningestor.intake.ApplicantIdAllocator;
import com.dnobretech.loaningestor.intake.BatchIdentifierContext;
import com.dnobretech.loaningestor.intake.RowRepairEngine;
import com.dnobretech.loaningestor.intake.SchemaEnsurer;
import com.dnobretech.loaningestor.intake.SpreadsheetReader;
import com.dnobretech.loaningestor.intake.ValueClassifier;
import com.dnobretech.loaningestor.service.ApplicantUpsertService;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestionServiceImplTest {

    @Mock
    private SchemaEnsurer schema;

    @Mock
    private MappingOracleClient oracle;

    @Mock
    private ApplicantIdAllocator allocator;

    @Mock
    private ApplicantUpsertService upsertService;

    private IngestionServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new IngestionServiceImpl(
                new SpreadsheetReader(),
                schema,
                oracle,
                allocator,
                new RowRepairEngine(new ValueClassifier()),
                upsertService
        );
        ReflectionTestUtils.setField(service, "previewRows", 2);
    }

    @Test
    void previewReturnsFirstRowsAndMappingWithoutPersisting() throws IOException {
        when(oracle.requestMapping(any())).thenReturn(AdvisoryMapping.of(Map.of("Full Name", "applicant_name")));
        when(allocator.openBatch()).thenReturn(new BatchIdentifierContext(Set.of(), 101));

        PreviewResponse res = service.preview(upload());

        assertThat(res.status()).isEqualTo("validated");
        assertThat(res.mapping()).containsEntry("Full Name", "applicant_name");
        assertThat(res.mappingFallback()).isFalse();
        assertThat(res.totalRows()).isEqualTo(3);
        assertThat(res.preview()).hasSize(2);
        assertThat(res.preview().get(0))
                .containsEntry("applicant_id", "A101")
                .containsEntry("applicant_name", "John Smith")
                .containsEntry("phone_number", "9876543210")
                .containsEntry("monthly_income", "450000")
                .containsEntry("aadhaar_number", "");
        verify(schema).ensureLoanApplicants();
        verifyNoInteractions(upsertService);
    }

    @Test
    void uploadPersistsEveryRepairedRow() throws IOException {
        when(oracle.requestMapping(any())).thenReturn(AdvisoryMapping.fallback("timeout"));
        when(allocator.openBatch()).thenReturn(new BatchIdentifierContext(Set.of(101L), 101));
        List<RecordFailure> failures = List.of(new RecordFailure(4, "A104", "boom"));
        when(upsertService.upsert(any())).thenReturn(new UpsertResult(2, 0, failures));

        UploadResponse res = service.upload(upload());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ApplicantRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(upsertService).upsert(captor.capture());
        assertThat(captor.getValue()).extracting(ApplicantRecord::applicantId)
                .containsExactly("A102", "A103", "A104");
        assertThat(res.status()).isEqualTo("success");
        assertThat(res.inserted()).isEqualTo(2);
        assertThat(res.updated()).isZero();
        assertThat(res.failures()).isEqualTo(failures);
        assertThat(res.mapping()).isEmpty();
    }

    @Test
    void schemaFailureDoesNotStopPreview() throws IOException {
        doThrow(new IllegalStateException("db down")).when(schema).ensureLoanApplicants();
        when(oracle.requestMapping(any())).thenReturn(AdvisoryMapping.of(Map.of()));
        when(allocator.openBatch()).thenReturn(new BatchIdentifierContext(Set.of(), 101));

        PreviewResponse res = service.preview(upload());

        assertThat(res.totalRows()).isEqualTo(3);
    }

    @Test
    void emptyUploadIsRejectedBeforeAnyWork() {
        MockMultipartFile empty = new MockMultipartFile("file", "x.xlsx", null, new byte[0]);

        assertThatThrownBy(() -> service.upload(empty)).isInstanceOf(SpreadsheetFormatException.class);
        verifyNoInteractions(oracle, allocator, upsertService, schema);
    }

    private static MockMultipartFile upload() throws IOException {
        try (Workbook wb = new XSSFWorkbook(); ByteArrayOutputStream bos = new ByteArrayOutputStream()) {
            Sheet sh = wb.createSheet("s");
            Row h = sh.createRow(0);
            h.createCell(0).setCellValue("Full Name");
            h.createCell(1).setCellValue("Mobile");
            h.createCell(2).setCellValue("Salary");

            Object[][] data = {
                    {"john smith", 9876543210d, 450000d},
                    {"asha rao", "8123456789", "38000"},
                    {"vik menon", "not given", "nan"}
            };
            for (int i = 0; i < data.length; i++) {
                Row r = sh.createRow(i + 1);
                for (int c = 0; c < data[i].length; c++) {
                    Object v = data[i][c];
                    if (v instanceof Double d) r.createCell(c).setCellValue(d);
                    else r.createCell(c).setCellValue((String) v);
                }
            }
            wb.write(bos);
            return new MockMultipartFile("file", "applicants.xlsx",
                    "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", bos.toByteArray());
        }
    }
}
