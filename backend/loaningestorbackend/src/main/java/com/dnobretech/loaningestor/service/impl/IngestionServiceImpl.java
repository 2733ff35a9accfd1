package com.dnobretech.loaningestor.service.impl;

import com.dnobretech.loaningestor.client.MappingOracleClient;
import com.dnobretech.loaningestor.dto.AdvisoryMapping;
import com.dnobretech.loaningestor.dto.ApplicantRecord;
import com.dnobretech.loaningestor.dto.PreviewResponse;
import com.dnobretech.loaningestor.dto.SourceSheet;
import com.dnobretech.loaningestor.dto.UploadResponse;
import com.dnobretech.loaningestor.dto.UpsertResult;
import com.dnobretech.loaningestor.exception.SpreadsheetFormatException;
import com.dnobretech.loaningestor.intake.ApplicantIdAllocator;
import com.dnobretech.loaningestor.intake.BatchIdentifierContext;
import com.dnobretech.loaningestor.intake.RowRepairEngine;
import com.dnobretech.loaningestor.intake.SchemaEnsurer;
import com.dnobretech.loaningestor.intake.SpreadsheetReader;
import com.dnobretech.loaningestor.service.ApplicantUpsertService;
import com.dnobretech.loaningestor.service.IngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionServiceImpl implements IngestionService {

    private final SpreadsheetReader reader;
    private final SchemaEnsurer schema;
    private final MappingOracleClient oracle;
    private final ApplicantIdAllocator allocator;
    private final RowRepairEngine engine;
    private final ApplicantUpsertService upsertService;

    @Value("${loan.preview.rows:20}")
    private int previewRows;

    @Override
    public PreviewResponse preview(MultipartFile file) {
        Repaired batch = prepare(file);
        int limit = previewRows > 0 ? previewRows : 20;
        List<Map<String, String>> rows = batch.records().stream()
                .limit(limit)
                .map(ApplicantRecord::toPreview)
                .toList();
        return new PreviewResponse("validated", batch.mapping().columns(), batch.mapping().fallback(),
                batch.records().size(), rows);
    }

    @Override
    public UploadResponse upload(MultipartFile file) {
        Repaired batch = prepare(file);
        UpsertResult res = upsertService.upsert(batch.records());
        return new UploadResponse("success", batch.mapping().columns(), batch.records().size(),
                res.inserted(), res.updated(), res.failures());
    }

    private record Repaired(AdvisoryMapping mapping, List<ApplicantRecord> records) {}

    private Repaired prepare(MultipartFile file) {
        SourceSheet sheet = readSheet(file);
        try {
            schema.ensureLoanApplicants();
        } catch (Exception e) {
            // sem tabela o alocador cai no modo só-lote; o upsert reporta as falhas por registro
            log.warn("[ingest] não foi possível garantir a tabela loan_applicants: {}", e.toString());
        }

        AdvisoryMapping mapping = sheet.headers().isEmpty()
                ? AdvisoryMapping.fallback("planilha sem cabeçalho")
                : oracle.requestMapping(sheet);

        BatchIdentifierContext ids = allocator.openBatch();
        List<ApplicantRecord> records = engine.repair(sheet, mapping, ids).records();
        log.info("[ingest] '{}': {} linhas, mapeamento {} ({} colunas)",
                file.getOriginalFilename(), records.size(),
                mapping.fallback() ? "vazio" : "do oráculo", mapping.columns().size());
        return new Repaired(mapping, records);
    }

    private SourceSheet readSheet(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new SpreadsheetFormatException("Envie 'file' com uma planilha (.xlsx/.xls)");
        }
        try (InputStream in = file.getInputStream()) {
            return reader.read(in);
        } catch (IOException e) {
            throw new SpreadsheetFormatException("Falha ao ler o upload: " + e.getMessage(), e);
        }
    }
}
