package com.dnobretech.loaningestor.intake;

import com.dnobretech.loaningestor.dto.AdvisoryMapping;
import com.dnobretech.loaningestor.dto.ApplicantRecord;
import com.dnobretech.loaningestor.dto.SourceRow;
import com.dnobretech.loaningestor.dto.SourceSheet;
import com.dnobretech.loaningestor.enums.CanonicalField;
import com.dnobretech.loaningestor.util.ValueNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reparo de linhas em dois passes:
 * <ol>
 *   <li>invalidação: apaga células que não passam no validador do campo atribuído pelo mapeamento
 *       (exceto loan_amount/monthly_income, que confiam na coluna);</li>
 *   <li>reparo: reclassifica todos os valores crus da linha original por formato e reconstrói os campos.</li>
 * </ol>
 * Nenhuma linha é descartada; o que não der para reparar fica vazio.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RowRepairEngine {

    private final ValueClassifier classifier;

    public RepairBatch repair(SourceSheet sheet, AdvisoryMapping mapping, BatchIdentifierContext ids) {
        RepairBatch batch = new RepairBatch(sheet, mapping, ids);
        applyMapping(batch);
        invalidate(batch);
        repairRows(batch);
        log.info("[repair] {} linhas reparadas ({} ids no lote)", batch.records().size(), ids.batchSize());
        return batch;
    }

    // ---------- MAPPING_APPLIED ----------
    // renomeia colunas pelo mapeamento; os dez campos sempre existem (ausente = null).
    // várias colunas no mesmo campo: vence a primeira não vazia, na ordem do cabeçalho.
    void applyMapping(RepairBatch batch) {
        batch.advance(RepairStage.CLEARED, RepairStage.MAPPING_APPLIED);
        AdvisoryMapping mapping = batch.mapping();
        for (SourceRow row : batch.sheet().rows()) {
            ApplicantRecord rec = new ApplicantRecord(row.rowNumber());
            for (Map.Entry<String, String> cell : row.cells().entrySet()) {
                if (FieldValidators.isNull(cell.getValue())) continue;
                Optional<CanonicalField> field = mapping.targetOf(cell.getKey());
                if (field.isPresent() && !rec.has(field.get())) {
                    rec.set(field.get(), cell.getValue().trim());
                }
            }
            batch.mutableRecords().add(rec);
        }
    }

    // ---------- INVALIDATED ----------
    void invalidate(RepairBatch batch) {
        batch.advance(RepairStage.MAPPING_APPLIED, RepairStage.INVALIDATED);
        for (ApplicantRecord rec : batch.mutableRecords()) {
            for (CanonicalField f : CanonicalField.values()) {
                if (f.isColumnTrusted()) continue;
                String v = rec.get(f);
                if (f.accepts(v)) rec.set(f, f.normalize(v));
                else rec.clear(f);
            }
        }
    }

    // ---------- REPAIRED ----------
    void repairRows(RepairBatch batch) {
        batch.advance(RepairStage.INVALIDATED, RepairStage.REPAIRED);
        BatchIdentifierContext ids = batch.ids();
        List<SourceRow> rows = batch.sheet().rows();
        List<ApplicantRecord> records = batch.mutableRecords();

        // ids já existentes no arquivo entram no lote antes de qualquer alocação
        for (int i = 0; i < rows.size(); i++) {
            ids.register(records.get(i).applicantId());
            for (String v : rows.get(i).values()) {
                if (FieldValidators.validId(v)) ids.register(v);
            }
        }

        for (int i = 0; i < rows.size(); i++) {
            repairRow(rows.get(i), records.get(i), ids);
        }
    }

    void repairRow(SourceRow original, ApplicantRecord rec, BatchIdentifierContext ids) {
        ValueBuckets buckets = classifier.classify(rawValues(original));

        String id = buckets.first(ValueBucket.ID).orElseGet(ids::allocateNext);
        rec.set(CanonicalField.APPLICANT_ID, id);
        ids.register(id);

        // valor encontrado no balde sempre sobrescreve o que veio da coluna mapeada
        for (ValueBucket bucket : ValueBucket.values()) {
            if (bucket == ValueBucket.ID || bucket.target() == null) continue;
            buckets.first(bucket).ifPresent(v -> rec.set(bucket.target(), v));
        }

        keepTrustedColumn(rec, CanonicalField.LOAN_AMOUNT);
        keepTrustedColumn(rec, CanonicalField.MONTHLY_INCOME);
        splitNumbers(rec, buckets.numbers());

        if (buckets.size() == 0) {
            log.debug("[repair] linha {} sem valores classificáveis, só id {}", original.rowNumber(), id);
        }
    }

    private static List<String> rawValues(SourceRow row) {
        List<String> out = new ArrayList<>();
        for (String v : row.values()) {
            if (FieldValidators.isNull(v)) continue;
            out.add(ValueNormalizer.fixScientific(v.trim()));
        }
        return out;
    }

    // coluna confiável: mantém o decimal que veio mapeado (sem checar faixa); texto não numérico é limpo
    private static void keepTrustedColumn(ApplicantRecord rec, CanonicalField field) {
        String v = rec.get(field);
        if (v == null) return;
        rec.set(field, ValueNormalizer.plainDecimal(v));
    }

    /**
     * Divisão valor/renda: em ordem crescente, o primeiro número &lt; 500000 vira renda e o primeiro
     * &gt; 500000 vira valor do empréstimo. Exatamente 500000 não vai para nenhum dos dois, e números
     * que passam como telefone são ignorados.
     */
    static void splitNumbers(ApplicantRecord rec, List<Long> numbers) {
        List<Long> sorted = new ArrayList<>(numbers);
        Collections.sort(sorted);
        Long income = null;
        Long loan = null;
        for (long n : sorted) {
            if (n == 0) continue;
            if (FieldValidators.validPhone(Long.toString(n))) continue;
            if (n < FieldValidators.LOAN_MIN) {
                if (income == null) income = n;
            } else if (n > FieldValidators.LOAN_MIN) {
                if (loan == null) loan = n;
            }
        }
        if (income != null) rec.set(CanonicalField.MONTHLY_INCOME, Long.toString(income));
        if (loan != null) rec.set(CanonicalField.LOAN_AMOUNT, Long.toString(loan));
    }
}
