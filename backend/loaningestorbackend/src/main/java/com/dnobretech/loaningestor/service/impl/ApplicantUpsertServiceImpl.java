package com.dnobretech.loaningestor.service.impl;

import com.dnobretech.loaningestor.dto.ApplicantRecord;
import com.dnobretech.loaningestor.dto.RecordFailure;
import com.dnobretech.loaningestor.dto.UpsertResult;
import com.dnobretech.loaningestor.enums.CanonicalField;
import com.dnobretech.loaningestor.intake.FieldValidators;
import com.dnobretech.loaningestor.service.ApplicantUpsertService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Upsert por applicant_id. Cada registro roda na própria transação: se um falhar, é revertido
 * sozinho, entra na lista de falhas e o lote continua.
 */
@Slf4j
@Service
public class ApplicantUpsertServiceImpl implements ApplicantUpsertService {

    private static final String UPDATE_SQL = """
        UPDATE loan_applicants SET
          applicant_name = ?, phone_number = ?, email = ?,
          aadhaar_number = ?, pan_number = ?, loan_amount = ?,
          loan_purpose = ?, employment_type = ?, monthly_income = ?
        WHERE applicant_id = ?
        """;

    private static final String INSERT_SQL = """
        INSERT INTO loan_applicants (
          applicant_name, phone_number, email,
          aadhaar_number, pan_number, loan_amount,
          loan_purpose, employment_type, monthly_income,
          applicant_id, created_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
        """;

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;

    public ApplicantUpsertServiceImpl(JdbcTemplate jdbc, PlatformTransactionManager txManager) {
        this.jdbc = jdbc;
        this.tx = new TransactionTemplate(txManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public UpsertResult upsert(List<ApplicantRecord> records) {
        int inserted = 0, updated = 0;
        List<RecordFailure> failures = new ArrayList<>();

        for (ApplicantRecord r : records) {
            try {
                if (writeOne(r)) inserted++;
                else updated++;
            } catch (RuntimeException e) {
                log.warn("[upsert] linha {} ({}) falhou: {}", r.rowNumber(), r.applicantId(), e.toString());
                failures.add(new RecordFailure(r.rowNumber(), r.applicantId(), e.getMessage()));
            }
        }
        log.info("[upsert] inseridos={} atualizados={} falhas={}", inserted, updated, failures.size());
        return new UpsertResult(inserted, updated, List.copyOf(failures));
    }

    /** true = inserido, false = atualizado */
    private boolean writeOne(ApplicantRecord r) {
        Object[] args = storageArgs(r);
        try {
            Boolean ins = tx.execute(status -> {
                // UPDATE primeiro: trava a linha e serializa lotes concorrentes no mesmo id
                if (jdbc.update(UPDATE_SQL, args) > 0) return false;
                jdbc.update(INSERT_SQL, args);
                return true;
            });
            return Boolean.TRUE.equals(ins);
        } catch (DuplicateKeyException e) {
            // outro lote inseriu o mesmo id entre o UPDATE e o INSERT
            log.debug("[upsert] {} inserido em paralelo, atualizando", r.applicantId());
            tx.executeWithoutResult(status -> jdbc.update(UPDATE_SQL, args));
            return false;
        }
    }

    // mesma ordem para UPDATE e INSERT: campos não-chave e depois applicant_id
    private static Object[] storageArgs(ApplicantRecord r) {
        String id = r.applicantId();
        if (FieldValidators.isNull(id)) {
            throw new IllegalArgumentException("registro sem applicant_id");
        }
        return new Object[]{
                text(r, CanonicalField.APPLICANT_NAME),
                text(r, CanonicalField.PHONE_NUMBER),
                text(r, CanonicalField.EMAIL),
                text(r, CanonicalField.AADHAAR_NUMBER),
                text(r, CanonicalField.PAN_NUMBER),
                number(r, CanonicalField.LOAN_AMOUNT),
                text(r, CanonicalField.LOAN_PURPOSE),
                text(r, CanonicalField.EMPLOYMENT_TYPE),
                number(r, CanonicalField.MONTHLY_INCOME),
                id.trim()
        };
    }

    private static String text(ApplicantRecord r, CanonicalField f) {
        String v = r.get(f);
        return FieldValidators.isNull(v) ? null : v.trim();
    }

    private static BigDecimal number(ApplicantRecord r, CanonicalField f) {
        String v = text(r, f);
        return v == null ? null : new BigDecimal(v).setScale(2, RoundingMode.HALF_UP);
    }
}
