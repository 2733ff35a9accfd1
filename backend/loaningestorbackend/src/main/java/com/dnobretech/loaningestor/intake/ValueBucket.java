package com.dnobretech.loaningestor.intake;

import com.dnobretech.loaningestor.enums.CanonicalField;

/**
 * Baldes de classificação por valor, na ordem de prioridade (o primeiro que casa vence).
 */
public enum ValueBucket {
    ID(CanonicalField.APPLICANT_ID),
    EMAIL(CanonicalField.EMAIL),
    PAN(CanonicalField.PAN_NUMBER),
    AADHAAR(CanonicalField.AADHAAR_NUMBER),
    PHONE(CanonicalField.PHONE_NUMBER),
    EMPLOYMENT(CanonicalField.EMPLOYMENT_TYPE),
    PURPOSE(CanonicalField.LOAN_PURPOSE),
    NUMERIC(null),
    NAME(CanonicalField.APPLICANT_NAME);

    private final CanonicalField target;

    ValueBucket(CanonicalField target) {
        this.target = target;
    }

    /** campo que o balde preenche diretamente; null para NUMERIC (vai para a divisão valor/renda) */
    public CanonicalField target() {
        return target;
    }
}
