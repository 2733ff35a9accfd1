package com.dnobretech.loaningestor.enums;

import com.dnobretech.loaningestor.intake.FieldValidators;
import com.dnobretech.loaningestor.util.ValueNormalizer;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Campos da tabela loan_applicants, na ordem das colunas.
 * Cada campo carrega o seu validador de formato e o normalizador aplicado antes de gravar.
 */
public enum CanonicalField {
    APPLICANT_ID("applicant_id", FieldValidators::validId, String::trim),
    APPLICANT_NAME("applicant_name", FieldValidators::validName, v -> ValueNormalizer.titleCase(v.trim())),
    PHONE_NUMBER("phone_number", FieldValidators::validPhone, String::trim),
    EMAIL("email", FieldValidators::validEmail, String::trim),
    AADHAAR_NUMBER("aadhaar_number", FieldValidators::validAadhaar, String::trim),
    PAN_NUMBER("pan_number", FieldValidators::validPan, v -> v.trim().toUpperCase(Locale.ROOT)),
    LOAN_AMOUNT("loan_amount", FieldValidators::validLoanAmount, String::trim),
    LOAN_PURPOSE("loan_purpose", FieldValidators::validLoanPurpose,
            v -> LoanPurpose.fromTerm(v).map(LoanPurpose::label).orElse(v.trim())),
    EMPLOYMENT_TYPE("employment_type", FieldValidators::validEmploymentType,
            v -> EmploymentType.fromTerm(v).map(EmploymentType::label).orElse(v.trim())),
    MONTHLY_INCOME("monthly_income", FieldValidators::validMonthlyIncome, String::trim);

    private final String column;
    private final Predicate<String> validator;
    private final UnaryOperator<String> normalizer;

    CanonicalField(String column, Predicate<String> validator, UnaryOperator<String> normalizer) {
        this.column = column;
        this.validator = validator;
        this.normalizer = normalizer;
    }

    public String column() {
        return column;
    }

    public boolean accepts(String value) {
        return !FieldValidators.isNull(value) && validator.test(value.trim());
    }

    public String normalize(String value) {
        return value == null ? null : normalizer.apply(value);
    }

    /**
     * Faixas de valor/renda se sobrepõem: esses dois campos confiam na coluna mapeada
     * e não passam pela invalidação por formato.
     */
    public boolean isColumnTrusted() {
        return this == LOAN_AMOUNT || this == MONTHLY_INCOME;
    }

    public static Optional<CanonicalField> fromColumn(String column) {
        if (column == null) return Optional.empty();
        String c = column.trim();
        for (CanonicalField f : values()) {
            if (f.column.equals(c)) return Optional.of(f);
        }
        return Optional.empty();
    }

    public static List<String> columns() {
        return Arrays.stream(values()).map(CanonicalField::column).toList();
    }
}
