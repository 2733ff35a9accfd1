package com.dnobretech.loaningestor.enums;

import com.dnobretech.loaningestor.util.ValueNormalizer;

import java.util.Locale;
import java.util.Optional;

public enum LoanPurpose {
    EDUCATION("education"),
    HOME_RENOVATION("home renovation"),
    CAR("car"),
    BUSINESS("business"),
    PERSONAL("personal"),
    MEDICAL("medical");

    private final String term;

    LoanPurpose(String term) {
        this.term = term;
    }

    public String term() {
        return term;
    }

    public String label() {
        return ValueNormalizer.titleCase(term);
    }

    public static Optional<LoanPurpose> fromTerm(String value) {
        if (value == null) return Optional.empty();
        String lv = value.trim().toLowerCase(Locale.ROOT);
        for (LoanPurpose p : values()) {
            if (p.term.equals(lv)) return Optional.of(p);
        }
        return Optional.empty();
    }
}
