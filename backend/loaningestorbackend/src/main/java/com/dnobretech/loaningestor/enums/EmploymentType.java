package com.dnobretech.loaningestor.enums;

import com.dnobretech.loaningestor.util.ValueNormalizer;

import java.util.Locale;
import java.util.Optional;

public enum EmploymentType {
    SALARIED("salaried"),
    SELF_EMPLOYED("self employed"),
    UNEMPLOYED("unemployed");

    private final String term;

    EmploymentType(String term) {
        this.term = term;
    }

    public String term() {
        return term;
    }

    /** forma gravada no banco: "Self Employed" */
    public String label() {
        return ValueNormalizer.titleCase(term);
    }

    /** compara o valor em minúsculas com o termo controlado (sem fuzzy) */
    public static Optional<EmploymentType> fromTerm(String value) {
        if (value == null) return Optional.empty();
        String lv = value.trim().toLowerCase(Locale.ROOT);
        for (EmploymentType t : values()) {
            if (t.term.equals(lv)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
