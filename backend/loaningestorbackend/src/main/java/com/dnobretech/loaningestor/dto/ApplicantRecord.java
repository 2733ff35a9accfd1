package com.dnobretech.loaningestor.dto;

import com.dnobretech.loaningestor.enums.CanonicalField;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** Registro em reparo/reparado: um valor (ou null) por campo canônico. */
public class ApplicantRecord {

    private final int rowNumber;
    private final Map<CanonicalField, String> values = new EnumMap<>(CanonicalField.class);

    public ApplicantRecord(int rowNumber) {
        this.rowNumber = rowNumber;
    }

    public int rowNumber() {
        return rowNumber;
    }

    public String get(CanonicalField field) {
        return values.get(field);
    }

    public void set(CanonicalField field, String value) {
        if (value == null) values.remove(field);
        else values.put(field, value);
    }

    public void clear(CanonicalField field) {
        values.remove(field);
    }

    public boolean has(CanonicalField field) {
        return values.containsKey(field);
    }

    public String applicantId() {
        return values.get(CanonicalField.APPLICANT_ID);
    }

    /** campo -> valor, vazio ("") para nulos, na ordem da tabela */
    public Map<String, String> toPreview() {
        Map<String, String> out = new LinkedHashMap<>();
        for (CanonicalField f : CanonicalField.values()) {
            String v = values.get(f);
            out.put(f.column(), v == null ? "" : v);
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ApplicantRecord other)) return false;
        return rowNumber == other.rowNumber && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return 31 * rowNumber + values.hashCode();
    }

    @Override
    public String toString() {
        return "ApplicantRecord{row=" + rowNumber + ", " + values + "}";
    }
}
