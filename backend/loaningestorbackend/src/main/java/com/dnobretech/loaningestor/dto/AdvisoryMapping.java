package com.dnobretech.loaningestor.dto;

import com.dnobretech.loaningestor.enums.CanonicalField;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mapeamento coluna da planilha -> campo canônico sugerido pelo oráculo.
 * fallback=true quando o oráculo falhou ou respondeu algo inutilizável (mapeamento vazio).
 */
public record AdvisoryMapping(Map<String, String> columns, boolean fallback, String reason) {

    public static AdvisoryMapping of(Map<String, String> columns) {
        return new AdvisoryMapping(Collections.unmodifiableMap(new LinkedHashMap<>(columns)), false, null);
    }

    public static AdvisoryMapping fallback(String reason) {
        return new AdvisoryMapping(Map.of(), true, reason);
    }

    /** Coluna renomeada pelo mapeamento; sem entrada, a coluna mantém o próprio nome. */
    public Optional<CanonicalField> targetOf(String column) {
        String target = columns.getOrDefault(column, column);
        return CanonicalField.fromColumn(target);
    }
}
