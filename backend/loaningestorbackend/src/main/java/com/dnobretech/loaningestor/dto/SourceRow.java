package com.dnobretech.loaningestor.dto;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Linha original da planilha (coluna -> texto), na ordem do cabeçalho. rowNumber é 1-based como no Excel. */
public record SourceRow(int rowNumber, Map<String, String> cells) {

    public String get(String column) {
        return cells.get(column);
    }

    public List<String> values() {
        return new ArrayList<>(cells.values());
    }
}
