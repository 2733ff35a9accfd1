package com.dnobretech.loaningestor.dto;

import java.util.List;
import java.util.Map;

public record SourceSheet(List<String> headers, List<SourceRow> rows) {

    public List<Map<String, String>> records() {
        return rows.stream().map(SourceRow::cells).toList();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
