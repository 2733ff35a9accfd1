package com.dnobretech.loaningestor.dto;

import java.util.List;
import java.util.Map;

public record PreviewResponse(String status,
                              Map<String, String> mapping,
                              boolean mappingFallback,
                              int totalRows,
                              List<Map<String, String>> preview) {
}
