package com.dnobretech.loaningestor.dto;

import java.util.List;
import java.util.Map;

public record UploadResponse(String status,
                             Map<String, String> mapping,
                             int totalRows,
                             int inserted,
                             int updated,
                             List<RecordFailure> failures) {
}
