package com.dnobretech.loaningestor.dto;

import java.util.List;

public record UpsertResult(int inserted, int updated, List<RecordFailure> failures) {
}
