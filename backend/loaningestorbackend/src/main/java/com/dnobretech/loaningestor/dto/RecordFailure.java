package com.dnobretech.loaningestor.dto;

public record RecordFailure(int rowNumber, String applicantId, String message) {
}
