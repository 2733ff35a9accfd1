package com.dnobretech.loaningestor.intake;

public enum RepairStage {
    CLEARED,
    MAPPING_APPLIED,
    INVALIDATED,
    REPAIRED
}
