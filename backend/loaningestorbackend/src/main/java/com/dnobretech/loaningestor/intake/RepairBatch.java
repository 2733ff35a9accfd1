package com.dnobretech.loaningestor.intake;

import com.dnobretech.loaningestor.dto.AdvisoryMapping;
import com.dnobretech.loaningestor.dto.ApplicantRecord;
import com.dnobretech.loaningestor.dto.SourceSheet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Estado de um lote em reparo. Só anda para frente:
 * CLEARED -> MAPPING_APPLIED -> INVALIDATED -> REPAIRED.
 */
public class RepairBatch {

    private final SourceSheet sheet;
    private final AdvisoryMapping mapping;
    private final BatchIdentifierContext ids;
    private final List<ApplicantRecord> records = new ArrayList<>();
    private RepairStage stage;

    RepairBatch(SourceSheet sheet, AdvisoryMapping mapping, BatchIdentifierContext ids) {
        this.sheet = sheet;
        this.mapping = mapping;
        this.ids = ids;
        ids.clear();
        this.stage = RepairStage.CLEARED;
    }

    void advance(RepairStage from, RepairStage to) {
        if (stage != from) {
            throw new IllegalStateException("lote em " + stage + ", esperado " + from + " para ir a " + to);
        }
        stage = to;
    }

    SourceSheet sheet() {
        return sheet;
    }

    AdvisoryMapping mapping() {
        return mapping;
    }

    BatchIdentifierContext ids() {
        return ids;
    }

    List<ApplicantRecord> mutableRecords() {
        return records;
    }

    public RepairStage stage() {
        return stage;
    }

    public List<ApplicantRecord> records() {
        return Collections.unmodifiableList(records);
    }
}
