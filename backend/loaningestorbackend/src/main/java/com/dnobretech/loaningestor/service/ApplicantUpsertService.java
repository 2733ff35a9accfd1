package com.dnobretech.loaningestor.service;

import com.dnobretech.loaningestor.dto.ApplicantRecord;
import com.dnobretech.loaningestor.dto.UpsertResult;

import java.util.List;

public interface ApplicantUpsertService {
    /** insere ids novos, sobrescreve os existentes; uma transação por registro */
    UpsertResult upsert(List<ApplicantRecord> records);
}
