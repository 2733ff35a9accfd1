package com.dnobretech.loaningestor.service;

import com.dnobretech.loaningestor.domain.LoanApplicant;

public interface ApplicantService {
    LoanApplicant get(String applicantId);
}
