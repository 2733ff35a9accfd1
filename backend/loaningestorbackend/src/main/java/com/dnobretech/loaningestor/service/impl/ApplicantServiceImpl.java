package com.dnobretech.loaningestor.service.impl;

import com.dnobretech.loaningestor.domain.LoanApplicant;
import com.dnobretech.loaningestor.repository.LoanApplicantRepository;
import com.dnobretech.loaningestor.service.ApplicantService;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class ApplicantServiceImpl implements ApplicantService {

    private final LoanApplicantRepository repo;

    @Override
    @Transactional(readOnly = true)
    public LoanApplicant get(String applicantId) {
        return repo.findById(applicantId.trim())
                .orElseThrow(() -> new EntityNotFoundException("Solicitante não encontrado: " + applicantId));
    }
}
