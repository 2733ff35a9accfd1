package com.dnobretech.loaningestor.controller;

import com.dnobretech.loaningestor.domain.LoanApplicant;
import com.dnobretech.loaningestor.service.ApplicantService;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Validated
@RestController
@RequestMapping("/api/applicants")
@RequiredArgsConstructor
public class ApplicantController {

    private final ApplicantService applicantService;

    @GetMapping("/{id}")
    public LoanApplicant get(@PathVariable @Pattern(regexp = "^A[0-9]+$", message = "applicant_id deve ter o formato A<n>") String id) {
        return applicantService.get(id);
    }
}
