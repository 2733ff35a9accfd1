package com.dnobretech.loaningestor.controller;

import com.dnobretech.loaningestor.domain.LoanApplicant;
import com.dnobretech.loaningestor.service.ApplicantService;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ApplicantController.class)
class ApplicantControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ApplicantService applicantService;

    @Test
    void returnsStoredApplicant() throws Exception {
        when(applicantService.get("A101")).thenReturn(LoanApplicant.builder()
                .applicantId("A101")
                .applicantName("John Smith")
                .monthlyIncome(new BigDecimal("45000.50"))
                .build());

        mvc.perform(get("/api/applicants/A101"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.applicantId").value("A101"))
                .andExpect(jsonPath("$.applicantName").value("John Smith"))
                .andExpect(jsonPath("$.monthlyIncome").value(45000.50));
    }

    @Test
    void malformedIdIsBadRequest() throws Exception {
        mvc.perform(get("/api/applicants/101"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));

        verify(applicantService, never()).get(anyString());
    }

    @Test
    void unknownIdIsNotFound() throws Exception {
        when(applicantService.get("A999")).thenThrow(new EntityNotFoundException("Solicitante não encontrado: A999"));

        mvc.perform(get("/api/applicants/A999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Solicitante não encontrado: A999"));
    }
}
