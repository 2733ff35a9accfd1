package com.dnobretech.loaningestor.domain;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "loan_applicants")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LoanApplicant {

    @Id
    @Column(name = "applicant_id", length = 50)
    private String applicantId;                 // A<n>

    @Column(name = "applicant_name")
    private String applicantName;

    @Column(name = "phone_number", length = 20)
    private String phoneNumber;

    private String email;

    @Column(name = "aadhaar_number", length = 20)
    private String aadhaarNumber;

    @Column(name = "pan_number", length = 20)
    private String panNumber;

    @Column(name = "loan_amount", precision = 21, scale = 2)
    private BigDecimal loanAmount;

    @Column(name = "loan_purpose")
    private String loanPurpose;

    @Column(name = "employment_type", length = 100)
    private String employmentType;

    @Column(name = "monthly_income", precision = 21, scale = 2)
    private BigDecimal monthlyIncome;

    /** default do banco (CURRENT_TIMESTAMP) */
    @Column(name = "created_at", insertable = false, updatable = false)
    private LocalDateTime createdAt;
}
