package com.dnobretech.loaningestor.intake;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SchemaEnsurer {

    private final JdbcTemplate jdbc;

    public void ensureLoanApplicants() {
        jdbc.execute("""
        CREATE TABLE IF NOT EXISTS loan_applicants (
          applicant_id    VARCHAR(50) PRIMARY KEY,
          applicant_name  VARCHAR(255),
          phone_number    VARCHAR(20),
          email           VARCHAR(255),
          aadhaar_number  VARCHAR(20),
          pan_number      VARCHAR(20),
          loan_amount     NUMERIC(21,2),
          loan_purpose    VARCHAR(255),
          employment_type VARCHAR(100),
          monthly_income  NUMERIC(21,2),
          created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
        )
        """);
    }
}
