package com.dnobretech.loaningestor.repository;

import com.dnobretech.loaningestor.domain.LoanApplicant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface LoanApplicantRepository extends JpaRepository<LoanApplicant, String> {

    @Query("select a.applicantId from LoanApplicant a")
    List<String> findAllApplicantIds();
    // escrita (upsert) é via JdbcTemplate no service
}
