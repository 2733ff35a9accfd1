package com.dnobretech.loaningestor.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final JdbcTemplate jdbc;

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("msg", "Loan Applicant Ingestion System");
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        String db;
        try {
            jdbc.queryForObject("SELECT 1", Integer.class);
            db = "up";
        } catch (Exception e) {
            log.warn("[health] banco indisponível: {}", e.toString());
            db = "down";
        }
        return Map.of("status", "ok", "database", db);
    }
}
