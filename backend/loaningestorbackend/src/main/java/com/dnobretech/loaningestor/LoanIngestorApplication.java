package com.dnobretech.loaningestor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LoanIngestorApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoanIngestorApplication.class, args);
    }
}
