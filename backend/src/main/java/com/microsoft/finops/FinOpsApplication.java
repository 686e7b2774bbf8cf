package com.microsoft.finops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Multi-Cloud FinOps Cost Engine
 *
 * Ingests AWS, Azure and GCP billing into one canonical cost store and serves
 * spend aggregation, budgets, chargeback allocation and governance policies
 * on top of it.
 */
@SpringBootApplication
@EnableScheduling
public class FinOpsApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinOpsApplication.class, args);
    }
}
