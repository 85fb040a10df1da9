package com.acme.reconcile;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the invoice reconciliation service.
 *
 * Features:
 * - Invoice / purchase order / goods receipt reconciliation
 * - Logistic-regression mismatch classifier with rule-based decision policy
 * - Guardrailed orchestration with a human approval checkpoint
 * - Run audit persistence and OpenAPI documentation
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableTransactionManagement
public class ReconcileServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReconcileServiceApplication.class, args);
    }
}
