package com.apflow.invoice.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Invoice Orchestrator Application.
 *
 * This service:
 * - Consumes extracted invoices from invoices.orchestrator.in (or POST /api/invoice-runs)
 * - Verifies supplier, bank and purchase-order fields against the reference tools
 * - Routes each invoice to PROCEED, REJECT or MANUAL_REVIEW
 * - Publishes terminal run records to invoices.final.status
 */
@SpringBootApplication
public class InvoiceOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(InvoiceOrchestratorApplication.class, args);
    }
}
