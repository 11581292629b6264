package com.apflow.invoice.reference;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Reference Tools Service Application.
 *
 * Serves the supplier, bank and purchase-order checks and the invoice ledger
 * over POST /api/tools/{toolName}.
 */
@SpringBootApplication
public class ReferenceToolsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReferenceToolsApplication.class, args);
    }
}
