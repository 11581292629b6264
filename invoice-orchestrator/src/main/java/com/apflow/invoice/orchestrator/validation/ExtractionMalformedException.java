package com.apflow.invoice.orchestrator.validation;

/**
 * The extracted invoice cannot enter the pipeline: a mandatory identity field
 * is missing or a field breaks the value/confidence contract.
 */
public class ExtractionMalformedException extends RuntimeException {

    public ExtractionMalformedException(String message) {
        super(message);
    }
}
