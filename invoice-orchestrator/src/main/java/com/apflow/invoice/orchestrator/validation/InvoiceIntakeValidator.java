package com.apflow.invoice.orchestrator.validation;

import com.apflow.invoice.canonical.ExtractedField;
import com.apflow.invoice.canonical.ExtractedInvoice;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks an extracted invoice before any tool is called.
 *
 * Invoice number and supplier name are mandatory. Every field must be either
 * fully present with a confidence in [0, 1] or fully absent.
 */
public class InvoiceIntakeValidator {

    private final Validator validator;

    public InvoiceIntakeValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * @throws ExtractionMalformedException listing every problem found
     */
    public void validate(ExtractedInvoice invoice) {
        List<String> problems = new ArrayList<>();

        requireText(invoice.getInvoiceNumber(), "invoiceNumber", problems);
        requireText(invoice.getSupplierName(), "supplierName", problems);

        for (Map.Entry<String, ExtractedField<?>> entry : invoice.fields().entrySet()) {
            ExtractedField<?> field = entry.getValue();
            if (!field.isConsistent()) {
                problems.add(entry.getKey() + " must carry both a value and a confidence, or neither");
                continue;
            }
            for (ConstraintViolation<?> violation : validator.validate(field)) {
                problems.add(entry.getKey() + "." + violation.getPropertyPath() + " " + violation.getMessage());
            }
        }

        if (!problems.isEmpty()) {
            throw new ExtractionMalformedException(String.join("; ", problems));
        }
    }

    private static void requireText(ExtractedField<String> field, String name, List<String> problems) {
        if (!field.isPresent() || field.getValue().isBlank()) {
            problems.add("mandatory field " + name + " is missing");
        }
    }
}
