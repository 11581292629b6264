package com.apflow.invoice.tools;

import com.apflow.invoice.canonical.VerificationOutcome;
import com.apflow.invoice.tools.dto.EntityCandidate;
import com.apflow.invoice.tools.dto.InvoiceRecordPayload;
import com.apflow.invoice.tools.dto.RecordCreationResult;

import java.util.List;

/**
 * Typed client for the reference-data and system-of-record tools.
 *
 * One method per capability. Transport and protocol failures are thrown as
 * {@link ToolException} subtypes; they are never turned into a NOT_FOUND
 * outcome. Only {@link #createRecord} has a side effect.
 */
public interface ReferenceToolClient {

    /**
     * Verify a tax identifier, optionally against the supplier the invoice names.
     */
    VerificationOutcome checkTaxId(String taxId, String supplierHint);

    VerificationOutcome checkNationalId(String nationalId);

    /**
     * Verify that the account and routing code belong to the supplier.
     */
    VerificationOutcome checkBankAccount(String accountNumber, String routingCode, String supplierHint);

    VerificationOutcome checkPurchaseOrder(String reference);

    /**
     * Find registered suppliers whose name matches.
     */
    List<EntityCandidate> lookupEntity(String name);

    /**
     * Create the invoice record in the system of record.
     *
     * Replaying the same idempotency key returns the originally created record
     * as {@code DUPLICATE} instead of creating a second one.
     */
    RecordCreationResult createRecord(InvoiceRecordPayload payload, String idempotencyKey);
}
