package com.apflow.invoice.reference.tools;

import com.apflow.invoice.reference.data.PurchaseOrder;
import com.apflow.invoice.reference.data.ReferenceDataStore;
import com.apflow.invoice.reference.data.Supplier;
import com.apflow.invoice.reference.ledger.InvoiceLedgerService;
import com.apflow.invoice.tools.dto.CheckToolResponse;
import com.apflow.invoice.tools.dto.EntityCandidate;
import com.apflow.invoice.tools.dto.EntityLookupResponse;
import com.apflow.invoice.tools.dto.InvoiceRecordPayload;
import com.apflow.invoice.tools.dto.RecordCreationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reference-data checks and record creation behind the tool endpoint.
 *
 * Supplier hints are resolved by exact (case- and spacing-insensitive) name;
 * a hint that does not resolve is ignored.
 */
@Slf4j
@Service
public class ReferenceToolService {

    private final ReferenceDataStore referenceData;
    private final InvoiceLedgerService ledger;

    public ReferenceToolService(ReferenceDataStore referenceData, InvoiceLedgerService ledger) {
        this.referenceData = referenceData;
        this.ledger = ledger;
    }

    public CheckToolResponse validateTaxId(String taxId, String supplierName) {
        Optional<Supplier> registered = referenceData.findSupplierByTaxId(taxId);
        Optional<Supplier> hinted = referenceData.findSupplierByExactName(supplierName);

        if (registered.isPresent()) {
            if (hinted.isPresent() && !hinted.get().getSupplierId().equals(registered.get().getSupplierId())) {
                return mismatch(hinted.get().getTaxId(), "VAT " + taxId + " is registered to "
                    + registered.get().getName() + ", not " + hinted.get().getName());
            }
            return match(registered.get().getTaxId(), "VAT " + taxId + " is registered to "
                + registered.get().getName());
        }
        if (hinted.isPresent()) {
            return mismatch(hinted.get().getTaxId(), "VAT " + taxId + " is not registered; "
                + hinted.get().getName() + " is registered with " + hinted.get().getTaxId());
        }
        return notFound("VAT " + taxId + " is not registered");
    }

    public CheckToolResponse validateNationalId(String nationalId) {
        return referenceData.findSupplierByNationalId(nationalId)
            .map(s -> match(s.getNationalId(), "SIRET " + nationalId + " belongs to " + s.getName()))
            .orElseGet(() -> notFound("SIRET " + nationalId + " is not registered"));
    }

    public CheckToolResponse validateSupplierBank(String accountNumber, String routingCode, String supplierName) {
        Optional<Supplier> owner = referenceData.findSupplierByBankDetails(accountNumber, routingCode);
        Optional<Supplier> hinted = referenceData.findSupplierByExactName(supplierName);

        if (hinted.isPresent()) {
            Supplier expected = hinted.get();
            if (owner.isPresent() && owner.get().getSupplierId().equals(expected.getSupplierId())) {
                return match(bankDetails(expected), "bank details belong to " + expected.getName());
            }
            String detail = owner
                .map(o -> "bank details belong to " + o.getName() + ", not " + expected.getName())
                .orElse("bank details do not match the registered details of " + expected.getName());
            return mismatch(bankDetails(expected), detail);
        }
        return owner
            .map(o -> match(bankDetails(o), "bank details belong to " + o.getName()))
            .orElseGet(() -> notFound("no registered supplier uses these bank details"));
    }

    public CheckToolResponse validatePurchaseOrder(String reference) {
        Optional<PurchaseOrder> po = referenceData.findPurchaseOrder(reference);
        if (po.isEmpty()) {
            return notFound("PO " + reference + " not found");
        }
        PurchaseOrder order = po.get();
        if (order.getStatus() != null && order.getStatus().isReceivable()) {
            return match(order.getPoNumber(), "PO " + order.getPoNumber() + " is " + order.getStatus().getValue()
                + " (amount: " + order.getTotalAmount() + " " + order.getCurrency() + ")");
        }
        String status = order.getStatus() == null ? "unknown" : order.getStatus().getValue();
        return mismatch(null, "PO " + order.getPoNumber() + " exists but status is '" + status
            + "', cannot receive invoices");
    }

    public EntityLookupResponse lookupSupplier(String name) {
        List<EntityCandidate> candidates = referenceData.searchSuppliersByName(name).stream()
            .map(ReferenceToolService::toCandidate)
            .collect(Collectors.toList());
        log.debug("Supplier lookup - name={}, candidates={}", name, candidates.size());
        return EntityLookupResponse.builder().candidates(candidates).build();
    }

    public RecordCreationResult createInvoiceRecord(InvoiceRecordPayload payload, String idempotencyKey) {
        return ledger.createRecord(payload, idempotencyKey);
    }

    private static EntityCandidate toCandidate(Supplier supplier) {
        return EntityCandidate.builder()
            .supplierId(supplier.getSupplierId())
            .name(supplier.getName())
            .taxId(supplier.getTaxId())
            .nationalId(supplier.getNationalId())
            .accountNumber(supplier.getAccountNumber())
            .routingCode(supplier.getRoutingCode())
            .build();
    }

    static String bankDetails(Supplier supplier) {
        return supplier.getAccountNumber() + " / " + supplier.getRoutingCode();
    }

    private static CheckToolResponse match(String canonicalValue, String message) {
        return respond(CheckToolResponse.Status.MATCH, canonicalValue, message);
    }

    private static CheckToolResponse mismatch(String canonicalValue, String message) {
        return respond(CheckToolResponse.Status.MISMATCH, canonicalValue, message);
    }

    private static CheckToolResponse notFound(String message) {
        return respond(CheckToolResponse.Status.NOT_FOUND, null, message);
    }

    private static CheckToolResponse respond(CheckToolResponse.Status status, String canonicalValue, String message) {
        return CheckToolResponse.builder().status(status).canonicalValue(canonicalValue).message(message).build();
    }
}
