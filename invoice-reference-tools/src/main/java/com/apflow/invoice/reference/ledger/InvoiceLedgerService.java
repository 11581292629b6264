package com.apflow.invoice.reference.ledger;

import com.apflow.invoice.reference.data.PurchaseOrder;
import com.apflow.invoice.reference.data.ReferenceDataStore;
import com.apflow.invoice.reference.data.Supplier;
import com.apflow.invoice.tools.dto.InvoiceRecordPayload;
import com.apflow.invoice.tools.dto.RecordCreationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Invoice ledger of the system of record.
 *
 * Record creation is idempotent per key: replaying a key returns the record
 * created the first time as DUPLICATE and posts nothing new.
 */
@Slf4j
@Service
public class InvoiceLedgerService {

    public static final String UNKNOWN_SUPPLIER = "UNKNOWN_SUPPLIER";
    public static final String PO_NOT_FOUND = "PO_NOT_FOUND";
    public static final String PO_NOT_RECEIVABLE = "PO_NOT_RECEIVABLE";
    public static final String DUPLICATE_INVOICE = "DUPLICATE_INVOICE";

    private final ReferenceDataStore referenceData;
    private final IdempotencyRegistry idempotencyRegistry;
    private final Clock clock;

    // recordId -> record
    private final Map<String, ErpInvoiceRecord> records = new ConcurrentHashMap<>();

    @Autowired
    public InvoiceLedgerService(ReferenceDataStore referenceData, IdempotencyRegistry idempotencyRegistry) {
        this(referenceData, idempotencyRegistry, Clock.systemUTC());
    }

    public InvoiceLedgerService(ReferenceDataStore referenceData, IdempotencyRegistry idempotencyRegistry,
                                Clock clock) {
        this.referenceData = referenceData;
        this.idempotencyRegistry = idempotencyRegistry;
        this.clock = clock;
    }

    /**
     * Post an invoice.
     *
     * Synchronized so that the idempotency check and the insert are atomic.
     */
    public synchronized RecordCreationResult createRecord(InvoiceRecordPayload payload, String idempotencyKey) {
        Optional<String> replayed = idempotencyRegistry.findRecordId(idempotencyKey);
        if (replayed.isPresent()) {
            log.info("Idempotent replay - key={}, recordId={}", idempotencyKey, replayed.get());
            return RecordCreationResult.duplicate(replayed.get());
        }

        Optional<Supplier> supplier = resolveSupplier(payload);
        if (supplier.isEmpty()) {
            return reject(idempotencyKey, UNKNOWN_SUPPLIER,
                "Cannot create invoice: supplier " + describeSupplier(payload) + " not found");
        }

        Optional<PurchaseOrder> po = referenceData.findPurchaseOrder(payload.getPurchaseOrderRef());
        if (po.isEmpty()) {
            return reject(idempotencyKey, PO_NOT_FOUND,
                "Cannot create invoice: PO " + payload.getPurchaseOrderRef() + " not found");
        }
        if (po.get().getStatus() == null || !po.get().getStatus().isReceivable()) {
            return reject(idempotencyKey, PO_NOT_RECEIVABLE,
                "Cannot create invoice: PO " + po.get().getPoNumber() + " is '"
                    + (po.get().getStatus() == null ? "unknown" : po.get().getStatus().getValue()) + "'");
        }

        String supplierId = supplier.get().getSupplierId();
        if (isAlreadyPosted(supplierId, payload.getInvoiceNumber())) {
            return reject(idempotencyKey, DUPLICATE_INVOICE,
                "Cannot create invoice: invoice " + payload.getInvoiceNumber()
                    + " is already posted for supplier " + supplier.get().getName());
        }

        String recordId = newRecordId();
        ErpInvoiceRecord record = ErpInvoiceRecord.builder()
            .recordId(recordId)
            .idempotencyKey(idempotencyKey)
            .supplierId(supplierId)
            .poNumber(po.get().getPoNumber())
            .invoiceNumber(payload.getInvoiceNumber())
            .invoiceDate(payload.getInvoiceDate())
            .netAmount(payload.getNetAmount())
            .taxAmount(payload.getTaxAmount())
            .totalAmount(payload.getTotalAmount())
            .currency(payload.getCurrency() == null ? "EUR" : payload.getCurrency())
            .status("posted")
            .createdAt(Instant.now(clock))
            .build();
        records.put(recordId, record);
        idempotencyRegistry.register(idempotencyKey, recordId);

        log.info("Invoice posted - key={}, recordId={}, supplierId={}, invoiceNumber={}",
            idempotencyKey, recordId, supplierId, payload.getInvoiceNumber());
        return RecordCreationResult.created(recordId);
    }

    public Optional<ErpInvoiceRecord> getRecord(String recordId) {
        return Optional.ofNullable(records.get(recordId));
    }

    public List<ErpInvoiceRecord> getAllRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records.values()));
    }

    public int getRecordCount() {
        return records.size();
    }

    private Optional<Supplier> resolveSupplier(InvoiceRecordPayload payload) {
        if (payload.getTaxId() != null) {
            Optional<Supplier> byTaxId = referenceData.findSupplierByTaxId(payload.getTaxId());
            if (byTaxId.isPresent()) {
                return byTaxId;
            }
        }
        return referenceData.findSupplierByExactName(payload.getSupplierName());
    }

    private boolean isAlreadyPosted(String supplierId, String invoiceNumber) {
        String wanted = invoiceNumber == null ? "" : invoiceNumber.trim().toUpperCase(Locale.ROOT);
        return records.values().stream()
            .anyMatch(r -> r.getSupplierId().equals(supplierId)
                && r.getInvoiceNumber() != null
                && r.getInvoiceNumber().trim().toUpperCase(Locale.ROOT).equals(wanted));
    }

    private static RecordCreationResult reject(String idempotencyKey, String code, String message) {
        log.warn("Invoice rejected by ledger - key={}, code={}, message={}", idempotencyKey, code, message);
        return RecordCreationResult.rejected(code, message);
    }

    private static String describeSupplier(InvoiceRecordPayload payload) {
        return payload.getTaxId() != null ? "with VAT " + payload.getTaxId() : "'" + payload.getSupplierName() + "'";
    }

    private static String newRecordId() {
        return "ERP-INV-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
    }
}
