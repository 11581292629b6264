package com.apflow.invoice.reference.data;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory supplier and purchase-order master data.
 *
 * Read-only after construction. Only active suppliers are visible to lookups.
 */
@Slf4j
@Component
public class ReferenceDataStore {

    private final List<Supplier> suppliers;
    private final Map<String, Supplier> suppliersById = new HashMap<>();
    private final Map<String, Supplier> suppliersByTaxId = new HashMap<>();
    private final Map<String, Supplier> suppliersByNationalId = new HashMap<>();
    private final Map<String, PurchaseOrder> purchaseOrders = new HashMap<>();

    @Autowired
    public ReferenceDataStore() {
        this(new ReferenceDataLoader().load());
    }

    public ReferenceDataStore(ReferenceDataSet dataSet) {
        List<Supplier> active = new ArrayList<>();
        for (Supplier supplier : dataSet.getSuppliers()) {
            if (!supplier.isActive()) {
                continue;
            }
            active.add(supplier);
            suppliersById.put(supplier.getSupplierId(), supplier);
            suppliersByTaxId.put(normaliseCode(supplier.getTaxId()), supplier);
            suppliersByNationalId.put(normaliseCode(supplier.getNationalId()), supplier);
        }
        this.suppliers = Collections.unmodifiableList(active);
        for (PurchaseOrder po : dataSet.getPurchaseOrders()) {
            purchaseOrders.put(normaliseCode(po.getPoNumber()), po);
        }
        log.info("Reference data ready - suppliers={}, purchaseOrders={}", suppliers.size(), purchaseOrders.size());
    }

    public Optional<Supplier> findSupplierById(String supplierId) {
        return Optional.ofNullable(suppliersById.get(supplierId));
    }

    public Optional<Supplier> findSupplierByTaxId(String taxId) {
        return Optional.ofNullable(suppliersByTaxId.get(normaliseCode(taxId)));
    }

    public Optional<Supplier> findSupplierByNationalId(String nationalId) {
        return Optional.ofNullable(suppliersByNationalId.get(normaliseCode(nationalId)));
    }

    /**
     * Supplier whose name equals the given one, ignoring case and spacing.
     */
    public Optional<Supplier> findSupplierByExactName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = normaliseName(name);
        return suppliers.stream()
            .filter(s -> normaliseName(s.getName()).equals(wanted))
            .findFirst();
    }

    /**
     * Suppliers whose name contains the given text, ignoring case.
     */
    public List<Supplier> searchSuppliersByName(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        String wanted = normaliseName(text);
        List<Supplier> matches = new ArrayList<>();
        for (Supplier supplier : suppliers) {
            if (normaliseName(supplier.getName()).contains(wanted)) {
                matches.add(supplier);
            }
        }
        return matches;
    }

    /**
     * Active supplier owning exactly this account and routing code.
     */
    public Optional<Supplier> findSupplierByBankDetails(String accountNumber, String routingCode) {
        String account = normaliseCode(accountNumber);
        String routing = normaliseCode(routingCode);
        return suppliers.stream()
            .filter(s -> normaliseCode(s.getAccountNumber()).equals(account)
                && normaliseCode(s.getRoutingCode()).equals(routing))
            .findFirst();
    }

    public Optional<PurchaseOrder> findPurchaseOrder(String poNumber) {
        return Optional.ofNullable(purchaseOrders.get(normaliseCode(poNumber)));
    }

    public List<Supplier> getSuppliers() {
        return suppliers;
    }

    static String normaliseCode(String code) {
        return code == null ? "" : code.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
    }

    static String normaliseName(String name) {
        return name == null ? "" : name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
