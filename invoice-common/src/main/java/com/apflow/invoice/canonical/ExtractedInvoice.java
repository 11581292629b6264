package com.apflow.invoice.canonical;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical extracted invoice, as produced by the upstream extraction stage.
 *
 * Immutable. Every extracted field is an {@link ExtractedField}; a field that
 * the extractor did not produce (or that arrived as JSON null) is normalised to
 * {@link ExtractedField#absent()} and never defaulted to zero or empty.
 *
 * The submission id is optional. When supplied it identifies the submission
 * across re-submissions and becomes the pipeline run id.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExtractedInvoice {

    private final String submissionId;

    // Supplier identity
    private final ExtractedField<String> supplierName;
    private final ExtractedField<String> taxId;
    private final ExtractedField<String> nationalId;
    private final ExtractedField<String> bankAccountNumber;
    private final ExtractedField<String> bankRoutingCode;

    // Invoice header
    private final ExtractedField<String> purchaseOrderRef;
    private final ExtractedField<String> invoiceNumber;
    private final ExtractedField<LocalDate> invoiceDate;
    private final ExtractedField<List<LineItem>> lineItems;

    // Amounts
    private final ExtractedField<String> currency;
    private final ExtractedField<BigDecimal> netAmount;
    private final ExtractedField<BigDecimal> taxAmount;
    private final ExtractedField<BigDecimal> totalAmount;

    @Builder(toBuilder = true)
    @Jacksonized
    private ExtractedInvoice(String submissionId,
                             ExtractedField<String> supplierName,
                             ExtractedField<String> taxId,
                             ExtractedField<String> nationalId,
                             ExtractedField<String> bankAccountNumber,
                             ExtractedField<String> bankRoutingCode,
                             ExtractedField<String> purchaseOrderRef,
                             ExtractedField<String> invoiceNumber,
                             ExtractedField<LocalDate> invoiceDate,
                             ExtractedField<List<LineItem>> lineItems,
                             ExtractedField<String> currency,
                             ExtractedField<BigDecimal> netAmount,
                             ExtractedField<BigDecimal> taxAmount,
                             ExtractedField<BigDecimal> totalAmount) {
        this.submissionId = submissionId;
        this.supplierName = normalise(supplierName);
        this.taxId = normalise(taxId);
        this.nationalId = normalise(nationalId);
        this.bankAccountNumber = normalise(bankAccountNumber);
        this.bankRoutingCode = normalise(bankRoutingCode);
        this.purchaseOrderRef = normalise(purchaseOrderRef);
        this.invoiceNumber = normalise(invoiceNumber);
        this.invoiceDate = normalise(invoiceDate);
        this.lineItems = normalise(lineItems);
        this.currency = normalise(currency);
        this.netAmount = normalise(netAmount);
        this.taxAmount = normalise(taxAmount);
        this.totalAmount = normalise(totalAmount);
    }

    private static <T> ExtractedField<T> normalise(ExtractedField<T> field) {
        return field == null ? ExtractedField.absent() : field;
    }

    /**
     * All extracted fields keyed by their canonical field name, in declaration order.
     */
    @JsonIgnore
    public Map<String, ExtractedField<?>> fields() {
        Map<String, ExtractedField<?>> fields = new LinkedHashMap<>();
        fields.put("supplierName", supplierName);
        fields.put("taxId", taxId);
        fields.put("nationalId", nationalId);
        fields.put("bankAccountNumber", bankAccountNumber);
        fields.put("bankRoutingCode", bankRoutingCode);
        fields.put("purchaseOrderRef", purchaseOrderRef);
        fields.put("invoiceNumber", invoiceNumber);
        fields.put("invoiceDate", invoiceDate);
        fields.put("lineItems", lineItems);
        fields.put("currency", currency);
        fields.put("netAmount", netAmount);
        fields.put("taxAmount", taxAmount);
        fields.put("totalAmount", totalAmount);
        return Collections.unmodifiableMap(fields);
    }

    @JsonIgnore
    public String supplierNameValue() {
        return supplierName.getValue();
    }

    @JsonIgnore
    public String invoiceNumberValue() {
        return invoiceNumber.getValue();
    }

    @JsonIgnore
    public List<LineItem> lineItemsOrEmpty() {
        return lineItems.isPresent() ? lineItems.getValue() : Collections.emptyList();
    }
}
