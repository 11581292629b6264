package com.apflow.invoice.reference.tools;

import com.apflow.invoice.tools.ToolNames;
import com.apflow.invoice.tools.dto.BankCheckRequest;
import com.apflow.invoice.tools.dto.CreateRecordRequest;
import com.apflow.invoice.tools.dto.EntityLookupRequest;
import com.apflow.invoice.tools.dto.NationalIdCheckRequest;
import com.apflow.invoice.tools.dto.PurchaseOrderCheckRequest;
import com.apflow.invoice.tools.dto.TaxIdCheckRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes a named tool call with a JSON argument document to the tool service
 * and renders the result as JSON.
 */
@Component
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final ReferenceToolService toolService;
    private final ObjectMapper objectMapper;

    public ToolDispatcher(ReferenceToolService toolService) {
        this.toolService = toolService;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * @throws UnknownToolException if no tool has this name
     * @throws IllegalArgumentException if the arguments are malformed or a required one is missing
     */
    public String dispatch(String toolName, String argumentsJson) {
        log.debug("Tool call - tool={}", toolName);
        Object result;
        switch (toolName) {
            case ToolNames.VALIDATE_TAX_ID: {
                TaxIdCheckRequest request = read(argumentsJson, TaxIdCheckRequest.class);
                result = toolService.validateTaxId(require(request.getTaxId(), "taxId"), request.getSupplierName());
                break;
            }
            case ToolNames.VALIDATE_NATIONAL_ID: {
                NationalIdCheckRequest request = read(argumentsJson, NationalIdCheckRequest.class);
                result = toolService.validateNationalId(require(request.getNationalId(), "nationalId"));
                break;
            }
            case ToolNames.VALIDATE_SUPPLIER_BANK: {
                BankCheckRequest request = read(argumentsJson, BankCheckRequest.class);
                result = toolService.validateSupplierBank(require(request.getAccountNumber(), "accountNumber"),
                    require(request.getRoutingCode(), "routingCode"), request.getSupplierName());
                break;
            }
            case ToolNames.VALIDATE_PURCHASE_ORDER: {
                PurchaseOrderCheckRequest request = read(argumentsJson, PurchaseOrderCheckRequest.class);
                result = toolService.validatePurchaseOrder(require(request.getReference(), "reference"));
                break;
            }
            case ToolNames.LOOKUP_SUPPLIER: {
                EntityLookupRequest request = read(argumentsJson, EntityLookupRequest.class);
                result = toolService.lookupSupplier(require(request.getName(), "name"));
                break;
            }
            case ToolNames.CREATE_INVOICE_RECORD: {
                CreateRecordRequest request = read(argumentsJson, CreateRecordRequest.class);
                String key = require(request.getIdempotencyKey(), "idempotencyKey");
                if (request.getInvoice() == null) {
                    throw new IllegalArgumentException("Missing required argument: invoice");
                }
                require(request.getInvoice().getInvoiceNumber(), "invoice.invoiceNumber");
                require(request.getInvoice().getSupplierName(), "invoice.supplierName");
                result = toolService.createInvoiceRecord(request.getInvoice(), key);
                break;
            }
            default:
                throw new UnknownToolException(toolName);
        }
        return write(result);
    }

    private <T> T read(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Missing tool arguments");
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed tool arguments: " + e.getOriginalMessage(), e);
        }
    }

    private String write(Object result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render tool result", e);
        }
    }

    private static String require(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required argument: " + name);
        }
        return value;
    }
}
