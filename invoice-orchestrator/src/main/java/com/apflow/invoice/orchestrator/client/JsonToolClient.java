package com.apflow.invoice.orchestrator.client;

import com.apflow.invoice.canonical.CanonicalJson;
import com.apflow.invoice.canonical.VerificationOutcome;
import com.apflow.invoice.canonical.enums.CheckKind;
import com.apflow.invoice.canonical.enums.VerificationResult;
import com.apflow.invoice.tools.ReferenceToolClient;
import com.apflow.invoice.tools.ToolNames;
import com.apflow.invoice.tools.ToolProtocolException;
import com.apflow.invoice.tools.dto.BankCheckRequest;
import com.apflow.invoice.tools.dto.CheckToolResponse;
import com.apflow.invoice.tools.dto.CreateRecordRequest;
import com.apflow.invoice.tools.dto.EntityCandidate;
import com.apflow.invoice.tools.dto.EntityLookupRequest;
import com.apflow.invoice.tools.dto.EntityLookupResponse;
import com.apflow.invoice.tools.dto.InvoiceRecordPayload;
import com.apflow.invoice.tools.dto.NationalIdCheckRequest;
import com.apflow.invoice.tools.dto.PurchaseOrderCheckRequest;
import com.apflow.invoice.tools.dto.RecordCreationResult;
import com.apflow.invoice.tools.dto.TaxIdCheckRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Reference tool client speaking the JSON tool protocol.
 *
 * Responses are parsed strictly: unknown fields, unknown status values,
 * missing required fields and malformed JSON all raise
 * {@link ToolProtocolException}.
 */
public class JsonToolClient implements ReferenceToolClient {

    private static final Logger log = LoggerFactory.getLogger(JsonToolClient.class);

    private final ToolTransport transport;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public JsonToolClient(ToolTransport transport, Clock clock) {
        this.transport = transport;
        this.clock = clock;
        this.objectMapper = CanonicalJson.newStrictMapper();
    }

    @Override
    public VerificationOutcome checkTaxId(String taxId, String supplierHint) {
        return check(CheckKind.TAX_ID, ToolNames.VALIDATE_TAX_ID,
            TaxIdCheckRequest.builder().taxId(taxId).supplierName(supplierHint).build());
    }

    @Override
    public VerificationOutcome checkNationalId(String nationalId) {
        return check(CheckKind.NATIONAL_ID, ToolNames.VALIDATE_NATIONAL_ID,
            NationalIdCheckRequest.builder().nationalId(nationalId).build());
    }

    @Override
    public VerificationOutcome checkBankAccount(String accountNumber, String routingCode, String supplierHint) {
        return check(CheckKind.BANK_ACCOUNT, ToolNames.VALIDATE_SUPPLIER_BANK,
            BankCheckRequest.builder()
                .accountNumber(accountNumber)
                .routingCode(routingCode)
                .supplierName(supplierHint)
                .build());
    }

    @Override
    public VerificationOutcome checkPurchaseOrder(String reference) {
        return check(CheckKind.PURCHASE_ORDER, ToolNames.VALIDATE_PURCHASE_ORDER,
            PurchaseOrderCheckRequest.builder().reference(reference).build());
    }

    @Override
    public List<EntityCandidate> lookupEntity(String name) {
        EntityLookupResponse response = call(ToolNames.LOOKUP_SUPPLIER,
            EntityLookupRequest.builder().name(name).build(), EntityLookupResponse.class);
        if (response.getCandidates() == null) {
            throw new ToolProtocolException(ToolNames.LOOKUP_SUPPLIER, "response has no candidates list");
        }
        for (EntityCandidate candidate : response.getCandidates()) {
            if (candidate == null || isBlank(candidate.getSupplierId()) || isBlank(candidate.getName())) {
                throw new ToolProtocolException(ToolNames.LOOKUP_SUPPLIER, "candidate without supplierId or name");
            }
        }
        return response.getCandidates();
    }

    @Override
    public RecordCreationResult createRecord(InvoiceRecordPayload payload, String idempotencyKey) {
        RecordCreationResult result = call(ToolNames.CREATE_INVOICE_RECORD,
            CreateRecordRequest.builder().idempotencyKey(idempotencyKey).invoice(payload).build(),
            RecordCreationResult.class);
        if (result.getStatus() == null) {
            throw new ToolProtocolException(ToolNames.CREATE_INVOICE_RECORD, "response has no status");
        }
        if (result.isSuccessful() && isBlank(result.getRecordId())) {
            throw new ToolProtocolException(ToolNames.CREATE_INVOICE_RECORD,
                "status " + result.getStatus().getValue() + " without recordId");
        }
        if (result.getStatus() == RecordCreationResult.Status.REJECTED && isBlank(result.getRejectionCode())) {
            throw new ToolProtocolException(ToolNames.CREATE_INVOICE_RECORD, "REJECTED without rejectionCode");
        }
        return result;
    }

    private VerificationOutcome check(CheckKind kind, String toolName, Object request) {
        long startedAt = clock.millis();
        CheckToolResponse response = call(toolName, request, CheckToolResponse.class);
        if (response.getStatus() == null) {
            throw new ToolProtocolException(toolName, "response has no status");
        }
        return VerificationOutcome.builder()
            .checkKind(kind)
            .result(toResult(response.getStatus()))
            .canonicalValue(response.getCanonicalValue())
            .message(response.getMessage())
            .attempts(1)
            .latencyMillis(clock.millis() - startedAt)
            .checkedAt(clock.instant())
            .build();
    }

    private <T> T call(String toolName, Object request, Class<T> responseType) {
        String requestJson;
        try {
            requestJson = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request for tool " + toolName, e);
        }

        String responseJson = transport.invoke(toolName, requestJson);
        if (responseJson == null || responseJson.isBlank()) {
            throw new ToolProtocolException(toolName, "empty response");
        }

        try {
            T response = objectMapper.readValue(responseJson, responseType);
            if (response == null) {
                throw new ToolProtocolException(toolName, "null response");
            }
            return response;
        } catch (JsonProcessingException e) {
            log.debug("Unparseable tool response - tool={}, body={}", toolName, responseJson);
            throw new ToolProtocolException(toolName, "malformed response: " + e.getOriginalMessage(), e);
        }
    }

    private static VerificationResult toResult(CheckToolResponse.Status status) {
        switch (status) {
            case MATCH:
                return VerificationResult.MATCH;
            case MISMATCH:
                return VerificationResult.MISMATCH;
            case NOT_FOUND:
                return VerificationResult.NOT_FOUND;
            default:
                throw new IllegalArgumentException("Unhandled status " + status);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
