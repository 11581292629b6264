package com.apflow.invoice.canonical;

import com.apflow.invoice.canonical.enums.CheckKind;
import com.apflow.invoice.canonical.enums.ToolErrorType;
import com.apflow.invoice.canonical.enums.VerificationResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Result of one reference-data check for one invoice field.
 *
 * A TOOL_ERROR outcome means the check could not be completed (after retries)
 * and carries the error type; it is never a statement about the field itself.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerificationOutcome {

    @NotNull
    CheckKind checkKind;

    @NotNull
    VerificationResult result;

    /**
     * Corrected value from the reference system, when it offered one.
     */
    String canonicalValue;

    String message;

    /**
     * Set only when result is TOOL_ERROR.
     */
    ToolErrorType toolErrorType;

    int attempts;

    long latencyMillis;

    Instant checkedAt;

    public static VerificationOutcome toolError(CheckKind checkKind, ToolErrorType errorType, String message,
                                                int attempts, long latencyMillis, Instant checkedAt) {
        return VerificationOutcome.builder()
            .checkKind(checkKind)
            .result(VerificationResult.TOOL_ERROR)
            .toolErrorType(errorType)
            .message(message)
            .attempts(attempts)
            .latencyMillis(latencyMillis)
            .checkedAt(checkedAt)
            .build();
    }
}
