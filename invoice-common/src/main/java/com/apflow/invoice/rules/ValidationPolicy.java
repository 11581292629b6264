package com.apflow.invoice.rules;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Scoring and routing thresholds.
 *
 * Loaded from /config/validation_policy.json; every value has a named default
 * so a partial file is valid.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationPolicy {

    public static final double DEFAULT_PROCEED_THRESHOLD = 0.8;
    public static final double DEFAULT_FIELD_PASS_THRESHOLD = 0.8;
    public static final int DEFAULT_MAX_TOOL_ERRORS_BEFORE_REVIEW = 0;
    public static final BigDecimal DEFAULT_AMOUNT_TOLERANCE = new BigDecimal("0.01");

    /**
     * Overall score must be strictly greater than this to proceed.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Builder.Default
    private double proceedThreshold = DEFAULT_PROCEED_THRESHOLD;

    /**
     * A checked field passes when its confidence is at least this value.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Builder.Default
    private double fieldPassThreshold = DEFAULT_FIELD_PASS_THRESHOLD;

    /**
     * Review is forced once the number of TOOL_ERROR outcomes exceeds this.
     */
    @Min(0)
    @Builder.Default
    private int maxToolErrorsBeforeReview = DEFAULT_MAX_TOOL_ERRORS_BEFORE_REVIEW;

    /**
     * Allowed absolute difference when reconciling invoice amounts.
     */
    @Builder.Default
    private BigDecimal amountTolerance = DEFAULT_AMOUNT_TOLERANCE;

    public static ValidationPolicy defaults() {
        return ValidationPolicy.builder().build();
    }
}
