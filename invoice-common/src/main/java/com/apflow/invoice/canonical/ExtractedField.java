package com.apflow.invoice.canonical;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * One field produced by the upstream extractor together with the extractor's
 * own confidence in it.
 *
 * A field is either present (value and confidence both set) or explicitly
 * absent (neither set). Absent fields are never defaulted to zero or empty.
 *
 * @param <T> value type (String, BigDecimal, LocalDate, line items)
 */
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExtractedField<T> {

    private static final ExtractedField<?> ABSENT = new ExtractedField<>(null, null);

    private final T value;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final Double confidence;

    @JsonCreator
    ExtractedField(@JsonProperty("value") T value, @JsonProperty("confidence") Double confidence) {
        this.value = value;
        this.confidence = confidence;
    }

    /**
     * Create a present field.
     *
     * @throws IllegalArgumentException if the value is null or the confidence is outside [0, 1]
     */
    public static <T> ExtractedField<T> of(T value, double confidence) {
        if (value == null) {
            throw new IllegalArgumentException("Present field requires a value; use absent() instead");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Extraction confidence must be within [0.0, 1.0]: " + confidence);
        }
        return new ExtractedField<>(value, confidence);
    }

    @SuppressWarnings("unchecked")
    public static <T> ExtractedField<T> absent() {
        return (ExtractedField<T>) ABSENT;
    }

    public T getValue() {
        return value;
    }

    public Double getConfidence() {
        return confidence;
    }

    @JsonIgnore
    public boolean isPresent() {
        return value != null;
    }

    /**
     * Extraction confidence, or 0.0 for an absent field.
     */
    @JsonIgnore
    public double confidenceOrZero() {
        return isPresent() && confidence != null ? confidence : 0.0;
    }

    /**
     * A deserialized field must either carry both value and confidence or neither.
     */
    @JsonIgnore
    public boolean isConsistent() {
        return (value == null) == (confidence == null);
    }
}
