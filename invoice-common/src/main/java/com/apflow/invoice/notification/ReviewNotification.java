package com.apflow.invoice.notification;

import com.apflow.invoice.canonical.RunReport;
import com.apflow.invoice.canonical.enums.RoutingOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Message telling a user that an invoice was rejected or needs review.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReviewNotification {
    String runId;
    int attempt;
    RoutingOutcome outcome;
    String invoiceNumber;
    String supplierName;
    String summary;
    RunReport report;
    Instant sentAt;
}
