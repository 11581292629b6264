package com.apflow.invoice.orchestrator.report;

import com.apflow.invoice.canonical.AggregatedConfidence;
import com.apflow.invoice.canonical.ExtractedField;
import com.apflow.invoice.canonical.ExtractedInvoice;
import com.apflow.invoice.canonical.FieldAssessment;
import com.apflow.invoice.canonical.ReportEntry;
import com.apflow.invoice.canonical.RunReport;
import com.apflow.invoice.canonical.enums.CheckKind;
import com.apflow.invoice.canonical.enums.RunReportType;
import com.apflow.invoice.orchestrator.state.PipelineRun;
import com.apflow.invoice.tools.dto.RecordCreationResult;

import java.time.Clock;
import java.time.Instant;

/**
 * Builds the report attached to a terminal pipeline run.
 */
public class ReportFactory {

    static final String REJECTION_RECOMMENDATION = "Please verify the following fields with the supplier and "
        + "update ERP master data if needed before resubmitting the invoice.";
    static final String REVIEW_RECOMMENDATION = "Review the listed fields manually; unresolved checks could not "
        + "be completed against the reference systems and were not counted in the score.";
    static final String RESUBMIT_RECOMMENDATION = "Resubmit the invoice with the same submission id; record "
        + "creation is idempotent and will not post the invoice twice.";
    static final String FIX_EXTRACTION_RECOMMENDATION = "Correct the extraction and submit the invoice again.";

    private final Clock clock;

    public ReportFactory(Clock clock) {
        this.clock = clock;
    }

    public RunReport accepted(PipelineRun run, RecordCreationResult result) {
        return base(run, RunReportType.ACCEPTED)
            .createdRecordId(result.getRecordId())
            .recommendation(result.getStatus() == RecordCreationResult.Status.DUPLICATE
                ? "Invoice was already posted by an earlier attempt as " + result.getRecordId()
                : "Invoice posted as " + result.getRecordId())
            .build();
    }

    /**
     * Rejection after scoring: lists every definitively failed field.
     */
    public RunReport rejection(PipelineRun run) {
        RunReport.RunReportBuilder report = base(run, RunReportType.REJECTION)
            .ruleViolations(run.getRuleViolations())
            .recommendation(REJECTION_RECOMMENDATION);
        AggregatedConfidence confidence = run.getConfidence();
        for (FieldAssessment assessment : confidence.getAssessments().values()) {
            if (!assessment.isUnresolved() && !assessment.isPassed()) {
                report.entry(entry(run.getInvoice(), assessment));
            }
        }
        return report.build();
    }

    /**
     * Rejection by the system of record when creating the invoice.
     */
    public RunReport recordRejected(PipelineRun run, RecordCreationResult result) {
        return base(run, RunReportType.REJECTION)
            .entry(ReportEntry.builder()
                .field("invoice")
                .extractedValue(run.getInvoice().invoiceNumberValue())
                .reason("rejected by system of record: " + result.getRejectionCode() + " - " + result.getMessage())
                .build())
            .recommendation(REJECTION_RECOMMENDATION)
            .build();
    }

    public RunReport reviewRequired(PipelineRun run) {
        AggregatedConfidence confidence = run.getConfidence();
        RunReport.RunReportBuilder report = base(run, RunReportType.REVIEW_REQUIRED)
            .unresolvedFields(confidence.getUnresolvedFields())
            .ruleViolations(run.getRuleViolations())
            .recommendation(REVIEW_RECOMMENDATION);
        for (FieldAssessment assessment : confidence.getAssessments().values()) {
            if (!assessment.isPassed()) {
                report.entry(entry(run.getInvoice(), assessment));
            }
        }
        return report.build();
    }

    public RunReport failure(PipelineRun run, String reason, boolean outcomeUnknown) {
        return base(run, RunReportType.FAILURE)
            .entry(ReportEntry.builder().field("run").reason(reason).build())
            .recommendation(outcomeUnknown ? RESUBMIT_RECOMMENDATION : FIX_EXTRACTION_RECOMMENDATION)
            .build();
    }

    public RunReport cancelled(PipelineRun run) {
        return base(run, RunReportType.CANCELLED)
            .recommendation("Run cancelled before finalization; nothing was posted.")
            .build();
    }

    private RunReport.RunReportBuilder base(PipelineRun run, RunReportType type) {
        ExtractedInvoice invoice = run.getInvoice();
        AggregatedConfidence confidence = run.getConfidence();
        return RunReport.builder()
            .type(type)
            .runId(run.getRunId())
            .invoiceNumber(invoice.invoiceNumberValue())
            .supplierName(invoice.supplierNameValue())
            .overallScore(confidence == null ? null : confidence.getOverallScore())
            .generatedAt(Instant.now(clock));
    }

    private static ReportEntry entry(ExtractedInvoice invoice, FieldAssessment assessment) {
        return ReportEntry.builder()
            .field(assessment.getFieldName())
            .extractedValue(extractedValue(invoice, assessment.getCheckKind()))
            .reason(assessment.getReason())
            .suggestedCorrection(assessment.getSuggestedCorrection())
            .build();
    }

    private static String extractedValue(ExtractedInvoice invoice, CheckKind kind) {
        switch (kind) {
            case TAX_ID:
                return valueOf(invoice.getTaxId());
            case NATIONAL_ID:
                return valueOf(invoice.getNationalId());
            case BANK_ACCOUNT:
                if (!invoice.getBankAccountNumber().isPresent() && !invoice.getBankRoutingCode().isPresent()) {
                    return null;
                }
                return valueOf(invoice.getBankAccountNumber()) + " / " + valueOf(invoice.getBankRoutingCode());
            case PURCHASE_ORDER:
                return valueOf(invoice.getPurchaseOrderRef());
            default:
                return null;
        }
    }

    private static String valueOf(ExtractedField<String> field) {
        return field.isPresent() ? field.getValue() : null;
    }
}
