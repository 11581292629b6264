package com.apflow.invoice.rules;

import com.apflow.invoice.canonical.AggregatedConfidence;
import com.apflow.invoice.canonical.ExtractedField;
import com.apflow.invoice.canonical.ExtractedInvoice;
import com.apflow.invoice.canonical.FieldAssessment;
import com.apflow.invoice.canonical.VerificationOutcome;
import com.apflow.invoice.canonical.enums.CheckKind;
import com.apflow.invoice.canonical.enums.VerificationResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.apflow.invoice.rules.InvoiceFixtures.invoiceWithConfidence;
import static com.apflow.invoice.rules.InvoiceFixtures.mismatch;
import static com.apflow.invoice.rules.InvoiceFixtures.outcome;
import static com.apflow.invoice.rules.InvoiceFixtures.toolError;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConfidenceAggregatorTest {

    private final ConfidenceAggregator aggregator = new ConfidenceAggregator(ValidationPolicy.defaults());

    private static List<VerificationOutcome> allMatch() {
        List<VerificationOutcome> outcomes = new ArrayList<>();
        for (CheckKind kind : CheckKind.values()) {
            outcomes.add(outcome(kind, VerificationResult.MATCH));
        }
        return outcomes;
    }

    @Test
    public void testFourMatchesAtSameConfidenceScoreThatConfidence() {
        AggregatedConfidence result = aggregator.aggregate(invoiceWithConfidence(0.95), allMatch());

        assertEquals(0.95, result.getOverallScore(), 1e-9);
        assertTrue(result.allCheckedFieldsPass());
        assertFalse(result.hasDefinitiveFailure());
        assertFalse(result.isReviewForced());
        assertTrue(result.getFailureReasons().isEmpty());
    }

    @Test
    public void testMismatchScoresZeroAndCarriesSuggestedCorrection() {
        List<VerificationOutcome> outcomes = List.of(
            mismatch(CheckKind.TAX_ID, "FR82123456789"),
            outcome(CheckKind.NATIONAL_ID, VerificationResult.MATCH),
            outcome(CheckKind.BANK_ACCOUNT, VerificationResult.MATCH),
            outcome(CheckKind.PURCHASE_ORDER, VerificationResult.MATCH));

        AggregatedConfidence result = aggregator.aggregate(invoiceWithConfidence(0.9), outcomes);

        assertEquals(0.675, result.getOverallScore(), 1e-9);
        FieldAssessment taxId = result.getAssessments().get(CheckKind.TAX_ID);
        assertEquals(0.0, taxId.getConfidence());
        assertFalse(taxId.isPassed());
        assertEquals("FR82123456789", taxId.getSuggestedCorrection());
        assertTrue(result.hasDefinitiveFailure());
        assertEquals(1, result.getFailureReasons().size());
    }

    @Test
    public void testToolErrorIsExcludedFromMeanAndMarkedUnresolved() {
        List<VerificationOutcome> outcomes = List.of(
            outcome(CheckKind.TAX_ID, VerificationResult.MATCH),
            outcome(CheckKind.NATIONAL_ID, VerificationResult.MATCH),
            toolError(CheckKind.BANK_ACCOUNT),
            outcome(CheckKind.PURCHASE_ORDER, VerificationResult.MATCH));

        AggregatedConfidence result = aggregator.aggregate(invoiceWithConfidence(0.9), outcomes);

        assertEquals(0.9, result.getOverallScore(), 1e-9);
        assertEquals(List.of("bankAccountNumber"), result.getUnresolvedFields());
        assertTrue(result.isReviewForced());
        FieldAssessment bank = result.getAssessments().get(CheckKind.BANK_ACCOUNT);
        assertTrue(bank.isUnresolved());
        assertNull(bank.getConfidence());
    }

    @Test
    public void testMissingOutcomeCountsAsNotVerified() {
        List<VerificationOutcome> outcomes = List.of(
            outcome(CheckKind.TAX_ID, VerificationResult.MATCH),
            outcome(CheckKind.NATIONAL_ID, VerificationResult.MATCH),
            outcome(CheckKind.BANK_ACCOUNT, VerificationResult.MATCH));

        AggregatedConfidence result = aggregator.aggregate(invoiceWithConfidence(0.8), outcomes);

        FieldAssessment po = result.getAssessments().get(CheckKind.PURCHASE_ORDER);
        assertEquals(VerificationResult.NOT_FOUND, po.getResult());
        assertEquals(ConfidenceAggregator.NOT_VERIFIED, po.getReason());
        assertEquals(0.6, result.getOverallScore(), 1e-9);
    }

    @Test
    public void testBankConfidenceIsTheLowerOfAccountAndRoutingCode() {
        ExtractedInvoice invoice = invoiceWithConfidence(0.95).toBuilder()
            .bankRoutingCode(ExtractedField.of("BNPAFRPP", 0.7))
            .build();

        AggregatedConfidence result = aggregator.aggregate(invoice, allMatch());

        FieldAssessment bank = result.getAssessments().get(CheckKind.BANK_ACCOUNT);
        assertEquals(0.7, bank.getConfidence(), 1e-9);
        assertFalse(bank.isPassed());
        assertFalse(result.allCheckedFieldsPass());
    }

    @Test
    public void testRecomputationIsBitIdenticalRegardlessOfArrivalOrder() {
        ExtractedInvoice invoice = invoiceWithConfidence(0.87);
        List<VerificationOutcome> outcomes = new ArrayList<>(allMatch());
        outcomes.set(2, mismatch(CheckKind.BANK_ACCOUNT, "FR7630006000011234567890189"));

        AggregatedConfidence first = aggregator.aggregate(invoice, outcomes);
        List<VerificationOutcome> reversed = new ArrayList<>(outcomes);
        Collections.reverse(reversed);
        AggregatedConfidence second = aggregator.aggregate(invoice, reversed);

        assertEquals(Double.doubleToRawLongBits(first.getOverallScore()),
            Double.doubleToRawLongBits(second.getOverallScore()));
        assertEquals(first, second);
    }

    @Test
    public void testDuplicateCheckKindIsRejected() {
        List<VerificationOutcome> outcomes = List.of(
            outcome(CheckKind.TAX_ID, VerificationResult.MATCH),
            outcome(CheckKind.TAX_ID, VerificationResult.NOT_FOUND));

        assertThrows(IllegalArgumentException.class,
            () -> aggregator.aggregate(invoiceWithConfidence(0.9), outcomes));
    }

    @Test
    public void testNoResolvedFieldsScoresZero() {
        List<VerificationOutcome> outcomes = new ArrayList<>();
        for (CheckKind kind : CheckKind.values()) {
            outcomes.add(toolError(kind));
        }

        AggregatedConfidence result = aggregator.aggregate(invoiceWithConfidence(0.9), outcomes);

        assertEquals(0.0, result.getOverallScore());
        assertEquals(4, result.getUnresolvedFields().size());
    }
}
