package com.apflow.invoice.orchestrator.state;

import com.apflow.invoice.canonical.PipelineRunRecord;
import com.apflow.invoice.canonical.enums.PipelineState;
import com.apflow.invoice.orchestrator.TestInvoices;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PipelineRunTest {

    private PipelineRun run;

    @BeforeEach
    public void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
        run = new PipelineRun("sub-1", 1, TestInvoices.technoVision("sub-1", "FV-2025-0042"), clock);
    }

    @Test
    public void testStartsReceived() {
        assertEquals(PipelineState.RECEIVED, run.getState());
        assertTrue(run.getTransitions().isEmpty());
        assertEquals("invoice-run:sub-1", run.idempotencyKey());
    }

    @Test
    public void testStagesCannotBeSkipped() {
        assertThrows(IllegalStateException.class, () -> run.transitionTo(PipelineState.ROUTED, "skip"));
        assertEquals(PipelineState.RECEIVED, run.getState());
    }

    @Test
    public void testTerminalStateIsFinal() {
        run.transitionTo(PipelineState.FAILED, "malformed");

        assertThrows(IllegalStateException.class, () -> run.transitionTo(PipelineState.VALIDATING, "retry"));
        assertFalse(run.requestCancel());
    }

    @Test
    public void testTransitionsAreRecorded() {
        run.transitionTo(PipelineState.VALIDATING, "intake validation passed");
        run.transitionTo(PipelineState.AGGREGATING, "4 checks settled");

        PipelineRunRecord record = run.toRecord();

        assertEquals(PipelineState.AGGREGATING, record.getState());
        assertEquals(2, record.getTransitions().size());
        assertEquals(PipelineState.RECEIVED, record.getTransitions().get(0).getFrom());
        assertEquals("4 checks settled", record.getTransitions().get(1).getReason());
        assertEquals("FV-2025-0042", record.getInvoiceNumber());
    }

    /**
     * Once finalizing has begun the run can no longer be cancelled.
     */
    @Test
    public void testCancelRefusedWhileFinalizing() {
        run.transitionTo(PipelineState.VALIDATING, "ok");
        run.transitionTo(PipelineState.AGGREGATING, "ok");
        run.transitionTo(PipelineState.ROUTED, "ok");

        assertTrue(run.beginFinalizing());
        assertEquals(PipelineState.FINALIZING, run.getState());
        assertFalse(run.requestCancel());
        assertThrows(IllegalStateException.class, () -> run.transitionTo(PipelineState.CANCELLED, "late"));
    }

    @Test
    public void testCancelBeforeFinalizingWins() {
        run.transitionTo(PipelineState.VALIDATING, "ok");
        run.transitionTo(PipelineState.AGGREGATING, "ok");
        run.transitionTo(PipelineState.ROUTED, "ok");

        assertTrue(run.requestCancel());
        assertFalse(run.beginFinalizing());
        assertEquals(PipelineState.ROUTED, run.getState());
    }
}
