package com.apflow.invoice.orchestrator;

import com.apflow.invoice.canonical.PipelineRunRecord;
import com.apflow.invoice.canonical.enums.PipelineState;
import com.apflow.invoice.kafka.PipelineRunRecordSerializer;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RunOutcomePublisherTest {

    private static PipelineRunRecord record(String runId) {
        return PipelineRunRecord.builder().runId(runId).attempt(1).state(PipelineState.COMPLETED).build();
    }

    @Test
    public void testPublishesToFinalStatusTopic() {
        MockProducer<String, PipelineRunRecord> producer =
            new MockProducer<>(true, new StringSerializer(), new PipelineRunRecordSerializer());
        RunOutcomePublisher publisher = new RunOutcomePublisher(producer);

        publisher.publish(record("sub-1"));

        List<ProducerRecord<String, PipelineRunRecord>> history = producer.history();
        assertEquals(1, history.size());
        assertEquals(RunOutcomePublisher.TOPIC_FINAL_STATUS, history.get(0).topic());
        assertEquals("sub-1", history.get(0).key());
    }

    /**
     * A broker failure is logged; the run outcome stands.
     */
    @Test
    public void testSendFailureDoesNotPropagate() {
        MockProducer<String, PipelineRunRecord> producer =
            new MockProducer<>(false, new StringSerializer(), new PipelineRunRecordSerializer());
        RunOutcomePublisher publisher = new RunOutcomePublisher(producer);

        publisher.publish(record("sub-2"));

        assertTrue(producer.errorNext(new RuntimeException("broker down")));
    }

    @Test
    public void testMockModeOnlyLogs() {
        assertDoesNotThrow(() -> RunOutcomePublisher.mock().publish(record("sub-3")));
    }
}
