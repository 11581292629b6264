package com.apflow.invoice.notification;

import com.apflow.invoice.canonical.enums.RoutingOutcome;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NotificationServiceTest {

    @Test
    public void testPublishesJsonKeyedByRunId() {
        MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        NotificationService service = new NotificationService(producer);

        service.publish(ReviewNotification.builder()
            .runId("run-42")
            .attempt(1)
            .outcome(RoutingOutcome.REJECT)
            .invoiceNumber("FV-2025-0042")
            .supplierName("TechnoVision SAS")
            .summary("taxId: does not match reference data")
            .sentAt(Instant.parse("2025-03-01T10:00:00Z"))
            .build());

        List<ProducerRecord<String, String>> history = producer.history();
        assertEquals(1, history.size());
        ProducerRecord<String, String> record = history.get(0);
        assertEquals(NotificationService.TOPIC_NOTIFICATION, record.topic());
        assertEquals("run-42", record.key());
        assertTrue(record.value().contains("\"outcome\":\"REJECT\""));
        assertTrue(record.value().contains("\"sentAt\":\"2025-03-01T10:00:00Z\""));
    }

    @Test
    public void testShutdownClosesProducer() {
        MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        NotificationService service = new NotificationService(producer);

        service.shutdown();

        assertTrue(producer.closed());
    }
}
