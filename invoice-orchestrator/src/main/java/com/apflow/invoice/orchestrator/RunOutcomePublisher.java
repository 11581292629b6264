package com.apflow.invoice.orchestrator;

import com.apflow.invoice.canonical.PipelineRunRecord;
import com.apflow.invoice.kafka.PipelineRunRecordSerializer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Publishes terminal run records to the final status topic.
 *
 * Without a producer (mock mode) records are only logged.
 */
public class RunOutcomePublisher {

    private static final Logger log = LoggerFactory.getLogger(RunOutcomePublisher.class);
    public static final String TOPIC_FINAL_STATUS = "invoices.final.status";

    private final Producer<String, PipelineRunRecord> producer;

    public RunOutcomePublisher(Producer<String, PipelineRunRecord> producer) {
        this.producer = producer;
    }

    public static RunOutcomePublisher mock() {
        return new RunOutcomePublisher(null);
    }

    public static RunOutcomePublisher kafka(String bootstrapServers) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, PipelineRunRecordSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.LINGER_MS_CONFIG, 10);
        return new RunOutcomePublisher(new KafkaProducer<>(props));
    }

    public void publish(PipelineRunRecord record) {
        String runId = record.getRunId();
        if (producer == null) {
            log.info("Mock mode: final status not published - runId={}, attempt={}, state={}, finalOutcome={}",
                runId, record.getAttempt(), record.getState(), record.getFinalOutcome());
            return;
        }

        try {
            producer.send(new ProducerRecord<>(TOPIC_FINAL_STATUS, runId, record), (metadata, exception) -> {
                if (exception != null) {
                    log.error("Failed to publish final status - runId={}, state={}", runId, record.getState(), exception);
                } else {
                    log.info("Published final status - runId={}, state={}, topic={}, partition={}, offset={}",
                        runId, record.getState(), metadata.topic(), metadata.partition(), metadata.offset());
                }
            });
        } catch (RuntimeException e) {
            log.error("Failed to publish final status - runId={}, state={}", runId, record.getState(), e);
        }
    }

    public void shutdown() {
        log.info("Shutting down run outcome publisher");
        if (producer != null) {
            producer.close();
        }
    }
}
