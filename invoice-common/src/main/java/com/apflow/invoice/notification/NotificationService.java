package com.apflow.invoice.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Publishes review notifications to the notification Kafka topic.
 *
 * Each notification is sent as JSON, keyed by run id.
 */
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);
    public static final String TOPIC_NOTIFICATION = "invoices.notification";

    private final Producer<String, String> producer;
    private final ObjectMapper objectMapper;

    /**
     * @param bootstrapServers Kafka bootstrap servers
     */
    public NotificationService(String bootstrapServers) {
        this(createProducer(bootstrapServers));
    }

    public NotificationService(Producer<String, String> producer) {
        this.producer = producer;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        log.info("Notification Service initialized - topic={}", TOPIC_NOTIFICATION);
    }

    private static Producer<String, String> createProducer(String bootstrapServers) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.LINGER_MS_CONFIG, 10);
        return new KafkaProducer<>(props);
    }

    /**
     * Publish a review notification.
     *
     * @throws IllegalStateException if the notification cannot be serialized
     */
    public void publish(ReviewNotification notification) {
        String runId = notification.getRunId();
        String json;
        try {
            json = objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize notification for run " + runId, e);
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(TOPIC_NOTIFICATION, runId, json);
        producer.send(record, (metadata, exception) -> {
            if (exception != null) {
                log.error("Failed to publish notification - runId={}, outcome={}",
                    runId, notification.getOutcome(), exception);
            } else {
                log.info("Published notification - runId={}, outcome={}, topic={}, partition={}, offset={}",
                    runId, notification.getOutcome(), metadata.topic(), metadata.partition(), metadata.offset());
            }
        });
    }

    /**
     * Shutdown and close Kafka producer.
     */
    public void shutdown() {
        log.info("Shutting down Notification Service");
        producer.close();
    }
}
