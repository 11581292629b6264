package com.apflow.invoice.orchestrator.intake;

import com.apflow.invoice.canonical.ExtractedInvoice;
import com.apflow.invoice.kafka.ExtractedInvoiceDeserializer;
import com.apflow.invoice.orchestrator.PipelineOrchestratorService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.errors.RecordDeserializationException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Consumes extracted invoices from invoices.orchestrator.in and submits each
 * one to the pipeline.
 *
 * Offsets are committed once the run has been admitted; the run itself
 * continues on the pipeline worker pool. Not started in mock mode.
 */
@Component
@ConditionalOnProperty(name = "pipeline.mock.mode", havingValue = "false", matchIfMissing = true)
public class ExtractedInvoiceConsumer {

    private static final Logger log = LoggerFactory.getLogger(ExtractedInvoiceConsumer.class);
    public static final String TOPIC_INVOICES_IN = "invoices.orchestrator.in";

    private final java.util.function.Consumer<ExtractedInvoice> submitter;

    @Value("${kafka.bootstrap.servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${kafka.consumer.group-id:invoice-orchestrator-group}")
    private String groupId;

    @Value("${kafka.consumer.auto-offset-reset:earliest}")
    private String autoOffsetReset;

    private Consumer<String, ExtractedInvoice> consumer;
    private ExecutorService pollThread;
    private final AtomicBoolean running = new AtomicBoolean(false);

    @Autowired
    public ExtractedInvoiceConsumer(PipelineOrchestratorService orchestratorService) {
        this.submitter = orchestratorService::submit;
    }

    ExtractedInvoiceConsumer(Consumer<String, ExtractedInvoice> consumer,
                             java.util.function.Consumer<ExtractedInvoice> submitter) {
        this.consumer = consumer;
        this.submitter = submitter;
    }

    @PostConstruct
    public void start() {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, autoOffsetReset);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ExtractedInvoiceDeserializer.class);
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 100);

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(TOPIC_INVOICES_IN));

        running.set(true);
        pollThread = Executors.newSingleThreadExecutor();
        pollThread.submit(this::pollLoop);
        log.info("Extracted invoice consumer started - topic={}, groupId={}", TOPIC_INVOICES_IN, groupId);
    }

    @PreDestroy
    public void stop() {
        log.info("Shutting down extracted invoice consumer");
        running.set(false);
        if (consumer != null) {
            consumer.wakeup();
        }
        if (pollThread != null) {
            pollThread.shutdown();
            try {
                if (!pollThread.awaitTermination(10, TimeUnit.SECONDS)) {
                    pollThread.shutdownNow();
                }
            } catch (InterruptedException e) {
                pollThread.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private void pollLoop() {
        try {
            while (running.get()) {
                try {
                    pollOnce();
                } catch (WakeupException e) {
                    if (running.get()) {
                        throw e;
                    }
                } catch (RuntimeException e) {
                    log.error("Error in extracted invoice poll loop", e);
                }
            }
        } finally {
            consumer.close();
            log.info("Extracted invoice consumer stopped");
        }
    }

    /**
     * One poll: submit every record, then commit. A record that cannot be
     * decoded is skipped and its offset committed so the partition moves on.
     */
    void pollOnce() {
        ConsumerRecords<String, ExtractedInvoice> records;
        try {
            records = consumer.poll(Duration.ofSeconds(1));
        } catch (RecordDeserializationException e) {
            log.error("Skipping undecodable invoice record - partition={}, offset={}",
                e.topicPartition(), e.offset(), e);
            consumer.seek(e.topicPartition(), e.offset() + 1);
            consumer.commitSync(Collections.singletonMap(e.topicPartition(), new OffsetAndMetadata(e.offset() + 1)));
            return;
        }
        for (ConsumerRecord<String, ExtractedInvoice> record : records) {
            handle(record);
        }
        if (!records.isEmpty()) {
            consumer.commitSync();
        }
    }

    private void handle(ConsumerRecord<String, ExtractedInvoice> record) {
        ExtractedInvoice invoice = record.value();
        if (invoice == null) {
            log.warn("Skipping empty invoice record - key={}, offset={}", record.key(), record.offset());
            return;
        }
        try {
            submitter.accept(invoice);
        } catch (IllegalStateException e) {
            log.warn("Invoice not admitted - key={}, reason={}", record.key(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error submitting invoice - key={}, offset={}", record.key(), record.offset(), e);
        }
    }
}
