package com.apflow.invoice.kafka;

import com.apflow.invoice.canonical.CanonicalJson;
import com.apflow.invoice.canonical.PipelineRunRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.common.serialization.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka serializer for terminal pipeline run records.
 */
public class PipelineRunRecordSerializer implements Serializer<PipelineRunRecord> {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunRecordSerializer.class);

    private final ObjectMapper objectMapper;

    public PipelineRunRecordSerializer() {
        this.objectMapper = CanonicalJson.newMapper();
    }

    @Override
    public byte[] serialize(String topic, PipelineRunRecord data) {
        if (data == null) {
            return null;
        }

        try {
            return objectMapper.writeValueAsBytes(data);
        } catch (Exception e) {
            log.error("Failed to serialize PipelineRunRecord for topic: {}", topic, e);
            throw new RuntimeException("Failed to serialize PipelineRunRecord", e);
        }
    }

    @Override
    public void close() {
        // ObjectMapper doesn't require cleanup
    }
}
