package com.apflow.invoice.kafka;

import com.apflow.invoice.canonical.CanonicalJson;
import com.apflow.invoice.canonical.ExtractedInvoice;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Deserializer;

import java.io.IOException;

/**
 * Reads extractor output from the intake topic with the strict canonical
 * mapper. A payload that does not decode fails with a
 * {@link SerializationException}, which the consumer surfaces as a
 * {@code RecordDeserializationException} carrying the record's position.
 */
public class ExtractedInvoiceDeserializer implements Deserializer<ExtractedInvoice> {

    private final ObjectMapper objectMapper = CanonicalJson.newStrictMapper();

    @Override
    public ExtractedInvoice deserialize(String topic, byte[] data) {
        if (data == null) {
            return null;
        }
        try {
            return objectMapper.readValue(data, ExtractedInvoice.class);
        } catch (IOException e) {
            throw new SerializationException("Undecodable extracted invoice on " + topic + ": "
                + e.getMessage(), e);
        }
    }
}
