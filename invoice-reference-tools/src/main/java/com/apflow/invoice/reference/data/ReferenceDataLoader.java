package com.apflow.invoice.reference.data;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;

/**
 * Loads supplier and purchase-order master data from a classpath JSON file.
 */
public class ReferenceDataLoader {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDataLoader.class);
    public static final String DEFAULT_DATA_PATH = "/config/reference_data.json";

    private final ObjectMapper objectMapper;

    public ReferenceDataLoader() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
    }

    public ReferenceDataSet load() {
        return load(DEFAULT_DATA_PATH);
    }

    /**
     * @throws RuntimeException if the file is missing or malformed
     */
    public ReferenceDataSet load(String classpathPath) {
        try (InputStream inputStream = getClass().getResourceAsStream(classpathPath)) {
            if (inputStream == null) {
                throw new RuntimeException("Reference data file not found in classpath: " + classpathPath);
            }

            ReferenceDataSet dataSet = objectMapper.readValue(inputStream, ReferenceDataSet.class);
            log.info("Loaded {} suppliers and {} purchase orders from {}",
                dataSet.getSuppliers().size(), dataSet.getPurchaseOrders().size(), classpathPath);
            return dataSet;

        } catch (RuntimeException e) {
            log.error("Failed to load reference data from: {}", classpathPath, e);
            throw e;
        } catch (Exception e) {
            log.error("Failed to load reference data from: {}", classpathPath, e);
            throw new RuntimeException("Failed to load reference data", e);
        }
    }
}
