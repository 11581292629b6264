package com.apflow.invoice.rules;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;

/**
 * Loads the validation policy from a classpath JSON file.
 */
public class ValidationPolicyLoader {

    private static final Logger log = LoggerFactory.getLogger(ValidationPolicyLoader.class);
    public static final String DEFAULT_POLICY_PATH = "/config/validation_policy.json";

    private final ObjectMapper objectMapper;

    public ValidationPolicyLoader() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    public ValidationPolicy loadPolicy() {
        return loadPolicy(DEFAULT_POLICY_PATH);
    }

    /**
     * Load the policy from a specific classpath location.
     *
     * @param classpathPath path to the JSON file in classpath
     * @return the loaded policy
     * @throws RuntimeException if the file is missing, malformed or holds out-of-range thresholds
     */
    public ValidationPolicy loadPolicy(String classpathPath) {
        ValidationPolicy policy;
        try (InputStream inputStream = getClass().getResourceAsStream(classpathPath)) {
            if (inputStream == null) {
                throw new RuntimeException("Validation policy file not found in classpath: " + classpathPath);
            }
            policy = objectMapper.readValue(inputStream, ValidationPolicy.class);
        } catch (RuntimeException e) {
            log.error("Failed to load validation policy from: {}", classpathPath, e);
            throw e;
        } catch (Exception e) {
            log.error("Failed to load validation policy from: {}", classpathPath, e);
            throw new RuntimeException("Failed to load validation policy", e);
        }

        validate(policy, classpathPath);
        log.info("Loaded validation policy from {} - proceedThreshold={}, fieldPassThreshold={}, "
                + "maxToolErrorsBeforeReview={}, amountTolerance={}",
            classpathPath, policy.getProceedThreshold(), policy.getFieldPassThreshold(),
            policy.getMaxToolErrorsBeforeReview(), policy.getAmountTolerance());
        return policy;
    }

    private static void validate(ValidationPolicy policy, String source) {
        if (!inUnitRange(policy.getProceedThreshold()) || !inUnitRange(policy.getFieldPassThreshold())) {
            throw new RuntimeException("Thresholds in " + source + " must be within [0.0, 1.0]");
        }
        if (policy.getMaxToolErrorsBeforeReview() < 0) {
            throw new RuntimeException("maxToolErrorsBeforeReview in " + source + " must not be negative");
        }
        if (policy.getAmountTolerance() == null || policy.getAmountTolerance().signum() < 0) {
            throw new RuntimeException("amountTolerance in " + source + " must be a non-negative amount");
        }
    }

    private static boolean inUnitRange(double value) {
        return !Double.isNaN(value) && value >= 0.0 && value <= 1.0;
    }
}
