package com.apflow.invoice.reference.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers which record each idempotency key created.
 *
 * In production, this would be a unique index in the ledger database.
 */
@Slf4j
@Component
public class IdempotencyRegistry {

    private final Map<String, String> recordIdsByKey = new ConcurrentHashMap<>();

    public Optional<String> findRecordId(String idempotencyKey) {
        return Optional.ofNullable(recordIdsByKey.get(idempotencyKey));
    }

    /**
     * Bind a key to a record id. The first binding wins.
     *
     * @return the record id bound to the key after the call
     */
    public String register(String idempotencyKey, String recordId) {
        String existing = recordIdsByKey.putIfAbsent(idempotencyKey, recordId);
        if (existing != null) {
            log.debug("Idempotency key already bound - key={}, recordId={}", idempotencyKey, existing);
            return existing;
        }
        log.debug("Idempotency key registered - key={}, recordId={}", idempotencyKey, recordId);
        return recordId;
    }

    public int size() {
        return recordIdsByKey.size();
    }

    /**
     * Clear all keys (for testing).
     */
    public void clear() {
        recordIdsByKey.clear();
    }
}
