package com.salesagent.leads.service;

import com.salesagent.leads.store.ProcessedKeyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Makes side effects at-most-once per (scope, key), across restarts.
 *
 * Scopes in use: {@code reply} (inbound message id), {@code proposal-email} and
 * {@code meeting} (lead id or sender address).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IdempotencyGuard {

    public static final String SCOPE_REPLY = "reply";
    public static final String SCOPE_PROPOSAL_EMAIL = "proposal-email";
    public static final String SCOPE_MEETING = "meeting";

    private final ProcessedKeyRepository processedKeys;

    /**
     * @return true the first time a (scope, key) pair is seen, false on every repeat
     */
    public boolean acquire(String scope, String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("idempotency key is required for scope " + scope);
        }
        boolean first = processedKeys.insertIfAbsent(scope, key);
        if (!first) {
            log.info("Skipping duplicate {} for key {}", scope, key);
        }
        return first;
    }

    public boolean seen(String scope, String key) {
        return processedKeys.exists(scope, key);
    }

    /** Forget a key so the action can be attempted again. */
    public void release(String scope, String key) {
        processedKeys.delete(scope, key);
    }

    /**
     * Runs {@code action} unless the key was already processed. If the action throws,
     * the key is released before the exception propagates.
     *
     * @return the action's result, or empty when this was a duplicate
     */
    public <T> Optional<T> runOnce(String scope, String key, Supplier<T> action) {
        if (!acquire(scope, key)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(action.get());
        } catch (RuntimeException e) {
            log.warn("{} for key {} failed, releasing key: {}", scope, key, e.getMessage());
            release(scope, key);
            throw e;
        }
    }
}
