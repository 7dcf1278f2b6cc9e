package io.recoverly.ledger.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-customer mutual exclusion for ledger mutations.
 *
 * One fair ReentrantLock per customerId. Locks are reentrant, so an operation
 * holding a customer's lock may call another locked operation of the same
 * customer. Different customers never block each other.
 */
@Slf4j
@Component
public class CustomerLockManager {

    // One entry per customer ever locked, never evicted: sized by the customer base.
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Run an action while holding the customer's lock.
     */
    public <T> T withLock(String customerId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(customerId, id -> new ReentrantLock(true));
        if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
            log.debug("Waiting for ledger lock of customer {}", customerId);
        }
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String customerId, Runnable action) {
        withLock(customerId, () -> {
            action.run();
            return null;
        });
    }
}
