package com.ai.scheduling.component;

import com.ai.scheduling.dto.SchedulingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutex per resource id wrapped around a transaction. The transaction commits
 * before the lock is released, so find-then-commit cannot interleave for one resource.
 * <p>
 * Keys are resource ids plus {@link #QUEUE_KEY}, so the lock map stays as small as the
 * set of resources. Per-candidate exclusion is left to row locks in the store.
 */
@Component
public class SchedulingCriticalSection {

    private static final Logger log = LoggerFactory.getLogger(SchedulingCriticalSection.class);
    private static final int MAX_ATTEMPTS = 2;

    /** Serializes queue-wide writes: emergency stop/resume and new queue entries. */
    public static final String QUEUE_KEY = "queue-control";

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final TransactionTemplate transactionTemplate;

    public SchedulingCriticalSection(TransactionTemplate transactionTemplate) {
        this.transactionTemplate = transactionTemplate;
    }

    public <T> T execute(String key, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock(true));
        lock.lock();
        try {
            return transactionTemplate.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }

    public int keyCount() {
        return locks.size();
    }

    /**
     * Runs the work and, if it lost a race (conflict outcome or a store-level
     * uniqueness/version failure), runs it once more against fresh state.
     */
    public SchedulingResult executeWithRetry(String key, String operation, Supplier<SchedulingResult> work) {
        SchedulingResult result = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                result = execute(key, work);
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                log.warn("{} on {} hit a concurrent commit (attempt {}): {}", operation, key, attempt, e.getMessage());
                result = SchedulingResult.conflict(SchedulingResult.Reason.SLOT_TAKEN,
                        "A concurrent booking took this slot.");
            }
            if (result == null || result.outcome() != SchedulingResult.Outcome.CONFLICT) {
                return result;
            }
            if (attempt < MAX_ATTEMPTS) {
                log.info("{} on {} conflicted, retrying once against fresh state", operation, key);
            }
        }
        return result;
    }
}
