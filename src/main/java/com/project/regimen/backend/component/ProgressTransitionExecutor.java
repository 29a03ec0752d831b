package com.project.regimen.backend.component;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs progress transitions one at a time per key.
 *
 * A transition reads a pointer, decides, and writes it back. Two transitions on
 * the same plan (an open racing a backfill, say) must not interleave, so each
 * runs under a lock for its key. The lock is taken before the transaction
 * starts and released after it commits; the next caller always reads
 * committed state.
 */
@Slf4j
@Component
public class ProgressTransitionExecutor {

    private final TransactionTemplate transactionTemplate;

    // a key stays in the map only while some thread holds or waits for its lock
    private final Map<String, KeyLock> locks = new ConcurrentHashMap<>();

    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    public ProgressTransitionExecutor(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public static String planKey(Integer profileId, UUID planId) {
        return "plan:" + profileId + ":" + planId;
    }

    public static String cycleKey(UUID cycleId) {
        return "cycle:" + cycleId;
    }

    public static String workoutKey(UUID workoutId) {
        return "workout:" + workoutId;
    }

    public <T> T execute(String key, Supplier<T> transition) {
        return execute(List.of(key), transition);
    }

    /**
     * Same as {@link #execute(String, Supplier)} holding the locks of several
     * keys at once. Keys are locked in sorted order so two callers with
     * overlapping keys cannot deadlock.
     */
    public <T> T execute(Collection<String> keys, Supplier<T> transition) {
        List<String> held = new ArrayList<>();
        try {
            for (String key : keys.stream().distinct().sorted().toList()) {
                acquire(key);
                held.add(key);
            }
            log.debug("Running transition for {}", keys);
            return transactionTemplate.execute(status -> transition.get());
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                release(held.get(i));
            }
        }
    }

    private void acquire(String key) {
        KeyLock keyLock = locks.compute(key, (k, existing) -> {
            KeyLock entry = existing != null ? existing : new KeyLock();
            entry.users++;
            return entry;
        });
        keyLock.lock.lock();
    }

    private void release(String key) {
        KeyLock keyLock = locks.get(key);
        keyLock.lock.unlock();
        unregister(key);
    }

    private void unregister(String key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    /** Number of keys currently locked or waited for. */
    int activeKeyCount() {
        return locks.size();
    }

    public void run(String key, Runnable transition) {
        execute(key, () -> {
            transition.run();
            return null;
        });
    }
}
