package com.project.regimen.backend.component;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ProgressTransitionExecutor Tests")
class ProgressTransitionExecutorTest {

    private PlatformTransactionManager transactionManager;
    private ProgressTransitionExecutor executor;
    private ExecutorService pool;

    // read-modify-write without any synchronization of its own
    private int counter;

    @BeforeEach
    void setUp() {
        transactionManager = mock(PlatformTransactionManager.class);
        when(transactionManager.getTransaction(any())).thenReturn(mock(TransactionStatus.class));
        executor = new ProgressTransitionExecutor(transactionManager);
        pool = Executors.newFixedThreadPool(8);
        counter = 0;
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("Keys are built from the profile and plan, or the cycle")
    void shouldBuildKeys() {
        UUID id = UUID.fromString("00000000-0000-0000-0000-000000000001");

        assertEquals("plan:7:" + id, ProgressTransitionExecutor.planKey(7, id));
        assertEquals("cycle:" + id, ProgressTransitionExecutor.cycleKey(id));
        assertEquals("workout:" + id, ProgressTransitionExecutor.workoutKey(id));
    }

    @Test
    @DisplayName("Each transition runs in its own committed transaction")
    void shouldWrapInTransaction() {
        String result = executor.execute("plan:1:x", () -> "done");

        assertEquals("done", result);
        verify(transactionManager).getTransaction(any());
        verify(transactionManager).commit(any());
    }

    @Test
    @DisplayName("A failing transition is rolled back and its exception propagates")
    void shouldRollBackOnFailure() {
        assertThrows(IllegalStateException.class, () -> executor.execute("plan:1:x", () -> {
            throw new IllegalStateException("boom");
        }));

        verify(transactionManager).rollback(any());
        // the lock was released
        int next = executor.execute("plan:1:x", () -> 1);
        assertEquals(1, next);
    }

    @Test
    @DisplayName("Transitions on the same key never interleave")
    void shouldSerializeSameKey() throws Exception {
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            futures.add(pool.submit(() -> executor.run("cycle:shared", this::slowIncrement)));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        assertEquals(200, counter);
        verify(transactionManager, times(200)).commit(any());
    }

    @Test
    @DisplayName("Overlapping key sets taken in any order do not deadlock")
    void shouldLockSeveralKeysWithoutDeadlock() throws Exception {
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            List<String> keys = i % 2 == 0 ? List.of("plan:1:a", "cycle:b") : List.of("cycle:b", "plan:1:a");
            futures.add(pool.submit(() -> executor.execute(keys, () -> {
                slowIncrement();
                return null;
            })));
            futures.add(pool.submit(() -> executor.run("cycle:b", this::slowIncrement)));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        assertEquals(200, counter);
    }

    @Test
    @DisplayName("A transition may re-enter its own key")
    void shouldAllowReentry() {
        int result = executor.execute("plan:1:x", () -> executor.execute("plan:1:x", () -> 42));

        assertEquals(42, result);
    }

    @Test
    @DisplayName("Locks are dropped once no transition holds or waits for them")
    void shouldForgetIdleKeys() throws Exception {
        for (int i = 0; i < 50; i++) {
            executor.run(ProgressTransitionExecutor.workoutKey(UUID.randomUUID()), this::slowIncrement);
        }
        assertEquals(0, executor.activeKeyCount());

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            String key = "plan:1:" + (i % 3);
            futures.add(pool.submit(() -> executor.run(key, () -> {
                assertTrue(executor.activeKeyCount() > 0);
            })));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        executor.execute("plan:1:x", () -> executor.execute(List.of("plan:1:x", "cycle:y"), () -> {
            assertEquals(2, executor.activeKeyCount());
            return null;
        }));
        assertEquals(0, executor.activeKeyCount());
    }

    private void slowIncrement() {
        int read = counter;
        Thread.yield();
        counter = read + 1;
        assertTrue(counter > 0);
    }
}
