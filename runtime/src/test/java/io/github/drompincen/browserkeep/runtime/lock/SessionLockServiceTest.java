package io.github.drompincen.browserkeep.runtime.lock;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionLockServiceTest {

    private final SessionLockService lockService = new SessionLockService();

    @Test
    void sameIdIsSerialized() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 200; i++) {
                pool.submit(() -> lockService.runLocked("s1", () -> {
                    maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                    Thread.yield();
                    inside.decrementAndGet();
                }));
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(maxInside).hasValue(1);
        assertThat(lockService.trackedLocks()).isZero();
    }

    @Test
    void distinctIdsDoNotBlockEachOther() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch releaseHolder = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            pool.submit(() -> lockService.runLocked("s1", () -> {
                holding.countDown();
                await(releaseHolder);
            }));
            assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

            Future<String> other = pool.submit(() -> lockService.withLock("s2", () -> "done"));

            assertThat(other.get(5, TimeUnit.SECONDS)).isEqualTo("done");
            assertThat(lockService.isLocked("s1")).isTrue();
        } finally {
            releaseHolder.countDown();
            pool.shutdown();
        }
    }

    @Test
    void lockIsReleasedWhenActionThrows() {
        assertThatThrownBy(() -> lockService.runLocked("s1", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(lockService.isLocked("s1")).isFalse();
        assertThat(lockService.trackedLocks()).isZero();
    }

    @Test
    void reentrantOnSameThread() {
        String result = lockService.withLock("s1", () -> lockService.withLock("s1", () -> "nested"));

        assertThat(result).isEqualTo("nested");
        assertThat(lockService.trackedLocks()).isZero();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
