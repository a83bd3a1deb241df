package io.github.drompincen.browserkeep.runtime.driver;

import io.github.drompincen.browserkeep.runtime.error.DriverSpinFailureException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs every {@link BrowserDriverAdapter} call on a bounded pool with a deadline. Spin and resume
 * calls are interrupted at the deadline and a handle that shows up after that is released as soon
 * as it arrives. Releases run on their own pool so stalled spins cannot starve them, and a release
 * that outlives its deadline keeps running in the background.
 */
@Component
public class DriverInvoker {

    private static final Logger log = LoggerFactory.getLogger(DriverInvoker.class);

    private final BrowserDriverAdapter adapter;
    private final DriverPolicy policy;
    private final ExecutorService executor;
    private final ExecutorService releaseExecutor;

    public DriverInvoker(BrowserDriverAdapter adapter, DriverPolicy policy) {
        this.adapter = adapter;
        this.policy = policy;
        this.executor = Executors.newFixedThreadPool(policy.callThreads(), daemonThreads("driver-call-"));
        this.releaseExecutor = Executors.newFixedThreadPool(policy.callThreads(), daemonThreads("driver-release-"));
    }

    /**
     * Spins a handle, retrying with exponential backoff.
     *
     * @throws DriverSpinFailureException after the last attempt failed
     */
    public DriverHandle spin(String targetUrl) {
        long backoffMs = policy.spinBackoff().toMillis();
        DriverException last = null;
        for (int attempt = 1; attempt <= policy.spinAttempts(); attempt++) {
            try {
                return acquire("spin", () -> adapter.spin(targetUrl), policy.spinDeadline());
            } catch (DriverException e) {
                last = e;
                log.warn("Spin attempt {}/{} for {} failed: {}",
                        attempt, policy.spinAttempts(), targetUrl, e.getMessage());
            }
            if (attempt < policy.spinAttempts() && !pause(backoffMs)) {
                break;
            }
            backoffMs *= 2;
        }
        throw new DriverSpinFailureException(targetUrl, policy.spinAttempts(), last);
    }

    /**
     * @throws DriverException when the adapter fails or the resume deadline passes
     */
    public DriverHandle resume(String resumeToken) {
        return acquire("resume", () -> adapter.resume(resumeToken), policy.resumeDeadline());
    }

    /**
     * Releases the handle. Never throws; failures are logged.
     */
    public void release(DriverHandle handle) {
        if (handle == null) return;
        Future<?> future;
        try {
            future = releaseExecutor.submit(() -> adapter.release(handle));
        } catch (RuntimeException e) {
            log.warn("Could not schedule release of handle {}: {}", handle.handleId(), e.getMessage());
            return;
        }
        try {
            future.get(policy.releaseDeadline().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // left running: no caller holds this handle any more
            log.warn("Release of handle {} exceeded {}; still running in the background",
                    handle.handleId(), policy.releaseDeadline());
        } catch (ExecutionException e) {
            log.warn("Release of handle {} failed: {}", handle.handleId(), e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while releasing handle {}", handle.handleId());
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        releaseExecutor.shutdownNow();
    }

    private DriverHandle acquire(String operation, Supplier<DriverHandle> call, Duration deadline) {
        // whoever flips this first owns the handle: the caller on time, the call itself when late
        AtomicBoolean settled = new AtomicBoolean();
        Future<DriverHandle> future = executor.submit(() -> {
            DriverHandle handle = call.get();
            if (handle != null && !settled.compareAndSet(false, true)) {
                releaseLate(handle);
                return null;
            }
            return handle;
        });
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (!settled.compareAndSet(false, true)) {
                // the handle landed right at the deadline and is already ours
                return awaitSettled(operation, future);
            }
            future.cancel(true);
            throw new DriverTimeoutException(operation, deadline);
        } catch (ExecutionException e) {
            throw unwrap(operation, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (settled.compareAndSet(false, true)) {
                future.cancel(true);
            } else {
                releaseLate(awaitSettled(operation, future));
            }
            throw new DriverException(operation + " interrupted", e);
        }
    }

    private static DriverHandle awaitSettled(String operation, Future<DriverHandle> future) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    throw unwrap(operation, e);
                }
            }
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }

    private static DriverException unwrap(String operation, ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof DriverException driverException) return driverException;
        return new DriverException(operation + " failed: " + cause.getMessage(), cause);
    }

    private void releaseLate(DriverHandle late) {
        if (late == null) return;
        log.info("Releasing handle {} that arrived after its deadline", late.handleId());
        try {
            releaseExecutor.execute(() -> {
                try {
                    adapter.release(late);
                } catch (RuntimeException e) {
                    log.warn("Release of late handle {} failed: {}", late.handleId(), e.getMessage());
                }
            });
        } catch (RuntimeException e) {
            log.warn("Could not schedule release of late handle {}: {}", late.handleId(), e.getMessage());
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static boolean pause(long millis) {
        if (millis <= 0) return true;
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
