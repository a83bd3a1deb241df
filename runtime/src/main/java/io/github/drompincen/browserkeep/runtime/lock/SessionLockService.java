package io.github.drompincen.browserkeep.runtime.lock;

import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-session critical sections. Work on one id is serialized; distinct ids never contend.
 * Lock entries are reference counted and dropped once no thread holds or waits for them.
 */
@Service
public class SessionLockService {

    private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String sessionId, Supplier<T> action) {
        LockEntry entry = acquire(sessionId);
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            release(sessionId);
        }
    }

    public void runLocked(String sessionId, Runnable action) {
        withLock(sessionId, () -> {
            action.run();
            return null;
        });
    }

    public boolean isLocked(String sessionId) {
        LockEntry entry = locks.get(sessionId);
        return entry != null && entry.lock.isLocked();
    }

    int trackedLocks() {
        return locks.size();
    }

    private LockEntry acquire(String sessionId) {
        return locks.compute(sessionId, (id, entry) -> {
            LockEntry e = entry != null ? entry : new LockEntry();
            e.refs++;
            return e;
        });
    }

    private void release(String sessionId) {
        locks.computeIfPresent(sessionId, (id, entry) -> --entry.refs == 0 ? null : entry);
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int refs;
    }
}
