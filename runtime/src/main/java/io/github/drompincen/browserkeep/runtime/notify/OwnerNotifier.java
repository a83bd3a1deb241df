package io.github.drompincen.browserkeep.runtime.notify;

/**
 * Tells a session's owner that recovery could not bring the session back. Delivery is best-effort.
 */
public interface OwnerNotifier {
    void notifyResumeFailed(String sessionId, String owner, String reason);
}
