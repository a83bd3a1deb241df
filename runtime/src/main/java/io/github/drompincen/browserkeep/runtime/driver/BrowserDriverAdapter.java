package io.github.drompincen.browserkeep.runtime.driver;

/**
 * Capability to create, reconstruct and dispose the automation/view handle behind a session.
 * Implementations may block; the engine always calls them through {@link DriverInvoker}.
 */
public interface BrowserDriverAdapter {

    /**
     * Starts a fresh browser on {@code targetUrl}. A failed attempt must not leave a handle behind.
     *
     * @throws DriverException when no handle could be obtained
     */
    DriverHandle spin(String targetUrl);

    /**
     * Reconstructs job state from a checkpoint produced by the job before a restart.
     *
     * @throws DriverException when the checkpoint cannot be resumed
     */
    DriverHandle resume(String resumeToken);

    /**
     * Best-effort disposal. Releasing an already released handle is a no-op.
     */
    void release(DriverHandle handle);
}
