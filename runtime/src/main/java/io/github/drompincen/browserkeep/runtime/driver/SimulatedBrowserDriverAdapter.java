package io.github.drompincen.browserkeep.runtime.driver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process stand-in for a browser farm. Handles are bookkeeping entries with a fake view URL.
 */
@Component
@ConditionalOnProperty(name = "browserkeep.driver.mode", havingValue = "simulated", matchIfMissing = true)
public class SimulatedBrowserDriverAdapter implements BrowserDriverAdapter {

    private static final Logger log = LoggerFactory.getLogger(SimulatedBrowserDriverAdapter.class);

    private final Duration latency;
    private final Map<String, String> handles = new ConcurrentHashMap<>();

    public SimulatedBrowserDriverAdapter(@Value("${browserkeep.driver.simulated.latency:PT0S}") Duration latency) {
        this.latency = latency;
    }

    @Override
    public DriverHandle spin(String targetUrl) {
        String host = URI.create(targetUrl).getHost();
        if (host == null) {
            throw new DriverException("Target has no host: " + targetUrl);
        }
        simulateLatency();
        return open(targetUrl);
    }

    @Override
    public DriverHandle resume(String resumeToken) {
        if (resumeToken == null || resumeToken.isBlank()) {
            throw new DriverException("Nothing to resume from");
        }
        simulateLatency();
        return open("checkpoint:" + resumeToken);
    }

    @Override
    public void release(DriverHandle handle) {
        if (handles.remove(handle.handleId()) != null) {
            log.debug("Released simulated browser {}", handle.handleId());
        }
    }

    public int openHandles() {
        return handles.size();
    }

    private DriverHandle open(String source) {
        String handleId = "sim-" + UUID.randomUUID();
        handles.put(handleId, source);
        log.debug("Opened simulated browser {} on {}", handleId, source);
        return new DriverHandle(handleId, "sim://view/" + handleId);
    }

    private void simulateLatency() {
        if (latency.isZero()) return;
        try {
            Thread.sleep(latency.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DriverException("Interrupted while starting simulated browser", e);
        }
    }
}
