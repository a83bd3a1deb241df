package io.github.drompincen.browserkeep.runtime.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default notifier until a mail or push channel is wired in; records the notice in the log.
 */
@Component
public class LoggingOwnerNotifier implements OwnerNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingOwnerNotifier.class);

    @Override
    public void notifyResumeFailed(String sessionId, String owner, String reason) {
        log.info("Owner {} notified: session {} could not be resumed ({})", owner, sessionId, reason);
    }
}
