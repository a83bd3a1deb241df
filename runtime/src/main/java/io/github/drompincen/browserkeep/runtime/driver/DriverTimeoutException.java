package io.github.drompincen.browserkeep.runtime.driver;

import java.time.Duration;

public class DriverTimeoutException extends DriverException {

    public DriverTimeoutException(String operation, Duration deadline) {
        super(operation + " did not finish within " + deadline);
    }
}
