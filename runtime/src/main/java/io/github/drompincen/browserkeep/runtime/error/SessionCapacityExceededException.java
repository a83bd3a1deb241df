package io.github.drompincen.browserkeep.runtime.error;

public class SessionCapacityExceededException extends SessionException {

    private final int maxLive;

    public SessionCapacityExceededException(int maxLive) {
        super("capacity_exceeded", "Live session limit of " + maxLive + " reached");
        this.maxLive = maxLive;
    }

    public int getMaxLive() {
        return maxLive;
    }
}
