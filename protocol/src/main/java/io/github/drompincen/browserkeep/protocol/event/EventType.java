package io.github.drompincen.browserkeep.protocol.event;

public enum EventType {
    SESSION_CREATED("created"),
    SESSION_HEARTBEAT("heartbeat"),
    SESSION_RESUMED("resumed"),
    SESSION_RESUME_FAILED("resume-failed"),
    SESSION_ABANDONED("abandoned"),
    SESSION_COMPLETED("completed"),
    SESSION_FAILED("failed");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static EventType fromWireName(String wireName) {
        for (EventType type : values()) {
            if (type.wireName.equals(wireName)) return type;
        }
        throw new IllegalArgumentException("Unknown event type: " + wireName);
    }
}
