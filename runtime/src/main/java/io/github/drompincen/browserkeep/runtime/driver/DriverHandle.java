package io.github.drompincen.browserkeep.runtime.driver;

/**
 * Opaque reference to a running browser. Never persisted.
 */
public record DriverHandle(String handleId, String viewUrl) {}
