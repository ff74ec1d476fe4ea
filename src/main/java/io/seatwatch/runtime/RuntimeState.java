package io.seatwatch.runtime;

public enum RuntimeState {
    RUNNING,
    PAUSED_DISCONNECTED,
    STOPPED
}
