package com.conduit.streaming;

public enum StreamState {
    AWAITING_DATA,
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
