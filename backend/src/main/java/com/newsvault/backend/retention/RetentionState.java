package com.newsvault.backend.retention;

public enum RetentionState {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED
}
