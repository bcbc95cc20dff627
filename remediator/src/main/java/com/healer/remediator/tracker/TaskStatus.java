package com.healer.remediator.tracker;

public enum TaskStatus {
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
