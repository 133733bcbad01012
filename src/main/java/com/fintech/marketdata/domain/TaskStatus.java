package com.fintech.marketdata.domain;

/**
 * Lifecycle of an ingestion task.
 */
public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
