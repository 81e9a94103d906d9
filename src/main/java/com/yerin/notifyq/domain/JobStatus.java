package com.yerin.notifyq.domain;

public enum JobStatus {
    PENDING,
    EXECUTING,
    COMPLETED,
    FAILED,
    CANCELLED
}
