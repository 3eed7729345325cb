package com.example.audiobooksync.domain.enumtype;

public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    CANCELED,
    FAILED
}
