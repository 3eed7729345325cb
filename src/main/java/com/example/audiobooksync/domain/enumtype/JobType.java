package com.example.audiobooksync.domain.enumtype;

public enum JobType {
    IMPORT,
    SYNC
}
