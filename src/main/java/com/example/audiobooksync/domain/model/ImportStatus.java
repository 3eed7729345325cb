package com.example.audiobooksync.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Value;

/**
 * Live counters of one job. Written by the pipeline, read by status polling; every access
 * goes through the same lock and readers only ever see a {@link #snapshot()} copy.
 */
public class ImportStatus {

    private final ReentrantLock lock = new ReentrantLock();
    private final int errorLimit;

    private int total;
    private int processed;
    /** Books created; reported as "new" by sync. */
    private int imported;
    private int updated;
    private int unchanged;
    private int skipped;
    private int failed;
    private final List<String> errors = new ArrayList<>();

    public ImportStatus(int errorLimit) {
        this.errorLimit = Math.max(0, errorLimit);
    }

    public void setTotal(int total) {
        lock.lock();
        try {
            this.total = total;
        } finally {
            lock.unlock();
        }
    }

    public void setProcessed(int processed) {
        lock.lock();
        try {
            this.processed = processed;
        } finally {
            lock.unlock();
        }
    }

    public void incrementImported() {
        lock.lock();
        try {
            imported++;
        } finally {
            lock.unlock();
        }
    }

    public void incrementUpdated() {
        lock.lock();
        try {
            updated++;
        } finally {
            lock.unlock();
        }
    }

    public void incrementUnchanged() {
        lock.lock();
        try {
            unchanged++;
        } finally {
            lock.unlock();
        }
    }

    public void incrementSkipped() {
        lock.lock();
        try {
            skipped++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Counts a per-item failure. The message is kept only while the error list is below its cap.
     */
    public void recordFailure(String message) {
        lock.lock();
        try {
            failed++;
            appendError(message);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Keeps a job-level error message without touching the failure counter.
     */
    public void recordError(String message) {
        lock.lock();
        try {
            appendError(message);
        } finally {
            lock.unlock();
        }
    }

    private void appendError(String message) {
        if (message != null && errors.size() < errorLimit) {
            errors.add(message);
        }
    }

    public Snapshot snapshot() {
        lock.lock();
        try {
            return new Snapshot(total, processed, imported, updated, unchanged, skipped, failed,
                    Collections.unmodifiableList(new ArrayList<>(errors)));
        } finally {
            lock.unlock();
        }
    }

    public String importSummary() {
        Snapshot s = snapshot();
        return "Import completed: " + s.getImported() + " imported, " + s.getSkipped() + " skipped, "
                + s.getFailed() + " failed";
    }

    public String syncSummary() {
        Snapshot s = snapshot();
        return "Sync completed: " + s.getUpdated() + " updated, " + s.getImported() + " new, "
                + s.getUnchanged() + " unchanged, " + s.getSkipped() + " skipped, " + s.getFailed() + " failed";
    }

    @Value
    public static class Snapshot {
        int total;
        int processed;
        int imported;
        int updated;
        int unchanged;
        int skipped;
        int failed;
        List<String> errors;
    }
}
