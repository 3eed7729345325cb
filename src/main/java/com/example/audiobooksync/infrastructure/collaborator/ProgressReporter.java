package com.example.audiobooksync.infrastructure.collaborator;

import org.slf4j.event.Level;

/**
 * Progress, log and cancellation channel of one running job.
 */
public interface ProgressReporter {

    void log(Level level, String message, String detail);

    void updateProgress(int current, int total, String message);

    boolean isCanceled();
}
