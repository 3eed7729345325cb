package com.example.audiobooksync.application.service;

import com.example.audiobooksync.domain.enumtype.JobPhase;
import com.example.audiobooksync.domain.model.ImportJobParams;
import com.example.audiobooksync.domain.model.ImportStatus;
import com.example.audiobooksync.infrastructure.collaborator.ProgressReporter;
import java.util.function.Consumer;

public class ImportJobContext {

    private final Long jobId;
    private final ImportJobParams params;
    private final ImportStatus status;
    private final ProgressReporter reporter;
    private final Consumer<JobPhase> phaseListener;

    private JobPhase phase = JobPhase.IMPORTING;
    private String summary;

    public ImportJobContext(Long jobId,
                            ImportJobParams params,
                            ImportStatus status,
                            ProgressReporter reporter,
                            Consumer<JobPhase> phaseListener) {
        this.jobId = jobId;
        this.params = params;
        this.status = status;
        this.reporter = reporter;
        this.phaseListener = phaseListener;
    }

    public void transitionTo(JobPhase next) {
        if (phase == next) {
            return;
        }
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + jobId + " cannot move from " + phase + " to " + next);
        }
        phase = next;
        phaseListener.accept(next);
    }

    public Long getJobId() {
        return jobId;
    }

    public ImportJobParams getParams() {
        return params;
    }

    public ImportStatus getStatus() {
        return status;
    }

    public ProgressReporter getReporter() {
        return reporter;
    }

    public JobPhase getPhase() {
        return phase;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }
}
