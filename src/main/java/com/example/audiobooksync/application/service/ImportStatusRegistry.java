package com.example.audiobooksync.application.service;

import com.example.audiobooksync.common.config.AppImportProperties;
import com.example.audiobooksync.domain.model.ImportStatus;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

@Component
public class ImportStatusRegistry {

    static final int DEFAULT_FINISHED_RETENTION = 100;

    private final Map<Long, ImportStatus> running = new ConcurrentHashMap<>();
    private final Map<Long, ImportStatus> finished;
    private final AppImportProperties appImportProperties;

    public ImportStatusRegistry(AppImportProperties appImportProperties) {
        this(appImportProperties, DEFAULT_FINISHED_RETENTION);
    }

    ImportStatusRegistry(AppImportProperties appImportProperties, int finishedRetention) {
        this.appImportProperties = appImportProperties;
        this.finished = Collections.synchronizedMap(new LinkedHashMap<Long, ImportStatus>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Long, ImportStatus> eldest) {
                return size() > finishedRetention;
            }
        });
    }

    /**
     * Starts a fresh status for the job, replacing one left from an earlier run.
     */
    public ImportStatus start(Long jobId) {
        ImportStatus status = new ImportStatus(appImportProperties.getErrorLimit());
        finished.remove(jobId);
        running.put(jobId, status);
        return status;
    }

    /**
     * Moves the job's status to the bounded set of recently finished jobs; older ones are
     * dropped and only their job row remains.
     */
    public void finish(Long jobId) {
        ImportStatus status = running.remove(jobId);
        if (status != null) {
            finished.put(jobId, status);
        }
    }

    public ImportStatus.Snapshot snapshot(Long jobId) {
        ImportStatus status = running.get(jobId);
        if (status == null) {
            status = finished.get(jobId);
        }
        return status == null ? null : status.snapshot();
    }

    int runningCount() {
        return running.size();
    }
}
