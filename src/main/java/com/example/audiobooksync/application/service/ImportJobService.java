package com.example.audiobooksync.application.service;

import com.example.audiobooksync.api.request.CreateImportJobRequest;
import com.example.audiobooksync.api.request.CreateSyncJobRequest;
import com.example.audiobooksync.api.response.CreateImportJobResponse;
import com.example.audiobooksync.api.response.ImportJobDetailResponse;
import com.example.audiobooksync.api.response.ImportJobLogResponse;
import com.example.audiobooksync.common.config.AppLibraryProperties;
import com.example.audiobooksync.common.exception.BusinessException;
import com.example.audiobooksync.common.exception.ExportParseException;
import com.example.audiobooksync.common.logging.JobMdc;
import com.example.audiobooksync.domain.enumtype.JobPhase;
import com.example.audiobooksync.domain.enumtype.JobStatus;
import com.example.audiobooksync.domain.enumtype.JobType;
import com.example.audiobooksync.domain.enumtype.LibraryState;
import com.example.audiobooksync.domain.model.ImportJobParams;
import com.example.audiobooksync.domain.model.ImportStatus;
import com.example.audiobooksync.infrastructure.catalog.CatalogStore;
import com.example.audiobooksync.infrastructure.collaborator.DatabaseProgressReporter;
import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;
import com.example.audiobooksync.infrastructure.persistence.entity.ImportJobEntity;
import com.example.audiobooksync.infrastructure.persistence.entity.ImportJobLogEntity;
import com.example.audiobooksync.infrastructure.persistence.mapper.ImportJobLogMapper;
import com.example.audiobooksync.infrastructure.persistence.mapper.ImportJobMapper;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Creates import and sync jobs, runs them on the job executor and tracks their lifecycle
 * in {@code import_job}. Cancellation is a status change on the job row that the running
 * pipeline notices between two units.
 */
@Service
public class ImportJobService {

    private static final Logger log = LoggerFactory.getLogger(ImportJobService.class);

    private static final int MAX_LOG_ENTRIES = 500;

    private final ImportJobMapper importJobMapper;
    private final ImportJobLogMapper importJobLogMapper;
    private final CheckpointStore checkpointStore;
    private final ImportStatusRegistry importStatusRegistry;
    private final ImportPipelineService importPipelineService;
    private final LibrarySyncService librarySyncService;
    private final CatalogStore catalogStore;
    private final WriteBackBatcher writeBackBatcher;
    private final AppLibraryProperties appLibraryProperties;
    private final ExecutorService importJobExecutor;
    private final LocalDateTime processStart = LocalDateTime.now();

    public ImportJobService(ImportJobMapper importJobMapper,
                            ImportJobLogMapper importJobLogMapper,
                            CheckpointStore checkpointStore,
                            ImportStatusRegistry importStatusRegistry,
                            ImportPipelineService importPipelineService,
                            LibrarySyncService librarySyncService,
                            CatalogStore catalogStore,
                            WriteBackBatcher writeBackBatcher,
                            AppLibraryProperties appLibraryProperties,
                            @Qualifier("importJobExecutor") ExecutorService importJobExecutor) {
        this.importJobMapper = importJobMapper;
        this.importJobLogMapper = importJobLogMapper;
        this.checkpointStore = checkpointStore;
        this.importStatusRegistry = importStatusRegistry;
        this.importPipelineService = importPipelineService;
        this.librarySyncService = librarySyncService;
        this.catalogStore = catalogStore;
        this.writeBackBatcher = writeBackBatcher;
        this.appLibraryProperties = appLibraryProperties;
        this.importJobExecutor = importJobExecutor;
    }

    public CreateImportJobResponse createImportJob(CreateImportJobRequest request) {
        ImportJobParams params = new ImportJobParams();
        params.setExportPath(request.getExportPath().trim());
        if (request.getImportMode() != null) {
            params.setImportMode(request.getImportMode());
        }
        params.setPathMappings(request.getPathMappings() == null ? new ArrayList<>() : request.getPathMappings());
        params.setSkipDuplicates(request.isSkipDuplicates());
        params.setEnrichMetadata(request.isEnrichMetadata());
        params.setAutoOrganize(request.isAutoOrganize());
        params.setPreserveLocation(request.isPreserveLocation());
        params.setImportPlaylists(request.isImportPlaylists());
        return createJob(JobType.IMPORT, params);
    }

    public CreateImportJobResponse createSyncJob(CreateSyncJobRequest request) {
        String exportPath = StringUtils.hasText(request.getExportPath())
                ? request.getExportPath().trim() : appLibraryProperties.getExportPath();
        if (!StringUtils.hasText(exportPath)) {
            throw new BusinessException("400", "Export path is required", "Pass exportPath or set app.library.export-path");
        }
        ImportJobParams params = new ImportJobParams();
        params.setExportPath(exportPath);
        params.setPathMappings(request.getPathMappings() != null
                ? request.getPathMappings() : new ArrayList<>(appLibraryProperties.getPathMappings()));
        params.setImportPlaylists(request.isImportPlaylists());
        params.setForce(request.isForce());
        return createJob(JobType.SYNC, params);
    }

    /**
     * @return whether a sync job for the export is pending or running
     */
    public boolean hasActiveSync(String exportPath) {
        return importJobMapper.countActive(JobType.SYNC.name(), exportPath) > 0;
    }

    public ImportJobDetailResponse getJob(Long jobId) {
        ImportJobEntity entity = importJobMapper.selectById(jobId);
        if (entity == null) {
            throw new BusinessException("404", "Job not found: " + jobId);
        }
        return toDetailResponse(entity, importStatusRegistry.snapshot(jobId));
    }

    public List<ImportJobDetailResponse> listRecentJobs(int limit) {
        int bounded = Math.max(1, Math.min(limit, 100));
        return importJobMapper.selectRecent(bounded).stream()
                .map(entity -> toDetailResponse(entity, importStatusRegistry.snapshot(entity.getId())))
                .collect(Collectors.toList());
    }

    public boolean cancelJob(Long jobId) {
        ImportJobEntity entity = importJobMapper.selectById(jobId);
        if (entity == null) {
            return false;
        }
        int affected = importJobMapper.cancel(jobId);
        if (affected > 0) {
            log.info("IMPORT_JOB_CANCELED jobId={} fromStatus={}", jobId, entity.getStatus());
        } else {
            log.info("IMPORT_JOB_CANCEL_IGNORED jobId={} currentStatus={}", jobId, entity.getStatus());
        }
        return true;
    }

    /**
     * Runs a canceled or failed job again with its stored parameters. The pipeline picks up
     * at the job's last checkpoint. A job still marked running from before this process
     * started is resumed too.
     */
    public CreateImportJobResponse resumeJob(Long jobId) {
        ImportJobEntity entity = importJobMapper.selectById(jobId);
        if (entity == null) {
            throw new BusinessException("404", "Job not found: " + jobId);
        }
        ImportJobParams params = checkpointStore.loadParams(jobId);
        if (params == null) {
            throw new BusinessException("400", "Job " + jobId + " has no resumable state",
                    "Start a new import instead");
        }
        if (importJobMapper.resetForResume(jobId, processStart) == 0) {
            if (JobStatus.RUNNING.name().equals(entity.getStatus())) {
                throw new BusinessException("400", "Job " + jobId + " is still running and cannot be resumed",
                        "Cancel the job first, then resume it");
            }
            throw new BusinessException("400", "Job " + jobId + " is " + entity.getStatus() + " and cannot be resumed");
        }
        JobType jobType = JobType.valueOf(entity.getJobType());
        log.info("IMPORT_JOB_RESUMED jobId={} type={} fromStatus={}", jobId, jobType, entity.getStatus());
        submit(jobId, jobType, params);
        return new CreateImportJobResponse(jobId, JobStatus.PENDING.name());
    }

    public List<ImportJobLogResponse> listLogs(Long jobId, int limit) {
        if (importJobMapper.selectById(jobId) == null) {
            throw new BusinessException("404", "Job not found: " + jobId);
        }
        int bounded = Math.max(1, Math.min(limit, MAX_LOG_ENTRIES));
        List<ImportJobLogResponse> result = new ArrayList<>();
        for (ImportJobLogEntity entry : importJobLogMapper.selectByJobId(jobId, bounded)) {
            result.add(new ImportJobLogResponse(entry.getId(), entry.getLevel(), entry.getMessage(),
                    entry.getDetail(), entry.getCreatedAt()));
        }
        return result;
    }

    private CreateImportJobResponse createJob(JobType jobType, ImportJobParams params) {
        if (!Files.isRegularFile(Paths.get(params.getExportPath()))) {
            throw new BusinessException("400", "Library export not found: " + params.getExportPath(),
                    "Check the export path");
        }
        ImportJobEntity entity = new ImportJobEntity();
        entity.setJobType(jobType.name());
        entity.setStatus(JobStatus.PENDING.name());
        entity.setPhase(JobPhase.IMPORTING.name());
        entity.setExportPath(params.getExportPath());
        importJobMapper.insert(entity);
        checkpointStore.saveParams(entity.getId(), params);
        log.info("IMPORT_JOB_CREATED jobId={} type={} export={} mode={}", entity.getId(), jobType,
                params.getExportPath(), params.getImportMode());

        submit(entity.getId(), jobType, params);
        return new CreateImportJobResponse(entity.getId(), JobStatus.PENDING.name());
    }

    private void submit(Long jobId, JobType jobType, ImportJobParams params) {
        try {
            importJobExecutor.submit(() -> executeJob(jobId, jobType, params));
        } catch (RejectedExecutionException e) {
            importJobMapper.markFailedBeforeRunning(jobId, "Job scheduling failed: " + truncate(e.getMessage(), 400));
            throw new BusinessException("TASK_EXECUTOR_REJECTED", "Job executor is busy, retry later");
        }
    }

    void executeJob(Long jobId, JobType jobType, ImportJobParams params) {
        try (MDC.MDCCloseable ignored = JobMdc.putJobId(jobId)) {
            if (importJobMapper.markRunning(jobId) == 0) {
                log.info("IMPORT_JOB_START_SKIPPED jobId={} currentStatus={}", jobId, importJobMapper.selectStatusById(jobId));
                return;
            }
            log.info("IMPORT_JOB_RUNNING jobId={} type={}", jobId, jobType);
            ImportStatus status = importStatusRegistry.start(jobId);
            ImportJobContext ctx = new ImportJobContext(jobId, params, status,
                    new DatabaseProgressReporter(jobId, importJobMapper, importJobLogMapper),
                    phase -> importJobMapper.updatePhase(jobId, phase.name()));
            try {
                JobPhase outcome = jobType == JobType.SYNC
                        ? librarySyncService.sync(ctx)
                        : importPipelineService.run(ctx);
                finish(ctx, outcome);
            } catch (Exception e) {
                fail(ctx, e);
            } finally {
                importStatusRegistry.finish(jobId);
            }
        }
    }

    private void finish(ImportJobContext ctx, JobPhase outcome) {
        Long jobId = ctx.getJobId();
        ImportStatus.Snapshot snapshot = ctx.getStatus().snapshot();
        String errorSummary = snapshot.getErrors().isEmpty() ? null : truncate(String.join("; ", snapshot.getErrors()), 1000);
        if (outcome == JobPhase.CANCELED) {
            importJobMapper.updateCanceledSummary(jobId, ctx.getPhase().name(),
                    "Canceled at " + snapshot.getProcessed() + "/" + snapshot.getTotal(), errorSummary);
            log.info("IMPORT_JOB_RESULT jobId={} status={} phase={} processed={} total={}",
                    jobId, JobStatus.CANCELED, ctx.getPhase(), snapshot.getProcessed(), snapshot.getTotal());
            return;
        }
        int finished = importJobMapper.markFinished(jobId, JobStatus.COMPLETED.name(), JobPhase.COMPLETED.name(),
                ctx.getSummary(), errorSummary);
        if (finished == 0) {
            // canceled after the last unit was committed
            importJobMapper.updateCanceledSummary(jobId, JobPhase.COMPLETED.name(), ctx.getSummary(), errorSummary);
            log.info("IMPORT_JOB_RESULT jobId={} status={} summary={}", jobId, JobStatus.CANCELED, ctx.getSummary());
        } else {
            log.info("IMPORT_JOB_RESULT jobId={} status={} imported={} updated={} unchanged={} skipped={} failed={}",
                    jobId, JobStatus.COMPLETED, snapshot.getImported(), snapshot.getUpdated(), snapshot.getUnchanged(),
                    snapshot.getSkipped(), snapshot.getFailed());
        }
        if (appLibraryProperties.isAutoWriteBack() && ctx.getParams().isReorganizeRequested()) {
            queueOrganizedBooks(ctx);
        }
    }

    /**
     * A malformed export can never succeed, so its state is dropped. Other failures keep
     * the checkpoint and the job can be resumed.
     */
    private void fail(ImportJobContext ctx, Exception e) {
        Long jobId = ctx.getJobId();
        log.error("Import job failed, jobId={}", jobId, e);
        String reason = truncate(e.getMessage(), 1000);
        ctx.getStatus().recordError(reason);
        if (e instanceof ExportParseException) {
            checkpointStore.clearState(jobId);
        }
        if (JobStatus.CANCELED.name().equals(importJobMapper.selectStatusById(jobId))) {
            importJobMapper.updateCanceledSummary(jobId, ctx.getPhase().name(), null, reason);
            return;
        }
        importJobMapper.markFinished(jobId, JobStatus.FAILED.name(), JobPhase.FAILED.name(), null, reason);
        log.info("IMPORT_JOB_RESULT jobId={} status={} phase={}", jobId, JobStatus.FAILED, ctx.getPhase());
    }

    private void queueOrganizedBooks(ImportJobContext ctx) {
        List<Long> organized = new ArrayList<>();
        for (BookEntity book : catalogStore.listBooksByImportJob(ctx.getJobId())) {
            if (LibraryState.ORGANIZED.dbValue().equals(book.getLibraryState())
                    && StringUtils.hasText(book.getPersistentId())) {
                organized.add(book.getId());
            }
        }
        writeBackBatcher.enqueue(organized);
    }

    private ImportJobDetailResponse toDetailResponse(ImportJobEntity entity, ImportStatus.Snapshot snapshot) {
        ImportJobDetailResponse response = new ImportJobDetailResponse();
        response.setJobId(entity.getId());
        response.setJobType(entity.getJobType());
        response.setStatus(entity.getStatus());
        response.setPhase(entity.getPhase());
        response.setExportPath(entity.getExportPath());
        int current = nullSafeInt(entity.getProgressCurrent());
        int total = nullSafeInt(entity.getProgressTotal());
        response.setProgressCurrent(current);
        response.setProgressTotal(total);
        response.setProgressPct(total <= 0 ? 0 : (int) Math.min(100L, current * 100L / total));
        response.setMessage(entity.getMessage());
        response.setErrorSummary(entity.getErrorSummary());
        response.setStartTime(entity.getStartTime());
        response.setEndTime(entity.getEndTime());
        if (snapshot != null) {
            response.setTotal(snapshot.getTotal());
            response.setProcessed(snapshot.getProcessed());
            response.setImported(snapshot.getImported());
            response.setUpdated(snapshot.getUpdated());
            response.setUnchanged(snapshot.getUnchanged());
            response.setSkipped(snapshot.getSkipped());
            response.setFailed(snapshot.getFailed());
            response.setErrors(snapshot.getErrors());
        }
        return response;
    }

    private int nullSafeInt(Integer value) {
        return value == null ? 0 : value;
    }

    private String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
