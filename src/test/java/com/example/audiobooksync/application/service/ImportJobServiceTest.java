package com.example.audiobooksync.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.audiobooksync.api.request.CreateImportJobRequest;
import com.example.audiobooksync.api.request.CreateSyncJobRequest;
import com.example.audiobooksync.api.response.CreateImportJobResponse;
import com.example.audiobooksync.api.response.ImportJobDetailResponse;
import com.example.audiobooksync.common.config.AppImportProperties;
import com.example.audiobooksync.common.config.AppLibraryProperties;
import com.example.audiobooksync.common.exception.BusinessException;
import com.example.audiobooksync.common.exception.ExportParseException;
import com.example.audiobooksync.domain.enumtype.ImportMode;
import com.example.audiobooksync.domain.enumtype.JobPhase;
import com.example.audiobooksync.domain.enumtype.JobType;
import com.example.audiobooksync.domain.model.ImportJobParams;
import com.example.audiobooksync.infrastructure.catalog.InMemoryCatalogStore;
import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;
import com.example.audiobooksync.infrastructure.persistence.entity.ImportJobEntity;
import com.example.audiobooksync.infrastructure.persistence.mapper.ImportJobLogMapper;
import com.example.audiobooksync.infrastructure.persistence.mapper.ImportJobMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

class ImportJobServiceTest {

    private static final Long JOB_ID = 11L;

    @TempDir
    Path dir;

    private ImportJobMapper importJobMapper;
    private CheckpointStore checkpointStore;
    private ImportStatusRegistry importStatusRegistry;
    private ImportPipelineService importPipelineService;
    private LibrarySyncService librarySyncService;
    private InMemoryCatalogStore catalogStore;
    private WriteBackBatcher writeBackBatcher;
    private AppLibraryProperties appLibraryProperties;
    private ExecutorService executor;
    private ImportJobService service;
    private Path export;

    @BeforeEach
    void setUp() throws Exception {
        importJobMapper = mock(ImportJobMapper.class);
        checkpointStore = mock(CheckpointStore.class);
        importStatusRegistry = new ImportStatusRegistry(new AppImportProperties());
        importPipelineService = mock(ImportPipelineService.class);
        librarySyncService = mock(LibrarySyncService.class);
        catalogStore = new InMemoryCatalogStore();
        writeBackBatcher = mock(WriteBackBatcher.class);
        appLibraryProperties = new AppLibraryProperties();
        executor = mock(ExecutorService.class);
        service = new ImportJobService(importJobMapper, mock(ImportJobLogMapper.class), checkpointStore,
                importStatusRegistry, importPipelineService, librarySyncService, catalogStore, writeBackBatcher,
                appLibraryProperties, executor);

        export = Files.write(dir.resolve("Library.xml"), "<plist/>".getBytes());
        doAnswer(invocation -> {
            ((ImportJobEntity) invocation.getArgument(0)).setId(JOB_ID);
            return 1;
        }).when(importJobMapper).insert(any(ImportJobEntity.class));
        when(importJobMapper.markRunning(JOB_ID)).thenReturn(1);
        when(importJobMapper.selectStatusById(JOB_ID)).thenReturn("RUNNING");
    }

    @Test
    void createImportJobShouldStoreParamsAndSubmit() {
        CreateImportJobRequest request = new CreateImportJobRequest();
        request.setExportPath(" " + export + " ");
        request.setImportMode(ImportMode.ORGANIZE);
        request.setEnrichMetadata(true);

        CreateImportJobResponse response = service.createImportJob(request);

        assertEquals(JOB_ID, response.getJobId());
        assertEquals("PENDING", response.getStatus());
        ArgumentCaptor<ImportJobParams> params = ArgumentCaptor.forClass(ImportJobParams.class);
        verify(checkpointStore).saveParams(eq(JOB_ID), params.capture());
        assertEquals(export.toString(), params.getValue().getExportPath());
        assertEquals(ImportMode.ORGANIZE, params.getValue().getImportMode());
        assertTrue(params.getValue().isSkipDuplicates());
        assertTrue(params.getValue().isEnrichMetadata());
        verify(executor).submit(any(Runnable.class));
    }

    @Test
    void missingExportShouldBeRejectedBeforeAnyRowIsWritten() {
        CreateImportJobRequest request = new CreateImportJobRequest();
        request.setExportPath(dir.resolve("absent.xml").toString());

        BusinessException error = assertThrows(BusinessException.class, () -> service.createImportJob(request));

        assertEquals("400", error.getCode());
        verify(importJobMapper, never()).insert(any(ImportJobEntity.class));
    }

    @Test
    void rejectedSubmitShouldFailTheJob() {
        when(executor.submit(any(Runnable.class))).thenThrow(new RejectedExecutionException("queue full"));
        CreateImportJobRequest request = new CreateImportJobRequest();
        request.setExportPath(export.toString());

        BusinessException error = assertThrows(BusinessException.class, () -> service.createImportJob(request));

        assertEquals("TASK_EXECUTOR_REJECTED", error.getCode());
        verify(importJobMapper).markFailedBeforeRunning(eq(JOB_ID), anyString());
    }

    @Test
    void createSyncJobShouldDefaultToConfiguredExport() {
        appLibraryProperties.setExportPath(export.toString());
        CreateSyncJobRequest request = new CreateSyncJobRequest();
        request.setForce(true);

        service.createSyncJob(request);

        ArgumentCaptor<ImportJobEntity> entity = ArgumentCaptor.forClass(ImportJobEntity.class);
        verify(importJobMapper).insert(entity.capture());
        assertEquals("SYNC", entity.getValue().getJobType());
        assertEquals(export.toString(), entity.getValue().getExportPath());
        ArgumentCaptor<ImportJobParams> params = ArgumentCaptor.forClass(ImportJobParams.class);
        verify(checkpointStore).saveParams(eq(JOB_ID), params.capture());
        assertTrue(params.getValue().isForce());
    }

    @Test
    void completedRunShouldMarkJobFinished() {
        when(importPipelineService.run(any(ImportJobContext.class))).thenAnswer(invocation -> {
            ImportJobContext ctx = invocation.getArgument(0);
            ctx.getStatus().incrementImported();
            ctx.transitionTo(JobPhase.COMPLETED);
            ctx.setSummary("Import completed: 1 imported, 0 skipped, 0 failed");
            return JobPhase.COMPLETED;
        });
        when(importJobMapper.markFinished(eq(JOB_ID), anyString(), anyString(), any(), any())).thenReturn(1);

        service.executeJob(JOB_ID, JobType.IMPORT, params());

        verify(importJobMapper).markFinished(JOB_ID, "COMPLETED", "COMPLETED",
                "Import completed: 1 imported, 0 skipped, 0 failed", null);
        verify(importJobMapper).updatePhase(JOB_ID, "COMPLETED");
        assertEquals(1, importStatusRegistry.snapshot(JOB_ID).getImported());
        assertEquals(0, importStatusRegistry.runningCount());
    }

    @Test
    void syncJobShouldRunTheSyncService() {
        when(librarySyncService.sync(any(ImportJobContext.class))).thenReturn(JobPhase.COMPLETED);
        when(importJobMapper.markFinished(eq(JOB_ID), anyString(), anyString(), any(), any())).thenReturn(1);

        service.executeJob(JOB_ID, JobType.SYNC, params());

        verify(librarySyncService).sync(any(ImportJobContext.class));
        verify(importPipelineService, never()).run(any(ImportJobContext.class));
    }

    @Test
    void jobNoLongerPendingShouldNotRun() {
        when(importJobMapper.markRunning(JOB_ID)).thenReturn(0);

        service.executeJob(JOB_ID, JobType.IMPORT, params());

        verify(importPipelineService, never()).run(any(ImportJobContext.class));
    }

    @Test
    void canceledRunShouldKeepCheckpointAndRecordSummary() {
        when(importPipelineService.run(any(ImportJobContext.class))).thenReturn(JobPhase.CANCELED);

        service.executeJob(JOB_ID, JobType.IMPORT, params());

        verify(importJobMapper).updateCanceledSummary(eq(JOB_ID), eq("IMPORTING"), anyString(), isNull());
        verify(checkpointStore, never()).clearState(JOB_ID);
        verify(importJobMapper, never()).markFinished(eq(JOB_ID), anyString(), anyString(), any(), any());
    }

    @Test
    void parseFailureShouldDropStateAndFailTheJob() {
        when(importPipelineService.run(any(ImportJobContext.class)))
                .thenThrow(new ExportParseException("Malformed library export"));

        service.executeJob(JOB_ID, JobType.IMPORT, params());

        verify(checkpointStore).clearState(JOB_ID);
        verify(importJobMapper).markFinished(JOB_ID, "FAILED", "FAILED", null, "Malformed library export");
    }

    @Test
    void otherFailureShouldKeepStateForResume() {
        when(importPipelineService.run(any(ImportJobContext.class)))
                .thenThrow(new IllegalStateException("database went away"));

        service.executeJob(JOB_ID, JobType.IMPORT, params());

        verify(checkpointStore, never()).clearState(JOB_ID);
        verify(importJobMapper).markFinished(JOB_ID, "FAILED", "FAILED", null, "database went away");
    }

    @Test
    void organizedBooksShouldBeQueuedForWriteBack() {
        appLibraryProperties.setAutoWriteBack(true);
        BookEntity organized = book("PID-1", "organized");
        book("PID-2", "imported");
        book(null, "organized");
        when(importPipelineService.run(any(ImportJobContext.class))).thenReturn(JobPhase.COMPLETED);
        when(importJobMapper.markFinished(eq(JOB_ID), anyString(), anyString(), any(), any())).thenReturn(1);
        ImportJobParams params = params();
        params.setAutoOrganize(true);

        service.executeJob(JOB_ID, JobType.IMPORT, params);

        verify(writeBackBatcher).enqueue(Collections.singletonList(organized.getId()));
    }

    @Test
    void resumeShouldResetAndResubmitWithStoredParams() {
        ImportJobEntity entity = new ImportJobEntity();
        entity.setId(JOB_ID);
        entity.setJobType("IMPORT");
        entity.setStatus("CANCELED");
        when(importJobMapper.selectById(JOB_ID)).thenReturn(entity);
        when(checkpointStore.loadParams(JOB_ID)).thenReturn(params());
        when(importJobMapper.resetForResume(eq(JOB_ID), any(LocalDateTime.class))).thenReturn(1);

        CreateImportJobResponse response = service.resumeJob(JOB_ID);

        assertEquals("PENDING", response.getStatus());
        verify(executor).submit(any(Runnable.class));
    }

    @Test
    void resumeOfRunningJobShouldBeRejected() {
        ImportJobEntity entity = new ImportJobEntity();
        entity.setId(JOB_ID);
        entity.setJobType("IMPORT");
        entity.setStatus("RUNNING");
        when(importJobMapper.selectById(JOB_ID)).thenReturn(entity);
        when(checkpointStore.loadParams(JOB_ID)).thenReturn(params());

        BusinessException error = assertThrows(BusinessException.class, () -> service.resumeJob(JOB_ID));

        assertEquals("400", error.getCode());
        assertEquals("Cancel the job first, then resume it", error.getUserAction());
        verify(executor, never()).submit(any(Runnable.class));
    }

    @Test
    void resumeOfJobLeftRunningByEarlierProcessShouldResubmit() {
        LocalDateTime before = LocalDateTime.now();
        ImportJobEntity entity = new ImportJobEntity();
        entity.setId(JOB_ID);
        entity.setJobType("IMPORT");
        entity.setStatus("RUNNING");
        when(importJobMapper.selectById(JOB_ID)).thenReturn(entity);
        when(checkpointStore.loadParams(JOB_ID)).thenReturn(params());
        when(importJobMapper.resetForResume(eq(JOB_ID), any(LocalDateTime.class))).thenReturn(1);

        CreateImportJobResponse response = service.resumeJob(JOB_ID);

        assertEquals("PENDING", response.getStatus());
        ArgumentCaptor<LocalDateTime> startedBefore = ArgumentCaptor.forClass(LocalDateTime.class);
        verify(importJobMapper).resetForResume(eq(JOB_ID), startedBefore.capture());
        assertFalse(startedBefore.getValue().isAfter(before));
        verify(executor).submit(any(Runnable.class));
    }

    @Test
    void unknownJobShouldBeNotFound() {
        BusinessException error = assertThrows(BusinessException.class, () -> service.getJob(99L));
        assertEquals("404", error.getCode());
        assertFalse(service.cancelJob(99L));
    }

    @Test
    void jobDetailShouldIncludeLiveCounters() {
        ImportJobEntity entity = new ImportJobEntity();
        entity.setId(JOB_ID);
        entity.setStatus("RUNNING");
        entity.setProgressCurrent(5);
        entity.setProgressTotal(20);
        when(importJobMapper.selectById(JOB_ID)).thenReturn(entity);
        importStatusRegistry.start(JOB_ID).recordFailure("File not found");

        ImportJobDetailResponse detail = service.getJob(JOB_ID);

        assertEquals(25, detail.getProgressPct());
        assertEquals(1, detail.getFailed());
        assertEquals(Collections.singletonList("File not found"), detail.getErrors());
    }

    private BookEntity book(String persistentId, String state) {
        BookEntity book = new BookEntity();
        book.setTitle("Book " + persistentId);
        book.setPersistentId(persistentId);
        book.setLibraryState(state);
        book.setImportJobId(JOB_ID);
        return catalogStore.createBook(book);
    }

    private ImportJobParams params() {
        ImportJobParams params = new ImportJobParams();
        params.setExportPath(export.toString());
        return params;
    }
}
