package com.example.audiobooksync.application.service;

import com.example.audiobooksync.common.config.AppImportProperties;
import com.example.audiobooksync.common.exception.LocationDecodeException;
import com.example.audiobooksync.domain.enumtype.JobPhase;
import com.example.audiobooksync.domain.model.AlbumGroup;
import com.example.audiobooksync.domain.model.ImportCheckpoint;
import com.example.audiobooksync.domain.model.ImportJobParams;
import com.example.audiobooksync.domain.model.ImportStatus;
import com.example.audiobooksync.domain.model.LibraryExport;
import com.example.audiobooksync.domain.model.LibraryFingerprint;
import com.example.audiobooksync.domain.model.Track;
import com.example.audiobooksync.infrastructure.catalog.CatalogStore;
import com.example.audiobooksync.infrastructure.collaborator.ProgressReporter;
import com.example.audiobooksync.infrastructure.export.LibraryExportParser;
import com.example.audiobooksync.infrastructure.export.LibraryFingerprintService;
import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Re-reads the export and mirrors play statistics onto books matched by persistent id.
 * Groups whose persistent id is unknown are created as new books; groups without a
 * persistent id are skipped.
 */
@Service
public class LibrarySyncService {

    private static final Logger log = LoggerFactory.getLogger(LibrarySyncService.class);

    private final LibraryExportParser libraryExportParser;
    private final AlbumGrouper albumGrouper;
    private final BookAssembler bookAssembler;
    private final BookCatalogWriter bookCatalogWriter;
    private final PlaylistTagResolver playlistTagResolver;
    private final CatalogStore catalogStore;
    private final CheckpointStore checkpointStore;
    private final LibraryFingerprintService libraryFingerprintService;
    private final AppImportProperties appImportProperties;
    private final MeterRegistry meterRegistry;

    public LibrarySyncService(LibraryExportParser libraryExportParser,
                              AlbumGrouper albumGrouper,
                              BookAssembler bookAssembler,
                              BookCatalogWriter bookCatalogWriter,
                              PlaylistTagResolver playlistTagResolver,
                              CatalogStore catalogStore,
                              CheckpointStore checkpointStore,
                              LibraryFingerprintService libraryFingerprintService,
                              AppImportProperties appImportProperties,
                              ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.libraryExportParser = libraryExportParser;
        this.albumGrouper = albumGrouper;
        this.bookAssembler = bookAssembler;
        this.bookCatalogWriter = bookCatalogWriter;
        this.playlistTagResolver = playlistTagResolver;
        this.catalogStore = catalogStore;
        this.checkpointStore = checkpointStore;
        this.libraryFingerprintService = libraryFingerprintService;
        this.appImportProperties = appImportProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public JobPhase sync(ImportJobContext ctx) {
        Long jobId = ctx.getJobId();
        ImportJobParams params = ctx.getParams();
        ImportStatus status = ctx.getStatus();
        ProgressReporter reporter = ctx.getReporter();
        Path exportPath = Paths.get(params.getExportPath());

        if (!params.isForce() && isUnchanged(exportPath)) {
            String summary = "Sync skipped: library export unchanged since last sync";
            ctx.transitionTo(JobPhase.COMPLETED);
            checkpointStore.clearState(jobId);
            ctx.setSummary(summary);
            reporter.log(Level.INFO, summary, params.getExportPath());
            log.info("LIBRARY_SYNC_UNCHANGED jobId={} export={}", jobId, exportPath);
            return JobPhase.COMPLETED;
        }

        LibraryExport export = libraryExportParser.parse(exportPath);
        List<AlbumGroup> groups = albumGrouper.group(export.getTracks());
        int total = groups.size();
        status.setTotal(total);
        Map<Integer, Set<String>> playlistIndex = params.isImportPlaylists()
                ? playlistTagResolver.indexByTrackId(export.getPlaylists())
                : Collections.emptyMap();

        ImportCheckpoint checkpoint = checkpointStore.loadCheckpoint(jobId);
        int startIndex = checkpoint != null && checkpoint.getPhase() == JobPhase.IMPORTING
                ? Math.min(Math.max(0, checkpoint.getIndex()), total) : 0;
        log.info("LIBRARY_SYNC_START jobId={} export={} groups={} startIndex={}", jobId, exportPath, total, startIndex);
        status.setProcessed(startIndex);

        int batch = Math.max(1, appImportProperties.getProgressBatchSize());
        int checkpointInterval = Math.max(1, appImportProperties.getCheckpointInterval());
        for (int i = startIndex; i < total; i++) {
            if (reporter.isCanceled()) {
                checkpointStore.saveCheckpoint(jobId, JobPhase.IMPORTING, i, total);
                log.info("LIBRARY_SYNC_CANCELED jobId={} index={} total={}", jobId, i, total);
                return JobPhase.CANCELED;
            }
            String result = syncGroup(ctx, groups.get(i), playlistIndex);
            incrementCounter("audiobook.sync.group", "result", result);

            int processed = i + 1;
            status.setProcessed(processed);
            if (processed % checkpointInterval == 0 && processed < total) {
                checkpointStore.saveCheckpoint(jobId, JobPhase.IMPORTING, processed, total);
            }
            if (processed % batch == 0 || processed == total) {
                reporter.updateProgress(processed, total, "Syncing library (" + processed + "/" + total + ")");
            }
        }

        ctx.transitionTo(JobPhase.COMPLETED);
        checkpointStore.clearState(jobId);
        try {
            catalogStore.saveLibraryFingerprint(libraryFingerprintService.compute(exportPath));
        } catch (IOException e) {
            status.recordError("Failed to fingerprint library export: " + e.getMessage());
            log.warn("LIBRARY_FINGERPRINT_FAILED jobId={} path={} reason={}", jobId, exportPath, e.getMessage());
        }

        String summary = status.syncSummary();
        ctx.setSummary(summary);
        reporter.updateProgress(total, total, summary);
        reporter.log(Level.INFO, summary, null);
        log.info("LIBRARY_SYNC_DONE jobId={} summary={}", jobId, summary);
        return JobPhase.COMPLETED;
    }

    private String syncGroup(ImportJobContext ctx, AlbumGroup group, Map<Integer, Set<String>> playlistIndex) {
        ImportStatus status = ctx.getStatus();
        Track first = group.getAuthoritativeTrack();
        if (first == null || first.getPersistentId().trim().isEmpty()) {
            status.incrementSkipped();
            return "skipped";
        }
        String persistentId = first.getPersistentId().trim();
        try {
            BookEntity existing = catalogStore.getBookByPersistentId(persistentId);
            if (existing != null) {
                if (applyPlayStatistics(existing, first)) {
                    catalogStore.updateBook(existing);
                    status.incrementUpdated();
                    return "updated";
                }
                status.incrementUnchanged();
                return "unchanged";
            }
            BookCandidate candidate = bookAssembler.assemble(group, ctx.getParams(), ctx.getJobId());
            bookCatalogWriter.create(candidate, playlistTagResolver.tagsFor(group, playlistIndex));
            status.incrementImported();
            return "new";
        } catch (LocationDecodeException | IOException e) {
            recordFailure(ctx, "Failed to sync '" + group.getKey() + "': " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("LIBRARY_SYNC_GROUP_ERROR jobId={} group={}", ctx.getJobId(), group.getKey(), e);
            recordFailure(ctx, "Failed to sync '" + group.getKey() + "': " + e.getMessage());
        }
        return "failed";
    }

    /**
     * Copies play count, rating, bookmark and last-played from the track.
     *
     * @return whether any field changed
     */
    static boolean applyPlayStatistics(BookEntity book, Track track) {
        boolean changed = false;
        if (!Objects.equals(book.getPlayCount(), track.getPlayCount())) {
            book.setPlayCount(track.getPlayCount());
            changed = true;
        }
        if (!Objects.equals(book.getRating(), track.getRating())) {
            book.setRating(track.getRating());
            changed = true;
        }
        if (!Objects.equals(book.getBookmarkMs(), track.getBookmark())) {
            book.setBookmarkMs(track.getBookmark());
            changed = true;
        }
        LocalDateTime lastPlayed = toLocalDateTime(track.getLastPlayed());
        if (!Objects.equals(book.getLastPlayedAt(), lastPlayed)) {
            book.setLastPlayedAt(lastPlayed);
            changed = true;
        }
        return changed;
    }

    private boolean isUnchanged(Path exportPath) {
        LibraryFingerprint stored = catalogStore.getLibraryFingerprint(LibraryFingerprintService.keyOf(exportPath));
        if (stored == null) {
            return false;
        }
        try {
            return stored.matches(libraryFingerprintService.computeCheap(exportPath), false);
        } catch (IOException e) {
            log.warn("LIBRARY_FINGERPRINT_CHECK_FAILED path={} reason={}", exportPath, e.getMessage());
            return false;
        }
    }

    private void recordFailure(ImportJobContext ctx, String message) {
        String limited = message.length() <= 1000 ? message : message.substring(0, 1000);
        ctx.getStatus().recordFailure(limited);
        ctx.getReporter().log(Level.WARN, limited, null);
        log.warn("LIBRARY_SYNC_GROUP_FAILED jobId={} reason={}", ctx.getJobId(), limited);
    }

    private static LocalDateTime toLocalDateTime(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private void incrementCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", name, e);
        }
    }
}
