package com.example.audiobooksync.application.service;

import com.example.audiobooksync.common.config.AppImportProperties;
import com.example.audiobooksync.common.exception.LocationDecodeException;
import com.example.audiobooksync.common.exception.MetadataLookupException;
import com.example.audiobooksync.domain.enumtype.ImportMode;
import com.example.audiobooksync.domain.enumtype.JobPhase;
import com.example.audiobooksync.domain.enumtype.LibraryState;
import com.example.audiobooksync.domain.model.AlbumGroup;
import com.example.audiobooksync.domain.model.ImportCheckpoint;
import com.example.audiobooksync.domain.model.ImportJobParams;
import com.example.audiobooksync.domain.model.ImportStatus;
import com.example.audiobooksync.domain.model.LibraryExport;
import com.example.audiobooksync.infrastructure.catalog.CatalogStore;
import com.example.audiobooksync.infrastructure.collaborator.ContentHasher;
import com.example.audiobooksync.infrastructure.collaborator.MetadataEnricher;
import com.example.audiobooksync.infrastructure.collaborator.Organizer;
import com.example.audiobooksync.infrastructure.collaborator.ProgressReporter;
import com.example.audiobooksync.infrastructure.export.LibraryExportParser;
import com.example.audiobooksync.infrastructure.export.LibraryFingerprintService;
import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Runs an import job: album groups become catalog books, then the optional enrichment and
 * reorganize phases run over the books this job created. Each phase is checkpointed and can
 * be resumed; books are always iterated in creation order so checkpoint indices stay valid.
 */
@Service
public class ImportPipelineService {

    private static final Logger log = LoggerFactory.getLogger(ImportPipelineService.class);

    private final LibraryExportParser libraryExportParser;
    private final AlbumGrouper albumGrouper;
    private final BookAssembler bookAssembler;
    private final BookCatalogWriter bookCatalogWriter;
    private final PlaylistTagResolver playlistTagResolver;
    private final CatalogStore catalogStore;
    private final ContentHasher contentHasher;
    private final MetadataEnricher metadataEnricher;
    private final Organizer organizer;
    private final CheckpointStore checkpointStore;
    private final LibraryFingerprintService libraryFingerprintService;
    private final AppImportProperties appImportProperties;
    private final MeterRegistry meterRegistry;

    public ImportPipelineService(LibraryExportParser libraryExportParser,
                                 AlbumGrouper albumGrouper,
                                 BookAssembler bookAssembler,
                                 BookCatalogWriter bookCatalogWriter,
                                 PlaylistTagResolver playlistTagResolver,
                                 CatalogStore catalogStore,
                                 ContentHasher contentHasher,
                                 MetadataEnricher metadataEnricher,
                                 Organizer organizer,
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
        this.contentHasher = contentHasher;
        this.metadataEnricher = metadataEnricher;
        this.organizer = organizer;
        this.checkpointStore = checkpointStore;
        this.libraryFingerprintService = libraryFingerprintService;
        this.appImportProperties = appImportProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    /**
     * @return {@link JobPhase#COMPLETED}, or {@link JobPhase#CANCELED} when the job was
     * canceled between two units; the checkpoint is kept in that case
     */
    public JobPhase run(ImportJobContext ctx) {
        Long jobId = ctx.getJobId();
        ImportJobParams params = ctx.getParams();
        ImportStatus status = ctx.getStatus();
        ProgressReporter reporter = ctx.getReporter();

        LibraryExport export = libraryExportParser.parse(Paths.get(params.getExportPath()));
        List<AlbumGroup> groups = albumGrouper.group(export.getTracks());
        status.setTotal(groups.size());

        ImportCheckpoint checkpoint = checkpointStore.loadCheckpoint(jobId);
        JobPhase resumePhase = checkpoint == null || checkpoint.getPhase().isTerminal()
                ? JobPhase.IMPORTING : checkpoint.getPhase();
        int resumeIndex = checkpoint == null ? 0 : Math.max(0, checkpoint.getIndex());
        log.info("IMPORT_PIPELINE_START jobId={} export={} tracks={} groups={} mode={} resumePhase={} resumeIndex={}",
                jobId, params.getExportPath(), export.getTracks().size(), groups.size(), params.getImportMode(),
                resumePhase, resumeIndex);
        reporter.log(Level.INFO, "Found " + groups.size() + " audiobooks in " + export.getTracks().size()
                + " tracks", params.getExportPath());

        if (resumePhase == JobPhase.IMPORTING) {
            if (!importGroups(ctx, export, groups, Math.min(resumeIndex, groups.size()))) {
                return JobPhase.CANCELED;
            }
        } else {
            status.setProcessed(groups.size());
            reporter.log(Level.INFO, "Import phase already committed, resuming at " + resumePhase, null);
        }

        if (params.isEnrichMetadata() && resumePhase.ordinal() <= JobPhase.ENRICHING.ordinal()) {
            ctx.transitionTo(JobPhase.ENRICHING);
            int start = resumePhase == JobPhase.ENRICHING ? resumeIndex : 0;
            if (!enrichBooks(ctx, start)) {
                return JobPhase.CANCELED;
            }
        }

        if (params.isReorganizeRequested()) {
            ctx.transitionTo(JobPhase.ORGANIZING);
            int start = resumePhase == JobPhase.ORGANIZING ? resumeIndex : 0;
            if (!organizeBooks(ctx, start)) {
                return JobPhase.CANCELED;
            }
        }

        ctx.transitionTo(JobPhase.COMPLETED);
        checkpointStore.clearState(jobId);
        saveFingerprint(ctx, params.getExportPath());

        String summary = status.importSummary();
        ctx.setSummary(summary);
        reporter.updateProgress(groups.size(), groups.size(), summary);
        reporter.log(Level.INFO, summary, null);
        log.info("IMPORT_PIPELINE_DONE jobId={} summary={}", jobId, summary);
        return JobPhase.COMPLETED;
    }

    // --- Import phase ---

    private boolean importGroups(ImportJobContext ctx, LibraryExport export, List<AlbumGroup> groups, int startIndex) {
        Long jobId = ctx.getJobId();
        ProgressReporter reporter = ctx.getReporter();
        int total = groups.size();
        Map<Integer, Set<String>> playlistIndex = ctx.getParams().isImportPlaylists()
                ? playlistTagResolver.indexByTrackId(export.getPlaylists())
                : Collections.emptyMap();

        if (startIndex > 0) {
            ctx.getStatus().setProcessed(startIndex);
            reporter.log(Level.INFO, "Resuming import at group " + startIndex + " of " + total, null);
        }
        for (int i = startIndex; i < total; i++) {
            if (reporter.isCanceled()) {
                checkpointStore.saveCheckpoint(jobId, JobPhase.IMPORTING, i, total);
                log.info("IMPORT_PIPELINE_CANCELED jobId={} phase={} index={} total={}", jobId, JobPhase.IMPORTING, i, total);
                return false;
            }
            String result = importGroup(ctx, groups.get(i), playlistIndex);
            incrementCounter("audiobook.import.group", "result", result);

            int processed = i + 1;
            ctx.getStatus().setProcessed(processed);
            if (processed % checkpointInterval() == 0 && processed < total) {
                checkpointStore.saveCheckpoint(jobId, JobPhase.IMPORTING, processed, total);
            }
            reportProgress(reporter, processed, total, "Importing audiobooks");
        }
        checkpointStore.saveCheckpoint(jobId, JobPhase.IMPORTING, total, total);
        return true;
    }

    private String importGroup(ImportJobContext ctx, AlbumGroup group, Map<Integer, Set<String>> playlistIndex) {
        ImportJobParams params = ctx.getParams();
        ImportStatus status = ctx.getStatus();
        String label = group.getKey();
        try {
            BookCandidate candidate = bookAssembler.assemble(group, params, ctx.getJobId());
            BookEntity book = candidate.getBook();
            label = book.getTitle();

            String hash = contentHasher.computeFileHash(candidate.getFirstFile());
            if (catalogStore.isHashBlocked(hash)) {
                status.incrementSkipped();
                ctx.getReporter().log(Level.INFO, "Skipped blocked content '" + label + "'", hash);
                return "skipped";
            }
            if (params.isSkipDuplicates()
                    && (catalogStore.getBookByFilePath(book.getFilePath()) != null
                    || catalogStore.getBookByFileHash(hash) != null)) {
                status.incrementSkipped();
                log.debug("IMPORT_GROUP_DUPLICATE jobId={} title={} path={}", ctx.getJobId(), label, book.getFilePath());
                return "skipped";
            }
            if (book.getPersistentId() != null && catalogStore.getBookByPersistentId(book.getPersistentId()) != null) {
                status.incrementSkipped();
                log.debug("IMPORT_GROUP_KNOWN_PERSISTENT_ID jobId={} persistentId={}", ctx.getJobId(), book.getPersistentId());
                return "skipped";
            }

            book.setFileHash(hash);
            book.setOriginalFileHash(hash);
            if (params.getImportMode() == ImportMode.ORGANIZED) {
                book.setOrganizedFileHash(hash);
            }
            bookCatalogWriter.create(candidate, playlistTagResolver.tagsFor(group, playlistIndex));
            status.incrementImported();
            return "imported";
        } catch (LocationDecodeException e) {
            recordGroupFailure(ctx, "Failed to decode location for '" + label + "': " + e.getMessage());
        } catch (NoSuchFileException e) {
            recordGroupFailure(ctx, "File not found for '" + label + "': " + e.getFile());
        } catch (IOException e) {
            recordGroupFailure(ctx, "Failed to read '" + label + "': " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("IMPORT_GROUP_ERROR jobId={} group={}", ctx.getJobId(), group.getKey(), e);
            recordGroupFailure(ctx, "Failed to import '" + label + "': " + e.getMessage());
        }
        return "failed";
    }

    private void recordGroupFailure(ImportJobContext ctx, String message) {
        String limited = limitLength(message, 1000);
        ctx.getStatus().recordFailure(limited);
        ctx.getReporter().log(Level.WARN, limited, null);
        log.warn("IMPORT_GROUP_FAILED jobId={} reason={}", ctx.getJobId(), limited);
    }

    // --- Enrichment phase ---

    private boolean enrichBooks(ImportJobContext ctx, int startIndex) {
        Long jobId = ctx.getJobId();
        ProgressReporter reporter = ctx.getReporter();
        List<BookEntity> books = catalogStore.listBooksByImportJob(jobId);
        int total = books.size();
        int consecutiveFailures = 0;
        int enriched = 0;
        reporter.log(Level.INFO, "Enriching metadata for " + total + " books", null);

        for (int i = Math.min(startIndex, total); i < total; i++) {
            if (reporter.isCanceled()) {
                checkpointStore.saveCheckpoint(jobId, JobPhase.ENRICHING, i, total);
                log.info("IMPORT_PIPELINE_CANCELED jobId={} phase={} index={} total={}", jobId, JobPhase.ENRICHING, i, total);
                return false;
            }
            BookEntity book = books.get(i);
            if (LibraryState.IMPORTED.dbValue().equals(book.getLibraryState())) {
                try {
                    metadataEnricher.fetchMetadataForRecord(book.getId());
                    consecutiveFailures = 0;
                    enriched++;
                    int pauseEvery = appImportProperties.getEnrichPauseEvery();
                    if (pauseEvery > 0 && enriched % pauseEvery == 0) {
                        pause(appImportProperties.getEnrichPauseMs());
                    }
                } catch (MetadataLookupException e) {
                    consecutiveFailures++;
                    String message = limitLength("Metadata lookup failed for '" + book.getTitle() + "': "
                            + e.getMessage(), 1000);
                    ctx.getStatus().recordError(message);
                    reporter.log(Level.WARN, message, null);
                    if (consecutiveFailures >= Math.max(1, appImportProperties.getEnrichFailureThreshold())) {
                        log.info("ENRICH_BACKOFF jobId={} consecutiveFailures={} sleepMs={}",
                                jobId, consecutiveFailures, appImportProperties.getEnrichFailureBackoffMs());
                        pause(appImportProperties.getEnrichFailureBackoffMs());
                        consecutiveFailures = 0;
                    }
                }
            }
            int processed = i + 1;
            if (processed % checkpointInterval() == 0 && processed < total) {
                checkpointStore.saveCheckpoint(jobId, JobPhase.ENRICHING, processed, total);
            }
            reportProgress(reporter, processed, total, "Enriching metadata");
        }
        checkpointStore.saveCheckpoint(jobId, JobPhase.ENRICHING, total, total);
        return true;
    }

    // --- Reorganize phase ---

    private boolean organizeBooks(ImportJobContext ctx, int startIndex) {
        Long jobId = ctx.getJobId();
        ProgressReporter reporter = ctx.getReporter();
        List<BookEntity> books = catalogStore.listBooksByImportJob(jobId);
        int total = books.size();
        reporter.log(Level.INFO, "Organizing " + total + " books", null);

        for (int i = Math.min(startIndex, total); i < total; i++) {
            if (reporter.isCanceled()) {
                checkpointStore.saveCheckpoint(jobId, JobPhase.ORGANIZING, i, total);
                log.info("IMPORT_PIPELINE_CANCELED jobId={} phase={} index={} total={}", jobId, JobPhase.ORGANIZING, i, total);
                return false;
            }
            BookEntity book = books.get(i);
            if (LibraryState.IMPORTED.dbValue().equals(book.getLibraryState())) {
                organizeBook(ctx, book);
            }
            int processed = i + 1;
            if (processed % checkpointInterval() == 0 && processed < total) {
                checkpointStore.saveCheckpoint(jobId, JobPhase.ORGANIZING, processed, total);
            }
            reportProgress(reporter, processed, total, "Organizing audiobooks");
        }
        checkpointStore.saveCheckpoint(jobId, JobPhase.ORGANIZING, total, total);
        return true;
    }

    private void organizeBook(ImportJobContext ctx, BookEntity book) {
        try {
            String newPath = organizer.organizeBook(book);
            if (newPath != null && !newPath.isEmpty() && !newPath.equals(book.getFilePath())) {
                book.setFilePath(newPath);
                Path organized = Paths.get(newPath);
                if (Files.isRegularFile(organized)) {
                    book.setOrganizedFileHash(contentHasher.computeFileHash(organized));
                }
                ctx.getReporter().log(Level.INFO, "Organized '" + book.getTitle() + "' to " + newPath, null);
            }
            book.setLibraryState(LibraryState.ORGANIZED.dbValue());
            catalogStore.updateBook(book);
        } catch (IOException | RuntimeException e) {
            String message = limitLength("Failed to organize '" + book.getTitle() + "': " + e.getMessage(), 1000);
            ctx.getStatus().recordFailure(message);
            ctx.getReporter().log(Level.WARN, message, book.getFilePath());
            log.warn("ORGANIZE_BOOK_FAILED jobId={} bookId={} reason={}", ctx.getJobId(), book.getId(), e.getMessage());
        }
    }

    // --- Helpers ---

    private void saveFingerprint(ImportJobContext ctx, String exportPath) {
        try {
            catalogStore.saveLibraryFingerprint(libraryFingerprintService.compute(Paths.get(exportPath)));
        } catch (IOException e) {
            String message = "Failed to fingerprint library export: " + e.getMessage();
            ctx.getStatus().recordError(message);
            log.warn("LIBRARY_FINGERPRINT_FAILED jobId={} path={} reason={}", ctx.getJobId(), exportPath, e.getMessage());
        }
    }

    private void reportProgress(ProgressReporter reporter, int processed, int total, String message) {
        int batch = Math.max(1, appImportProperties.getProgressBatchSize());
        if (processed % batch == 0 || processed == total) {
            reporter.updateProgress(processed, total, message + " (" + processed + "/" + total + ")");
        }
    }

    private int checkpointInterval() {
        return Math.max(1, appImportProperties.getCheckpointInterval());
    }

    void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Import job interrupted while pausing between metadata lookups");
        }
    }

    private String limitLength(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
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
