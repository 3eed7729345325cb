package com.example.audiobooksync.application.service;

import com.example.audiobooksync.common.config.AppLibraryProperties;
import com.example.audiobooksync.common.exception.BusinessException;
import com.example.audiobooksync.common.exception.LibraryModifiedException;
import com.example.audiobooksync.common.exception.WriteBackException;
import com.example.audiobooksync.domain.model.LibraryExport;
import com.example.audiobooksync.domain.model.LibraryFingerprint;
import com.example.audiobooksync.domain.model.PathMapping;
import com.example.audiobooksync.domain.model.Track;
import com.example.audiobooksync.domain.model.WriteBackResult;
import com.example.audiobooksync.domain.model.WriteBackUpdate;
import com.example.audiobooksync.domain.model.WriteBackValidationResult;
import com.example.audiobooksync.infrastructure.catalog.CatalogStore;
import com.example.audiobooksync.infrastructure.export.LibraryExportParser;
import com.example.audiobooksync.infrastructure.export.LibraryFingerprintService;
import com.example.audiobooksync.infrastructure.export.LocationCodec;
import com.example.audiobooksync.infrastructure.export.LocationRewriter;
import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Writes new file locations back into the media-player export. The export is either fully
 * rewritten and readable afterwards, or left with its original bytes.
 *
 * <p>Callers serialize write-backs per export path; a third-party edit between sync and
 * write-back is caught by comparing the stored fingerprint.
 */
@Service
public class WriteBackService {

    private static final Logger log = LoggerFactory.getLogger(WriteBackService.class);

    private static final String BACKUP_SUFFIX = ".backup.";
    private static final String TEMP_SUFFIX = ".writeback.tmp";

    private final CatalogStore catalogStore;
    private final LocationCodec locationCodec;
    private final LocationRewriter locationRewriter;
    private final LibraryExportParser libraryExportParser;
    private final LibraryFingerprintService libraryFingerprintService;
    private final AppLibraryProperties appLibraryProperties;
    private final MeterRegistry meterRegistry;

    public WriteBackService(CatalogStore catalogStore,
                            LocationCodec locationCodec,
                            LocationRewriter locationRewriter,
                            LibraryExportParser libraryExportParser,
                            LibraryFingerprintService libraryFingerprintService,
                            AppLibraryProperties appLibraryProperties,
                            ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.catalogStore = catalogStore;
        this.locationCodec = locationCodec;
        this.locationRewriter = locationRewriter;
        this.libraryExportParser = libraryExportParser;
        this.libraryFingerprintService = libraryFingerprintService;
        this.appLibraryProperties = appLibraryProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    /**
     * @param createBackup copy the export to {@code <export>.backup.<timestamp>} first
     * @param force        skip the fingerprint comparison
     * @throws LibraryModifiedException the export changed since it was last processed
     * @throws WriteBackException       writing or validating failed; the original bytes are back
     */
    public WriteBackResult writeBack(String exportPath,
                                     List<WriteBackUpdate> updates,
                                     List<PathMapping> mappings,
                                     boolean createBackup,
                                     boolean force) {
        if (!StringUtils.hasText(exportPath)) {
            throw new BusinessException("400", "Export path is required");
        }
        Path export = Paths.get(exportPath);
        Map<String, String> locations = resolveLocations(updates, mappings);
        if (locations.isEmpty()) {
            throw new BusinessException("400", "No update refers to a catalog book with a persistent id",
                    "Sync the library first so books carry their persistent ids");
        }

        if (!force) {
            checkFingerprint(export);
        }

        byte[] original;
        try {
            original = Files.readAllBytes(export);
        } catch (IOException e) {
            incrementCounter("failed");
            throw new WriteBackException("Failed to read library export " + export + ": " + e.getMessage(), e);
        }

        String backupPath = null;
        if (createBackup) {
            backupPath = createBackup(export);
        }

        LocationRewriter.Result rewritten = locationRewriter.rewrite(original, locations);
        writeAndValidate(export, original, rewritten.getContent());

        try {
            catalogStore.saveLibraryFingerprint(libraryFingerprintService.compute(export));
        } catch (IOException e) {
            log.warn("LIBRARY_FINGERPRINT_FAILED path={} reason={}", export, e.getMessage());
        }

        String message = "Updated " + rewritten.getUpdatedCount() + " of " + locations.size() + " locations";
        log.info("WRITE_BACK_DONE path={} requested={} resolved={} updated={} backup={}",
                export, updates.size(), locations.size(), rewritten.getUpdatedCount(), backupPath);
        incrementCounter("success");
        return new WriteBackResult(rewritten.getUpdatedCount(), backupPath, message);
    }

    /**
     * Writes back the current paths of the given catalog books into the configured export.
     */
    public WriteBackResult writeBackBooks(List<Long> bookIds, boolean createBackup, boolean force) {
        String exportPath = appLibraryProperties.getExportPath();
        if (!StringUtils.hasText(exportPath)) {
            throw new BusinessException("400", "No library export configured", "Set app.library.export-path");
        }
        List<WriteBackUpdate> updates = new ArrayList<>();
        for (Long bookId : bookIds) {
            BookEntity book = catalogStore.getBookById(bookId);
            if (book == null || !StringUtils.hasText(book.getPersistentId())) {
                log.debug("WRITE_BACK_BOOK_SKIPPED bookId={}", bookId);
                continue;
            }
            updates.add(new WriteBackUpdate(book.getPersistentId(), book.getFilePath()));
        }
        return writeBack(exportPath, updates, appLibraryProperties.getPathMappings(), createBackup, force);
    }

    /**
     * Reports updates whose persistent id is not in the export and new paths that do not
     * exist. Nothing is written.
     */
    public WriteBackValidationResult validate(String exportPath, List<WriteBackUpdate> updates) {
        if (!StringUtils.hasText(exportPath)) {
            throw new BusinessException("400", "Export path is required");
        }
        LibraryExport export = libraryExportParser.parse(Paths.get(exportPath));
        Set<String> knownIds = new HashSet<>();
        for (Track track : export.getTracks()) {
            if (!track.getPersistentId().isEmpty()) {
                knownIds.add(track.getPersistentId());
            }
        }
        WriteBackValidationResult result = new WriteBackValidationResult();
        result.setRequested(updates.size());
        for (WriteBackUpdate update : updates) {
            if (knownIds.contains(update.getPersistentId())) {
                result.setMatched(result.getMatched() + 1);
            } else {
                result.getUnknownPersistentIds().add(update.getPersistentId());
            }
            if (!StringUtils.hasText(update.getNewPath()) || !Files.exists(Paths.get(update.getNewPath()))) {
                result.getMissingNewPaths().add(update.getNewPath());
            }
        }
        log.info("WRITE_BACK_VALIDATED path={} requested={} matched={} unknown={} missing={}", exportPath,
                result.getRequested(), result.getMatched(), result.getUnknownPersistentIds().size(),
                result.getMissingNewPaths().size());
        return result;
    }

    private Map<String, String> resolveLocations(List<WriteBackUpdate> updates, List<PathMapping> mappings) {
        Map<String, String> locations = new LinkedHashMap<>();
        for (WriteBackUpdate update : updates) {
            if (!StringUtils.hasText(update.getPersistentId()) || !StringUtils.hasText(update.getNewPath())) {
                continue;
            }
            BookEntity book = catalogStore.getBookByPersistentId(update.getPersistentId());
            if (book == null || !StringUtils.hasText(book.getPersistentId())) {
                log.debug("WRITE_BACK_UPDATE_DROPPED persistentId={}", update.getPersistentId());
                continue;
            }
            locations.put(book.getPersistentId(), locationCodec.reverseRemap(update.getNewPath(), mappings));
        }
        return locations;
    }

    private void checkFingerprint(Path export) {
        LibraryFingerprint stored = catalogStore.getLibraryFingerprint(LibraryFingerprintService.keyOf(export));
        if (stored == null) {
            return;
        }
        LibraryFingerprint current;
        try {
            current = libraryFingerprintService.compute(export);
        } catch (IOException e) {
            incrementCounter("failed");
            throw new WriteBackException("Failed to fingerprint library export " + export + ": " + e.getMessage(), e);
        }
        if (!stored.matches(current, true)) {
            log.warn("WRITE_BACK_CONFLICT path={} stored=[{}] current=[{}]", export, stored.describe(), current.describe());
            incrementCounter("conflict");
            throw new LibraryModifiedException(stored, current);
        }
    }

    private String createBackup(Path export) {
        String timestamp = LocalDateTime.now()
                .format(DateTimeFormatter.ofPattern(appLibraryProperties.getBackupTimestampPattern()));
        Path backup = Paths.get(export.toString() + BACKUP_SUFFIX + timestamp);
        try {
            Files.copy(export, backup, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            incrementCounter("failed");
            throw new WriteBackException("Failed to back up library export to " + backup + ": " + e.getMessage(), e);
        }
        log.info("WRITE_BACK_BACKUP path={} backup={}", export, backup);
        return backup.toString();
    }

    private void writeAndValidate(Path export, byte[] original, byte[] content) {
        try {
            writeReplacing(export, content);
            libraryExportParser.parse(export);
        } catch (IOException | RuntimeException e) {
            restore(export, original, e);
            incrementCounter("failed");
            throw new WriteBackException("Write-back failed, library export restored: " + e.getMessage(), e);
        }
    }

    private void writeReplacing(Path target, byte[] content) throws IOException {
        Path temp = Paths.get(target.toString() + TEMP_SUFFIX);
        Files.write(temp, content);
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private void restore(Path export, byte[] original, Exception cause) {
        try {
            writeReplacing(export, original);
            log.warn("WRITE_BACK_ROLLED_BACK path={} reason={}", export, cause.getMessage());
        } catch (IOException restoreError) {
            cause.addSuppressed(restoreError);
            log.error("WRITE_BACK_RESTORE_FAILED path={}", export, restoreError);
        }
    }

    private void incrementCounter(String result) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter("audiobook.writeback", "result", result).increment();
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", "audiobook.writeback", e);
        }
    }
}
