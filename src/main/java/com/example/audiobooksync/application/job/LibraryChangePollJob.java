package com.example.audiobooksync.application.job;

import com.example.audiobooksync.api.request.CreateSyncJobRequest;
import com.example.audiobooksync.application.service.ImportJobService;
import com.example.audiobooksync.common.config.AppLibraryProperties;
import com.example.audiobooksync.common.exception.BusinessException;
import com.example.audiobooksync.domain.model.LibraryFingerprint;
import com.example.audiobooksync.infrastructure.catalog.CatalogStore;
import com.example.audiobooksync.infrastructure.export.LibraryFingerprintService;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Watches the configured export with the cheap size + mtime fingerprint and starts a sync
 * job when it changed since the last import, sync or write-back.
 */
@Service
public class LibraryChangePollJob {

    private static final Logger log = LoggerFactory.getLogger(LibraryChangePollJob.class);

    private final AppLibraryProperties appLibraryProperties;
    private final CatalogStore catalogStore;
    private final LibraryFingerprintService libraryFingerprintService;
    private final ImportJobService importJobService;

    public LibraryChangePollJob(AppLibraryProperties appLibraryProperties,
                                CatalogStore catalogStore,
                                LibraryFingerprintService libraryFingerprintService,
                                ImportJobService importJobService) {
        this.appLibraryProperties = appLibraryProperties;
        this.catalogStore = catalogStore;
        this.libraryFingerprintService = libraryFingerprintService;
        this.importJobService = importJobService;
    }

    @Scheduled(cron = "${app.library.poll-cron:0 */15 * * * ?}")
    public void run() {
        if (!appLibraryProperties.isPollEnabled() || !StringUtils.hasText(appLibraryProperties.getExportPath())) {
            log.debug("Library poll skipped: polling disabled or no export configured");
            return;
        }
        Path exportPath = Paths.get(appLibraryProperties.getExportPath());
        LibraryFingerprint stored = catalogStore.getLibraryFingerprint(LibraryFingerprintService.keyOf(exportPath));
        if (stored == null) {
            log.debug("Library poll skipped: export {} was never imported", exportPath);
            return;
        }
        LibraryFingerprint current;
        try {
            current = libraryFingerprintService.computeCheap(exportPath);
        } catch (IOException e) {
            log.warn("LIBRARY_POLL_FAILED path={} reason={}", exportPath, e.getMessage());
            return;
        }
        if (stored.matches(current, false)) {
            log.debug("LIBRARY_POLL_UNCHANGED path={}", exportPath);
            return;
        }
        if (importJobService.hasActiveSync(exportPath.toString())) {
            log.info("LIBRARY_POLL_SYNC_ACTIVE path={}", exportPath);
            return;
        }
        log.info("LIBRARY_POLL_CHANGED path={} stored=[{}] current=[{}]", exportPath, stored.describe(), current.describe());
        CreateSyncJobRequest request = new CreateSyncJobRequest();
        request.setExportPath(exportPath.toString());
        try {
            importJobService.createSyncJob(request);
        } catch (BusinessException e) {
            log.warn("Library change sync create failed, path={}, code={}, msg={}", exportPath, e.getCode(), e.getMessage());
        }
    }
}
