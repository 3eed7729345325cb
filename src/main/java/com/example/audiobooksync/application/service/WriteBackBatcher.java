package com.example.audiobooksync.application.service;

import com.example.audiobooksync.common.config.AppLibraryProperties;
import com.example.audiobooksync.common.exception.BusinessException;
import com.example.audiobooksync.domain.model.WriteBackResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Collects book ids whose files moved and writes them back to the configured export in one
 * go once no new id arrived for the debounce window. Batched write-backs skip the backup.
 */
@Component
public class WriteBackBatcher {

    private static final Logger log = LoggerFactory.getLogger(WriteBackBatcher.class);

    private final WriteBackService writeBackService;
    private final ScheduledExecutorService writeBackScheduler;
    private final AppLibraryProperties appLibraryProperties;

    private final Object monitor = new Object();
    private final Set<Long> pending = new LinkedHashSet<>();
    private ScheduledFuture<?> scheduledFlush;

    public WriteBackBatcher(WriteBackService writeBackService,
                            ScheduledExecutorService writeBackScheduler,
                            AppLibraryProperties appLibraryProperties) {
        this.writeBackService = writeBackService;
        this.writeBackScheduler = writeBackScheduler;
        this.appLibraryProperties = appLibraryProperties;
    }

    /**
     * Queues the books and restarts the debounce timer.
     */
    public void enqueue(Collection<Long> bookIds) {
        if (bookIds == null || bookIds.isEmpty()) {
            return;
        }
        synchronized (monitor) {
            pending.addAll(bookIds);
            if (scheduledFlush != null) {
                scheduledFlush.cancel(false);
            }
            long delay = Math.max(0L, appLibraryProperties.getWriteBackDebounceMs());
            scheduledFlush = writeBackScheduler.schedule(this::flush, delay, TimeUnit.MILLISECONDS);
            log.debug("WRITE_BACK_QUEUED added={} pending={} delayMs={}", bookIds.size(), pending.size(), delay);
        }
    }

    public int pendingCount() {
        synchronized (monitor) {
            return pending.size();
        }
    }

    /**
     * Writes back everything queued so far. A failed batch is logged and dropped; the books
     * keep their new paths in the catalog and can be written back again on request.
     */
    public void flush() {
        List<Long> batch;
        synchronized (monitor) {
            if (pending.isEmpty()) {
                return;
            }
            batch = new ArrayList<>(pending);
            pending.clear();
            scheduledFlush = null;
        }
        try {
            WriteBackResult result = writeBackService.writeBackBooks(batch, false, false);
            log.info("WRITE_BACK_BATCH_DONE books={} updated={}", batch.size(), result.getUpdatedCount());
        } catch (BusinessException e) {
            log.warn("WRITE_BACK_BATCH_FAILED books={} code={} reason={}", batch.size(), e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("WRITE_BACK_BATCH_ERROR books={} bookIds={}", batch.size(), batch, e);
        }
    }
}
