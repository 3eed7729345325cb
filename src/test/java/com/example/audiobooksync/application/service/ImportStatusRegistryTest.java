package com.example.audiobooksync.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.example.audiobooksync.common.config.AppImportProperties;
import org.junit.jupiter.api.Test;

class ImportStatusRegistryTest {

    @Test
    void finishedJobsShouldBeEvictedBeyondRetention() {
        ImportStatusRegistry registry = new ImportStatusRegistry(new AppImportProperties(), 2);
        for (long jobId = 1; jobId <= 3; jobId++) {
            registry.start(jobId).incrementImported();
            registry.finish(jobId);
        }

        assertNull(registry.snapshot(1L));
        assertEquals(1, registry.snapshot(2L).getImported());
        assertEquals(1, registry.snapshot(3L).getImported());
        assertEquals(0, registry.runningCount());
    }

    @Test
    void runningJobsShouldNotBeEvicted() {
        ImportStatusRegistry registry = new ImportStatusRegistry(new AppImportProperties(), 1);
        registry.start(10L);
        for (long jobId = 1; jobId <= 3; jobId++) {
            registry.start(jobId);
            registry.finish(jobId);
        }

        assertNotNull(registry.snapshot(10L));
        assertEquals(1, registry.runningCount());
    }

    @Test
    void restartShouldReplaceFinishedStatus() {
        ImportStatusRegistry registry = new ImportStatusRegistry(new AppImportProperties(), 5);
        registry.start(4L).incrementImported();
        registry.finish(4L);

        registry.start(4L);

        assertEquals(0, registry.snapshot(4L).getImported());
        assertEquals(1, registry.runningCount());
    }
}
