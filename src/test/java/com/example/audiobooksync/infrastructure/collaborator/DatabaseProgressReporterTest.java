package com.example.audiobooksync.infrastructure.collaborator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.audiobooksync.infrastructure.persistence.entity.ImportJobLogEntity;
import com.example.audiobooksync.infrastructure.persistence.mapper.ImportJobLogMapper;
import com.example.audiobooksync.infrastructure.persistence.mapper.ImportJobMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.event.Level;

class DatabaseProgressReporterTest {

    private ImportJobMapper importJobMapper;
    private ImportJobLogMapper importJobLogMapper;
    private DatabaseProgressReporter reporter;

    @BeforeEach
    void setUp() {
        importJobMapper = mock(ImportJobMapper.class);
        importJobLogMapper = mock(ImportJobLogMapper.class);
        reporter = new DatabaseProgressReporter(7L, importJobMapper, importJobLogMapper);
    }

    @Test
    void logShouldPersistTruncatedEntry() {
        StringBuilder longMessage = new StringBuilder();
        for (int i = 0; i < 60; i++) {
            longMessage.append("0123456789");
        }

        reporter.log(Level.WARN, longMessage.toString(), null);

        ArgumentCaptor<ImportJobLogEntity> captor = ArgumentCaptor.forClass(ImportJobLogEntity.class);
        verify(importJobLogMapper).insert(captor.capture());
        assertEquals(7L, captor.getValue().getJobId());
        assertEquals("WARN", captor.getValue().getLevel());
        assertEquals(500, captor.getValue().getMessage().length());
        assertNull(captor.getValue().getDetail());
    }

    @Test
    void logPersistFailureShouldNotPropagate() {
        when(importJobLogMapper.insert(any())).thenThrow(new IllegalStateException("db down"));

        reporter.log(Level.INFO, "Importing", "detail");

        verify(importJobLogMapper).insert(any());
    }

    @Test
    void cancellationShouldBeReadFromJobRow() {
        when(importJobMapper.selectStatusById(7L)).thenReturn("RUNNING", "CANCELED");

        assertFalse(reporter.isCanceled());
        assertTrue(reporter.isCanceled());
    }

    @Test
    void progressShouldUpdateJobRow() {
        reporter.updateProgress(3, 9, "Importing (3/9)");

        verify(importJobMapper).updateProgress(7L, 3, 9, "Importing (3/9)");
    }
}
