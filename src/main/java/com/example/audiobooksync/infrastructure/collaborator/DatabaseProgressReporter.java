package com.example.audiobooksync.infrastructure.collaborator;

import com.example.audiobooksync.domain.enumtype.JobStatus;
import com.example.audiobooksync.infrastructure.persistence.entity.ImportJobLogEntity;
import com.example.audiobooksync.infrastructure.persistence.mapper.ImportJobLogMapper;
import com.example.audiobooksync.infrastructure.persistence.mapper.ImportJobMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

public class DatabaseProgressReporter implements ProgressReporter {

    private static final Logger log = LoggerFactory.getLogger(DatabaseProgressReporter.class);

    private static final int MAX_MESSAGE_LENGTH = 500;
    private static final int MAX_DETAIL_LENGTH = 2000;

    private final Long jobId;
    private final ImportJobMapper importJobMapper;
    private final ImportJobLogMapper importJobLogMapper;

    public DatabaseProgressReporter(Long jobId, ImportJobMapper importJobMapper, ImportJobLogMapper importJobLogMapper) {
        this.jobId = jobId;
        this.importJobMapper = importJobMapper;
        this.importJobLogMapper = importJobLogMapper;
    }

    @Override
    public void log(Level level, String message, String detail) {
        switch (level) {
            case ERROR:
                log.error("JOB_LOG jobId={} message={} detail={}", jobId, message, detail);
                break;
            case WARN:
                log.warn("JOB_LOG jobId={} message={} detail={}", jobId, message, detail);
                break;
            case DEBUG:
            case TRACE:
                log.debug("JOB_LOG jobId={} message={} detail={}", jobId, message, detail);
                break;
            default:
                log.info("JOB_LOG jobId={} message={} detail={}", jobId, message, detail);
        }
        ImportJobLogEntity entity = new ImportJobLogEntity();
        entity.setJobId(jobId);
        entity.setLevel(level.name());
        entity.setMessage(limitLength(message, MAX_MESSAGE_LENGTH));
        entity.setDetail(limitLength(detail, MAX_DETAIL_LENGTH));
        try {
            importJobLogMapper.insert(entity);
        } catch (RuntimeException e) {
            log.warn("JOB_LOG_PERSIST_FAILED jobId={} reason={}", jobId, e.getMessage());
        }
    }

    @Override
    public void updateProgress(int current, int total, String message) {
        importJobMapper.updateProgress(jobId, current, total, limitLength(message, MAX_MESSAGE_LENGTH));
    }

    @Override
    public boolean isCanceled() {
        return JobStatus.CANCELED.name().equals(importJobMapper.selectStatusById(jobId));
    }

    private String limitLength(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
