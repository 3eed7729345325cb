package com.example.audiobooksync.application.service;

import com.example.audiobooksync.common.exception.BusinessException;
import com.example.audiobooksync.domain.enumtype.JobPhase;
import com.example.audiobooksync.domain.model.ImportCheckpoint;
import com.example.audiobooksync.domain.model.ImportJobParams;
import com.example.audiobooksync.infrastructure.persistence.entity.OperationStateEntity;
import com.example.audiobooksync.infrastructure.persistence.mapper.OperationStateMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Job parameters and resume position, keyed by job id and kept in {@code operation_state}
 * so they survive a restart.
 */
@Service
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private final OperationStateMapper operationStateMapper;
    private final ObjectMapper objectMapper;

    public CheckpointStore(OperationStateMapper operationStateMapper, ObjectMapper objectMapper) {
        this.operationStateMapper = operationStateMapper;
        this.objectMapper = objectMapper;
    }

    public void saveParams(Long jobId, ImportJobParams params) {
        try {
            operationStateMapper.upsertParams(jobId, objectMapper.writeValueAsString(params));
        } catch (JsonProcessingException e) {
            throw new BusinessException("500", "Failed to serialize job parameters: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @return the stored parameters, or {@code null} when the job has none
     */
    public ImportJobParams loadParams(Long jobId) {
        OperationStateEntity state = operationStateMapper.selectByJobId(jobId);
        if (state == null || state.getParamsJson() == null) {
            return null;
        }
        try {
            return objectMapper.readValue(state.getParamsJson(), ImportJobParams.class);
        } catch (JsonProcessingException e) {
            throw new BusinessException("500", "Stored job parameters are unreadable for job " + jobId, e);
        }
    }

    public void saveCheckpoint(Long jobId, JobPhase phase, int index, int total) {
        operationStateMapper.upsertCheckpoint(jobId, phase.name(), index, total);
        log.debug("CHECKPOINT_SAVED jobId={} phase={} index={} total={}", jobId, phase, index, total);
    }

    /**
     * @return the last checkpoint, or {@code null} when none was saved or the phase is unknown
     */
    public ImportCheckpoint loadCheckpoint(Long jobId) {
        OperationStateEntity state = operationStateMapper.selectByJobId(jobId);
        if (state == null) {
            return null;
        }
        JobPhase phase = JobPhase.fromName(state.getPhase());
        if (phase == null) {
            return null;
        }
        return new ImportCheckpoint(phase,
                state.getPhaseIndex() == null ? 0 : state.getPhaseIndex(),
                state.getPhaseTotal() == null ? 0 : state.getPhaseTotal());
    }

    public void clearState(Long jobId) {
        int deleted = operationStateMapper.deleteByJobId(jobId);
        log.debug("CHECKPOINT_CLEARED jobId={} rows={}", jobId, deleted);
    }
}
