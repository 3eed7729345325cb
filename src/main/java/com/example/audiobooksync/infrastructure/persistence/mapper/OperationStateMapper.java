package com.example.audiobooksync.infrastructure.persistence.mapper;

import com.example.audiobooksync.infrastructure.persistence.entity.OperationStateEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface OperationStateMapper {

    @Insert("INSERT INTO operation_state(job_id, params_json) VALUES(#{jobId}, #{paramsJson}) "
            + "ON DUPLICATE KEY UPDATE params_json = VALUES(params_json), updated_at = NOW()")
    int upsertParams(@Param("jobId") Long jobId, @Param("paramsJson") String paramsJson);

    @Insert("INSERT INTO operation_state(job_id, phase, phase_index, phase_total) "
            + "VALUES(#{jobId}, #{phase}, #{phaseIndex}, #{phaseTotal}) "
            + "ON DUPLICATE KEY UPDATE phase = VALUES(phase), phase_index = VALUES(phase_index), "
            + "phase_total = VALUES(phase_total), updated_at = NOW()")
    int upsertCheckpoint(@Param("jobId") Long jobId,
                         @Param("phase") String phase,
                         @Param("phaseIndex") int phaseIndex,
                         @Param("phaseTotal") int phaseTotal);

    @Select("SELECT job_id, params_json, phase, phase_index, phase_total, updated_at "
            + "FROM operation_state WHERE job_id = #{jobId}")
    OperationStateEntity selectByJobId(@Param("jobId") Long jobId);

    @Delete("DELETE FROM operation_state WHERE job_id = #{jobId}")
    int deleteByJobId(@Param("jobId") Long jobId);
}
