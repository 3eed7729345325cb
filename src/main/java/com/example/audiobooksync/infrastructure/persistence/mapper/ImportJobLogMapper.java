package com.example.audiobooksync.infrastructure.persistence.mapper;

import com.example.audiobooksync.infrastructure.persistence.entity.ImportJobLogEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface ImportJobLogMapper {

    @Insert("INSERT INTO import_job_log(job_id, level, message, detail) "
            + "VALUES(#{jobId}, #{level}, #{message}, #{detail})")
    int insert(ImportJobLogEntity entity);

    @Select("SELECT id, job_id, level, message, detail, created_at FROM import_job_log "
            + "WHERE job_id = #{jobId} ORDER BY id ASC LIMIT #{limit}")
    List<ImportJobLogEntity> selectByJobId(@Param("jobId") Long jobId, @Param("limit") int limit);
}
