package com.example.audiobooksync.infrastructure.persistence.mapper;

import com.example.audiobooksync.infrastructure.persistence.entity.ImportJobEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface ImportJobMapper {

    String COLUMNS = "id, job_type, status, phase, export_path, progress_current, progress_total, "
            + "message, error_summary, start_time, end_time, created_at, updated_at";

    @Insert("INSERT INTO import_job(job_type, status, phase, export_path, progress_current, progress_total, message) "
            + "VALUES(#{jobType}, #{status}, #{phase}, #{exportPath}, 0, 0, #{message})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(ImportJobEntity entity);

    @Select("SELECT " + COLUMNS + " FROM import_job WHERE id = #{id}")
    ImportJobEntity selectById(@Param("id") Long id);

    @Select("SELECT status FROM import_job WHERE id = #{id}")
    String selectStatusById(@Param("id") Long id);

    @Select("SELECT " + COLUMNS + " FROM import_job ORDER BY id DESC LIMIT #{limit}")
    List<ImportJobEntity> selectRecent(@Param("limit") int limit);

    @Select("SELECT COUNT(1) FROM import_job WHERE job_type = #{jobType} AND export_path = #{exportPath} "
            + "AND status IN ('PENDING','RUNNING')")
    int countActive(@Param("jobType") String jobType, @Param("exportPath") String exportPath);

    @Update("UPDATE import_job SET status = 'RUNNING', start_time = NOW(), end_time = NULL, updated_at = NOW() "
            + "WHERE id = #{id} AND status = 'PENDING'")
    int markRunning(@Param("id") Long id);

    @Update("UPDATE import_job SET phase = #{phase}, updated_at = NOW() WHERE id = #{id} AND status = 'RUNNING'")
    int updatePhase(@Param("id") Long id, @Param("phase") String phase);

    @Update("UPDATE import_job SET progress_current = #{current}, progress_total = #{total}, message = #{message}, "
            + "updated_at = NOW() WHERE id = #{id} AND status = 'RUNNING'")
    int updateProgress(@Param("id") Long id,
                       @Param("current") int current,
                       @Param("total") int total,
                       @Param("message") String message);

    @Update("UPDATE import_job SET status = #{status}, phase = #{phase}, message = #{message}, "
            + "error_summary = #{errorSummary}, end_time = NOW(), updated_at = NOW() "
            + "WHERE id = #{id} AND status = 'RUNNING'")
    int markFinished(@Param("id") Long id,
                     @Param("status") String status,
                     @Param("phase") String phase,
                     @Param("message") String message,
                     @Param("errorSummary") String errorSummary);

    @Update("UPDATE import_job SET status = 'FAILED', phase = 'FAILED', error_summary = #{errorSummary}, "
            + "end_time = NOW(), updated_at = NOW() WHERE id = #{id} AND status = 'PENDING'")
    int markFailedBeforeRunning(@Param("id") Long id, @Param("errorSummary") String errorSummary);

    @Update("UPDATE import_job SET status = 'CANCELED', end_time = NOW(), updated_at = NOW() "
            + "WHERE id = #{id} AND status IN ('PENDING','RUNNING')")
    int cancel(@Param("id") Long id);

    @Update("UPDATE import_job SET phase = #{phase}, message = #{message}, error_summary = #{errorSummary}, "
            + "end_time = NOW(), updated_at = NOW() WHERE id = #{id} AND status = 'CANCELED'")
    int updateCanceledSummary(@Param("id") Long id,
                              @Param("phase") String phase,
                              @Param("message") String message,
                              @Param("errorSummary") String errorSummary);

    /**
     * A {@code RUNNING} row started before {@code startedBefore} was left behind by a process
     * that stopped, so it is resumable as well.
     */
    @Update("UPDATE import_job SET status = 'PENDING', error_summary = NULL, end_time = NULL, updated_at = NOW() "
            + "WHERE id = #{id} AND (status IN ('CANCELED','FAILED') "
            + "OR (status = 'RUNNING' AND start_time < #{startedBefore}))")
    int resetForResume(@Param("id") Long id, @Param("startedBefore") LocalDateTime startedBefore);
}
