package com.example.audiobooksync.infrastructure.persistence.mapper;

import com.example.audiobooksync.infrastructure.persistence.entity.BookEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface BookMapper {

    String COLUMNS = "id, title, file_path, file_path_md5, format, duration_sec, file_size, narrator, edition, "
            + "release_year, series_id, series_position, persistent_id, play_count, rating, bookmark_ms, "
            + "last_played_at, date_added_at, file_hash, original_file_hash, organized_file_hash, library_state, "
            + "import_source, import_job_id, original_filename, created_at, updated_at";

    @Insert("INSERT INTO book("
            + "title, file_path, file_path_md5, format, duration_sec, file_size, narrator, edition, "
            + "release_year, series_id, series_position, persistent_id, play_count, rating, bookmark_ms, "
            + "last_played_at, date_added_at, file_hash, original_file_hash, organized_file_hash, library_state, "
            + "import_source, import_job_id, original_filename"
            + ") VALUES ("
            + "#{title}, #{filePath}, #{filePathMd5}, #{format}, #{durationSec}, #{fileSize}, #{narrator}, #{edition}, "
            + "#{releaseYear}, #{seriesId}, #{seriesPosition}, #{persistentId}, #{playCount}, #{rating}, #{bookmarkMs}, "
            + "#{lastPlayedAt}, #{dateAddedAt}, #{fileHash}, #{originalFileHash}, #{organizedFileHash}, #{libraryState}, "
            + "#{importSource}, #{importJobId}, #{originalFilename})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(BookEntity entity);

    @Update("UPDATE book SET title = #{title}, file_path = #{filePath}, file_path_md5 = #{filePathMd5}, "
            + "format = #{format}, duration_sec = #{durationSec}, file_size = #{fileSize}, narrator = #{narrator}, "
            + "edition = #{edition}, release_year = #{releaseYear}, series_id = #{seriesId}, "
            + "series_position = #{seriesPosition}, play_count = #{playCount}, rating = #{rating}, "
            + "bookmark_ms = #{bookmarkMs}, last_played_at = #{lastPlayedAt}, file_hash = #{fileHash}, "
            + "organized_file_hash = #{organizedFileHash}, library_state = #{libraryState}, updated_at = NOW() "
            + "WHERE id = #{id}")
    int update(BookEntity entity);

    @Select("SELECT " + COLUMNS + " FROM book WHERE id = #{id}")
    BookEntity selectById(@Param("id") Long id);

    @Select("SELECT " + COLUMNS + " FROM book WHERE file_path_md5 = #{filePathMd5} ORDER BY id ASC LIMIT 1")
    BookEntity selectByFilePathMd5(@Param("filePathMd5") String filePathMd5);

    @Select("SELECT " + COLUMNS + " FROM book WHERE file_hash = #{fileHash} "
            + "OR original_file_hash = #{fileHash} OR organized_file_hash = #{fileHash} ORDER BY id ASC LIMIT 1")
    BookEntity selectByFileHash(@Param("fileHash") String fileHash);

    @Select("SELECT " + COLUMNS + " FROM book WHERE persistent_id = #{persistentId}")
    BookEntity selectByPersistentId(@Param("persistentId") String persistentId);

    @Select("SELECT " + COLUMNS + " FROM book WHERE import_job_id = #{importJobId} ORDER BY id ASC")
    List<BookEntity> selectByImportJobId(@Param("importJobId") Long importJobId);
}
