package com.example.audiobooksync.infrastructure.persistence.mapper;

import com.example.audiobooksync.infrastructure.persistence.entity.BookSegmentEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface BookSegmentMapper {

    @Insert("INSERT INTO book_segment(book_id, file_path, format, file_size, duration_sec, track_number, total_tracks) "
            + "VALUES(#{bookId}, #{filePath}, #{format}, #{fileSize}, #{durationSec}, #{trackNumber}, #{totalTracks})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(BookSegmentEntity entity);

    @Select("SELECT id, book_id, file_path, format, file_size, duration_sec, track_number, total_tracks, created_at "
            + "FROM book_segment WHERE book_id = #{bookId} ORDER BY track_number ASC, id ASC")
    List<BookSegmentEntity> selectByBookId(@Param("bookId") Long bookId);
}
