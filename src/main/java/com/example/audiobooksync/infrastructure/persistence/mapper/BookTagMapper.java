package com.example.audiobooksync.infrastructure.persistence.mapper;

import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface BookTagMapper {

    @Delete("DELETE FROM book_tag WHERE book_id = #{bookId}")
    int deleteByBookId(@Param("bookId") Long bookId);

    @Insert("INSERT IGNORE INTO book_tag(book_id, tag) VALUES(#{bookId}, #{tag})")
    int insert(@Param("bookId") Long bookId, @Param("tag") String tag);

    @Select("SELECT tag FROM book_tag WHERE book_id = #{bookId} ORDER BY tag ASC")
    List<String> selectByBookId(@Param("bookId") Long bookId);
}
