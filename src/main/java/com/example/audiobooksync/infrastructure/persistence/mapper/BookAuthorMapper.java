package com.example.audiobooksync.infrastructure.persistence.mapper;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface BookAuthorMapper {

    @Delete("DELETE FROM book_author WHERE book_id = #{bookId}")
    int deleteByBookId(@Param("bookId") Long bookId);

    @Insert("INSERT INTO book_author(book_id, author_id, position) VALUES(#{bookId}, #{authorId}, #{position})")
    int insert(@Param("bookId") Long bookId, @Param("authorId") Long authorId, @Param("position") int position);
}
