package com.example.audiobooksync.infrastructure.persistence.mapper;

import com.example.audiobooksync.infrastructure.persistence.entity.AuthorEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface AuthorMapper {

    @Insert("INSERT INTO author(name) VALUES(#{name})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(AuthorEntity entity);

    /** {@code author.name} uses a binary collation, so the match is case-sensitive. */
    @Select("SELECT id, name, created_at FROM author WHERE name = #{name}")
    AuthorEntity selectByName(@Param("name") String name);

    @Select("SELECT a.id, a.name, a.created_at FROM author a "
            + "JOIN book_author ba ON ba.author_id = a.id "
            + "WHERE ba.book_id = #{bookId} ORDER BY ba.position ASC")
    List<AuthorEntity> selectByBookId(@Param("bookId") Long bookId);
}
