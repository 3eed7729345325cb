package com.example.audiobooksync.infrastructure.persistence.mapper;

import com.example.audiobooksync.infrastructure.persistence.entity.SeriesEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface SeriesMapper {

    @Insert("INSERT INTO series(name) VALUES(#{name})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(SeriesEntity entity);

    @Select("SELECT id, name, created_at FROM series WHERE name = #{name}")
    SeriesEntity selectByName(@Param("name") String name);
}
