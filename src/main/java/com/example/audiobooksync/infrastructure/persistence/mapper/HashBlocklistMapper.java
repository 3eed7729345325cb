package com.example.audiobooksync.infrastructure.persistence.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface HashBlocklistMapper {

    @Select("SELECT COUNT(1) FROM hash_blocklist WHERE file_hash = #{fileHash}")
    int countByHash(@Param("fileHash") String fileHash);
}
