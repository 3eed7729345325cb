package com.example.audiobooksync.infrastructure.persistence.mapper;

import com.example.audiobooksync.infrastructure.persistence.entity.LibraryFingerprintEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface LibraryFingerprintMapper {

    @Insert("INSERT INTO library_fingerprint(path, path_md5, file_size, mod_time, checksum) "
            + "VALUES(#{path}, #{pathMd5}, #{fileSize}, #{modTime}, #{checksum}) "
            + "ON DUPLICATE KEY UPDATE path = VALUES(path), file_size = VALUES(file_size), "
            + "mod_time = VALUES(mod_time), checksum = VALUES(checksum), updated_at = NOW()")
    int upsert(LibraryFingerprintEntity entity);

    @Select("SELECT path, path_md5, file_size, mod_time, checksum, updated_at "
            + "FROM library_fingerprint WHERE path_md5 = #{pathMd5}")
    LibraryFingerprintEntity selectByPathMd5(@Param("pathMd5") String pathMd5);
}
