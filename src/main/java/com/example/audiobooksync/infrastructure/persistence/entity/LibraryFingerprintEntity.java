package com.example.audiobooksync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class LibraryFingerprintEntity {

    private String path;

    private String pathMd5;

    private Long fileSize;

    private Long modTime;

    private Long checksum;

    private LocalDateTime updatedAt;
}
