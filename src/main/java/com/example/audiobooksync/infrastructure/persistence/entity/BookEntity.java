package com.example.audiobooksync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class BookEntity {

    private Long id;

    private String title;

    private String filePath;

    private String filePathMd5;

    private String format;

    private Integer durationSec;

    private Long fileSize;

    private String narrator;

    private String edition;

    private Integer releaseYear;

    private Long seriesId;

    private Integer seriesPosition;

    private String persistentId;

    private Integer playCount;

    private Integer rating;

    private Long bookmarkMs;

    private LocalDateTime lastPlayedAt;

    private LocalDateTime dateAddedAt;

    private String fileHash;

    private String originalFileHash;

    private String organizedFileHash;

    private String libraryState;

    private String importSource;

    private Long importJobId;

    private String originalFilename;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
