package com.example.audiobooksync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class BookSegmentEntity {

    private Long id;

    private Long bookId;

    private String filePath;

    private String format;

    private Long fileSize;

    private Integer durationSec;

    private Integer trackNumber;

    private Integer totalTracks;

    private LocalDateTime createdAt;
}
