package com.example.audiobooksync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ImportJobEntity {

    private Long id;

    private String jobType;

    private String status;

    private String phase;

    private String exportPath;

    private Integer progressCurrent;

    private Integer progressTotal;

    private String message;

    private String errorSummary;

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
