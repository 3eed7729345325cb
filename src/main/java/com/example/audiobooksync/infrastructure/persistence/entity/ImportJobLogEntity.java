package com.example.audiobooksync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ImportJobLogEntity {

    private Long id;

    private Long jobId;

    private String level;

    private String message;

    private String detail;

    private LocalDateTime createdAt;
}
