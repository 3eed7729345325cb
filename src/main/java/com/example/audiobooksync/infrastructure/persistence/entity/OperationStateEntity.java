package com.example.audiobooksync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class OperationStateEntity {

    private Long jobId;

    private String paramsJson;

    private String phase;

    private Integer phaseIndex;

    private Integer phaseTotal;

    private LocalDateTime updatedAt;
}
