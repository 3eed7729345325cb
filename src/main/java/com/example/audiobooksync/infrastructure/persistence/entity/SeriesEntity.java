package com.example.audiobooksync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class SeriesEntity {

    private Long id;

    private String name;

    private LocalDateTime createdAt;
}
