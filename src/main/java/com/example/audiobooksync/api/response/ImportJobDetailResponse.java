package com.example.audiobooksync.api.response;

import java.time.LocalDateTime;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class ImportJobDetailResponse {

    private Long jobId;
    private String jobType;
    private String status;
    private String phase;
    private String exportPath;
    private int progressCurrent;
    private int progressTotal;
    private int progressPct;
    private String message;
    private String errorSummary;
    private LocalDateTime startTime;
    private LocalDateTime endTime;

    /** Live counters; present only while this process holds the job's status. */
    private Integer total;
    private Integer processed;
    private Integer imported;
    private Integer updated;
    private Integer unchanged;
    private Integer skipped;
    private Integer failed;
    private List<String> errors;
}
