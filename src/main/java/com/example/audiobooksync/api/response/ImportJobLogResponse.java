package com.example.audiobooksync.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportJobLogResponse {

    private Long id;
    private String level;
    private String message;
    private String detail;
    private LocalDateTime createdAt;
}
