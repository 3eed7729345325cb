package com.example.audiobooksync.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateImportJobResponse {

    private Long jobId;
    private String status;
}
