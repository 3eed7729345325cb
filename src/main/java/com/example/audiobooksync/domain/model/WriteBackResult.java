package com.example.audiobooksync.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WriteBackResult {

    private int updatedCount;

    private String backupPath;

    private String message;
}
