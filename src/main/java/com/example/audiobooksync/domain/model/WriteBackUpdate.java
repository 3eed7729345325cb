package com.example.audiobooksync.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WriteBackUpdate {

    private String persistentId;

    /** Local file-system path the export entry should point at. */
    private String newPath;
}
