package com.example.audiobooksync.domain.model;

import com.example.audiobooksync.domain.enumtype.JobPhase;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportCheckpoint {

    private JobPhase phase;

    private int index;

    private int total;
}
