package com.example.audiobooksync.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class WriteBackValidationResult {

    private int requested;

    private int matched;

    private List<String> unknownPersistentIds = new ArrayList<>();

    private List<String> missingNewPaths = new ArrayList<>();

    public boolean isValid() {
        return unknownPersistentIds.isEmpty() && missingNewPaths.isEmpty();
    }
}
