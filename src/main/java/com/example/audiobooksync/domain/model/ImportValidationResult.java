package com.example.audiobooksync.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class ImportValidationResult {

    private int totalTracks;

    private int audiobookTracks;

    private int albumGroups;

    private int filesFound;

    private int filesMissing;

    private List<String> missingPaths = new ArrayList<>();

    /** Distinct {@code file://} prefixes, offered as path-mapping sources. */
    private List<String> pathPrefixes = new ArrayList<>();

    private String estimatedTime;
}
