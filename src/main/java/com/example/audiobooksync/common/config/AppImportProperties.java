package com.example.audiobooksync.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.import")
public class AppImportProperties {

    /**
     * Progress is reported every N units, and always for the last unit of a phase.
     */
    private int progressBatchSize = 10;

    /**
     * A resume checkpoint is persisted every N units of a phase.
     */
    private int checkpointInterval = 10;

    /**
     * Max error messages kept per job. Further failures are only counted.
     */
    private int errorLimit = 50;

    private int enrichFailureThreshold = 3;

    private long enrichFailureBackoffMs = 30_000L;

    /**
     * Pause after every N successful metadata lookups. 0 disables the pause.
     */
    private int enrichPauseEvery = 25;

    private long enrichPauseMs = 2_000L;

    private int workerThreads = 2;

    private int queueCapacity = 20;

    /**
     * Root directory books are moved under by the default organizer.
     */
    private String organizeRoot;

    private List<String> audioExtensions = new ArrayList<>(Arrays.asList("m4b", "m4a", "mp3", "aac", "flac", "ogg"));

    public Set<String> normalizedAudioExtensions() {
        return audioExtensions.stream()
                .filter(item -> item != null && !item.trim().isEmpty())
                .map(item -> item.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
