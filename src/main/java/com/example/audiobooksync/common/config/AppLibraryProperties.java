package com.example.audiobooksync.common.config;

import com.example.audiobooksync.domain.model.PathMapping;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.library")
public class AppLibraryProperties {

    /**
     * Export file polled for changes and targeted by auto write-back.
     */
    private String exportPath;

    private List<PathMapping> pathMappings = new ArrayList<>();

    private boolean pollEnabled = false;

    private String pollCron = "0 */15 * * * ?";

    private boolean autoWriteBack = false;

    private long writeBackDebounceMs = 5_000L;

    private String backupTimestampPattern = "yyyyMMdd-HHmmss";
}
