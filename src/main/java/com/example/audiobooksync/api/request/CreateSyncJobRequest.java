package com.example.audiobooksync.api.request;

import com.example.audiobooksync.domain.model.PathMapping;
import java.util.List;
import lombok.Data;

@Data
public class CreateSyncJobRequest {

    /** Defaults to {@code app.library.export-path}. */
    private String exportPath;

    /** Defaults to {@code app.library.path-mappings}. */
    private List<PathMapping> pathMappings;

    private boolean importPlaylists;

    private boolean force;
}
