package com.example.audiobooksync.domain.model;

import com.example.audiobooksync.domain.enumtype.ImportMode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class ImportJobParams {

    private String exportPath;

    private ImportMode importMode = ImportMode.IMPORT;

    private List<PathMapping> pathMappings = new ArrayList<>();

    private boolean skipDuplicates;

    private boolean enrichMetadata;

    private boolean autoOrganize;

    private boolean preserveLocation;

    private boolean importPlaylists;

    /** Sync jobs only: run even if the export fingerprint is unchanged. */
    private boolean force;

    @JsonIgnore
    public boolean isReorganizeRequested() {
        return (autoOrganize || importMode == ImportMode.ORGANIZE) && !preserveLocation;
    }
}
