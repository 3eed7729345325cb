package com.example.audiobooksync.api.request;

import com.example.audiobooksync.domain.enumtype.ImportMode;
import com.example.audiobooksync.domain.model.PathMapping;
import java.util.ArrayList;
import java.util.List;
import javax.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CreateImportJobRequest {

    @NotBlank
    private String exportPath;

    private ImportMode importMode = ImportMode.IMPORT;

    private List<PathMapping> pathMappings = new ArrayList<>();

    private boolean skipDuplicates = true;

    private boolean enrichMetadata;

    private boolean autoOrganize;

    private boolean preserveLocation;

    private boolean importPlaylists;
}
