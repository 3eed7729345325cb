package com.example.audiobooksync.api.request;

import com.example.audiobooksync.domain.model.PathMapping;
import com.example.audiobooksync.domain.model.WriteBackUpdate;
import java.util.ArrayList;
import java.util.List;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import lombok.Data;

@Data
public class WriteBackRequest {

    @NotBlank
    private String exportPath;

    @NotEmpty
    private List<WriteBackUpdate> updates = new ArrayList<>();

    private List<PathMapping> pathMappings = new ArrayList<>();

    private boolean createBackup = true;

    private boolean forceOverwrite;
}
