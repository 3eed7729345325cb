package com.example.audiobooksync.api.request;

import com.example.audiobooksync.domain.model.PathMapping;
import java.util.ArrayList;
import java.util.List;
import javax.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ValidateImportRequest {

    @NotBlank
    private String exportPath;

    private List<PathMapping> pathMappings = new ArrayList<>();
}
