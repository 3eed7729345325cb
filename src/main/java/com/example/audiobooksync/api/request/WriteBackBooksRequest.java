package com.example.audiobooksync.api.request;

import java.util.ArrayList;
import java.util.List;
import javax.validation.constraints.NotEmpty;
import lombok.Data;

@Data
public class WriteBackBooksRequest {

    @NotEmpty
    private List<Long> bookIds = new ArrayList<>();

    private boolean createBackup = true;

    private boolean forceOverwrite;

    /** Queue for the debounced batch instead of writing now. */
    private boolean deferred;
}
