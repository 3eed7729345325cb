package com.example.audiobooksync.api.controller;

import com.example.audiobooksync.api.request.WriteBackBooksRequest;
import com.example.audiobooksync.api.request.WriteBackRequest;
import com.example.audiobooksync.api.response.ApiResponse;
import com.example.audiobooksync.application.service.WriteBackBatcher;
import com.example.audiobooksync.application.service.WriteBackService;
import com.example.audiobooksync.domain.model.WriteBackResult;
import com.example.audiobooksync.domain.model.WriteBackValidationResult;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/library/write-back")
public class WriteBackController {

    private final WriteBackService writeBackService;
    private final WriteBackBatcher writeBackBatcher;

    public WriteBackController(WriteBackService writeBackService, WriteBackBatcher writeBackBatcher) {
        this.writeBackService = writeBackService;
        this.writeBackBatcher = writeBackBatcher;
    }

    @PostMapping
    public ApiResponse<WriteBackResult> writeBack(@Valid @RequestBody WriteBackRequest request) {
        return ApiResponse.success(writeBackService.writeBack(request.getExportPath(), request.getUpdates(),
                request.getPathMappings(), request.isCreateBackup(), request.isForceOverwrite()));
    }

    @PostMapping("/validate")
    public ApiResponse<WriteBackValidationResult> validate(@Valid @RequestBody WriteBackRequest request) {
        return ApiResponse.success(writeBackService.validate(request.getExportPath(), request.getUpdates()));
    }

    @PostMapping("/books")
    public ApiResponse<WriteBackResult> writeBackBooks(@Valid @RequestBody WriteBackBooksRequest request) {
        if (request.isDeferred()) {
            writeBackBatcher.enqueue(request.getBookIds());
            return ApiResponse.success(new WriteBackResult(0, null,
                    "Queued " + request.getBookIds().size() + " books, " + writeBackBatcher.pendingCount() + " pending"));
        }
        return ApiResponse.success(writeBackService.writeBackBooks(request.getBookIds(),
                request.isCreateBackup(), request.isForceOverwrite()));
    }
}
