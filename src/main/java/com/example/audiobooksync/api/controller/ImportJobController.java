package com.example.audiobooksync.api.controller;

import com.example.audiobooksync.api.request.CreateImportJobRequest;
import com.example.audiobooksync.api.request.CreateSyncJobRequest;
import com.example.audiobooksync.api.request.ValidateImportRequest;
import com.example.audiobooksync.api.response.ApiResponse;
import com.example.audiobooksync.api.response.CreateImportJobResponse;
import com.example.audiobooksync.api.response.ImportJobDetailResponse;
import com.example.audiobooksync.api.response.ImportJobLogResponse;
import com.example.audiobooksync.application.service.ImportJobService;
import com.example.audiobooksync.application.service.ImportValidationService;
import com.example.audiobooksync.domain.model.ImportValidationResult;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/import")
public class ImportJobController {

    private final ImportJobService importJobService;
    private final ImportValidationService importValidationService;

    public ImportJobController(ImportJobService importJobService, ImportValidationService importValidationService) {
        this.importJobService = importJobService;
        this.importValidationService = importValidationService;
    }

    @PostMapping("/validate")
    public ApiResponse<ImportValidationResult> validate(@Valid @RequestBody ValidateImportRequest request) {
        return ApiResponse.success(importValidationService.validate(request.getExportPath(), request.getPathMappings()));
    }

    @PostMapping("/jobs")
    public ApiResponse<CreateImportJobResponse> createImportJob(@Valid @RequestBody CreateImportJobRequest request) {
        return ApiResponse.success(importJobService.createImportJob(request));
    }

    @PostMapping("/sync-jobs")
    public ApiResponse<CreateImportJobResponse> createSyncJob(@RequestBody CreateSyncJobRequest request) {
        return ApiResponse.success(importJobService.createSyncJob(request));
    }

    @GetMapping("/jobs")
    public ApiResponse<List<ImportJobDetailResponse>> listJobs(
            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        return ApiResponse.success(importJobService.listRecentJobs(limit));
    }

    @GetMapping("/jobs/{id}")
    public ApiResponse<ImportJobDetailResponse> getJob(@PathVariable("id") Long id) {
        return ApiResponse.success(importJobService.getJob(id));
    }

    @PostMapping("/jobs/{id}/cancel")
    public ApiResponse<String> cancelJob(@PathVariable("id") Long id) {
        if (!importJobService.cancelJob(id)) {
            return ApiResponse.fail("404", "Job not found");
        }
        return ApiResponse.success("CANCELED");
    }

    @PostMapping("/jobs/{id}/resume")
    public ApiResponse<CreateImportJobResponse> resumeJob(@PathVariable("id") Long id) {
        return ApiResponse.success(importJobService.resumeJob(id));
    }

    @GetMapping("/jobs/{id}/logs")
    public ApiResponse<List<ImportJobLogResponse>> listLogs(@PathVariable("id") Long id,
                                                           @RequestParam(value = "limit", defaultValue = "200") int limit) {
        return ApiResponse.success(importJobService.listLogs(id, limit));
    }
}
