package com.example.cronscheduler.controller;

import com.example.cronscheduler.domain.enums.RunStatus;
import com.example.cronscheduler.dto.ApiResponse;
import com.example.cronscheduler.dto.JobDefinitionRequest;
import com.example.cronscheduler.dto.JobResponse;
import com.example.cronscheduler.dto.JobRunResponse;
import com.example.cronscheduler.service.JobDefinitionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API controller for job definitions.
 * <p>
 * Provides endpoints for:
 * - Creating, replacing and deleting jobs
 * - Enabling and disabling jobs
 * - Listing jobs and their run history
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/jobs")
@Tag(name = "Jobs", description = "APIs for managing cron and one-shot job definitions")
public class JobController {

    private final JobDefinitionService jobDefinitionService;

    @PostMapping
    @Operation(summary = "Create a job", description = "Create a recurring (cron) or one-shot job with an HTTP callback")
    public ResponseEntity<ApiResponse<JobResponse>> createJob(@Valid @RequestBody JobDefinitionRequest request) {
        log.info("API: Create job {}", request.getName());

        var response = jobDefinitionService.createJob(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Job created successfully"));
    }

    @GetMapping
    @Operation(summary = "List jobs", description = "List job definitions, optionally filtered by enabled flag")
    public ResponseEntity<ApiResponse<Page<JobResponse>>> listJobs(
            @Parameter(description = "Enabled filter") @RequestParam(required = false) Boolean enabled,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        var pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.ASC, "name"));
        return ResponseEntity.ok(ApiResponse.success(jobDefinitionService.listJobs(enabled, pageable)));
    }

    @GetMapping("/{name}")
    @Operation(summary = "Get job by name")
    public ResponseEntity<ApiResponse<JobResponse>> getJob(@Parameter(description = "Job name") @PathVariable String name) {
        return ResponseEntity.ok(ApiResponse.success(jobDefinitionService.getJob(name)));
    }

    @PutMapping("/{name}")
    @Operation(summary = "Replace a job", description = "Replace the full definition; the schedule restarts from now")
    public ResponseEntity<ApiResponse<JobResponse>> replaceJob(
            @Parameter(description = "Job name") @PathVariable String name,
            @Valid @RequestBody JobDefinitionRequest request) {
        log.info("API: Replace job {}", name);

        var response = jobDefinitionService.replaceJob(name, request);
        return ResponseEntity.ok(ApiResponse.success(response, "Job updated successfully"));
    }

    @DeleteMapping("/{name}")
    @Operation(summary = "Delete a job", description = "Runs already in flight still complete")
    public ResponseEntity<ApiResponse<Void>> deleteJob(@Parameter(description = "Job name") @PathVariable String name) {
        log.info("API: Delete job {}", name);

        jobDefinitionService.deleteJob(name);
        return ResponseEntity.ok(ApiResponse.success(null, "Job deleted successfully"));
    }

    @PostMapping("/{name}/enable")
    @Operation(summary = "Enable a job", description = "Resume scheduling from the next occurrence after now")
    public ResponseEntity<ApiResponse<JobResponse>> enableJob(@Parameter(description = "Job name") @PathVariable String name) {
        log.info("API: Enable job {}", name);

        return ResponseEntity.ok(ApiResponse.success(jobDefinitionService.enableJob(name), "Job enabled"));
    }

    @PostMapping("/{name}/disable")
    @Operation(summary = "Disable a job", description = "Stop future claims; a run in flight is not cancelled")
    public ResponseEntity<ApiResponse<JobResponse>> disableJob(@Parameter(description = "Job name") @PathVariable String name) {
        log.info("API: Disable job {}", name);

        return ResponseEntity.ok(ApiResponse.success(jobDefinitionService.disableJob(name), "Job disabled"));
    }

    @GetMapping("/{name}/runs")
    @Operation(summary = "Run history", description = "Occurrences of a job, newest first")
    public ResponseEntity<ApiResponse<Page<JobRunResponse>>> getJobRuns(
            @Parameter(description = "Job name") @PathVariable String name,
            @Parameter(description = "Status filter") @RequestParam(required = false) RunStatus status,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        var runs = jobDefinitionService.getJobRuns(name, status, PageRequest.of(page, size));
        return ResponseEntity.ok(ApiResponse.success(runs));
    }
}
