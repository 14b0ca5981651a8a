package com.example.cronscheduler.controller;

import com.example.cronscheduler.dto.ApiResponse;
import com.example.cronscheduler.dto.JobRunResponse;
import com.example.cronscheduler.dto.RunStatistics;
import com.example.cronscheduler.service.JobDefinitionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Read-only access to individual runs and run statistics
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/runs")
@Tag(name = "Runs", description = "Job occurrence history")
public class RunController {

    private final JobDefinitionService jobDefinitionService;

    @GetMapping("/statistics")
    @Operation(summary = "Run statistics", description = "Runs by status, recent error types and queue depth")
    public ResponseEntity<ApiResponse<RunStatistics>> getStatistics() {
        return ResponseEntity.ok(ApiResponse.success(jobDefinitionService.getStatistics()));
    }

    @GetMapping("/{runId}")
    @Operation(summary = "Get run", description = "One occurrence with all its attempts")
    public ResponseEntity<ApiResponse<JobRunResponse>> getRun(@Parameter(description = "Run UUID") @PathVariable UUID runId) {
        return ResponseEntity.ok(ApiResponse.success(jobDefinitionService.getRun(runId)));
    }
}
