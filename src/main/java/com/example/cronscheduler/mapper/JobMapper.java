package com.example.cronscheduler.mapper;

import com.example.cronscheduler.domain.entity.Job;
import com.example.cronscheduler.domain.entity.JobRun;
import com.example.cronscheduler.domain.entity.RunAttemptLog;
import com.example.cronscheduler.dto.JobResponse;
import com.example.cronscheduler.dto.JobRunResponse;
import com.example.cronscheduler.dto.RunAttemptResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobMapper {

    @Mapping(target = "enabled", expression = "java(job.isEnabled())")
    JobResponse toResponse(Job job);

    /**
     * Run without its attempt list
     */
    @Mapping(target = "attempts", ignore = true)
    JobRunResponse toRunResponse(JobRun run);

    RunAttemptResponse toAttemptResponse(RunAttemptLog log);

    List<RunAttemptResponse> toAttemptResponses(List<RunAttemptLog> logs);
}
