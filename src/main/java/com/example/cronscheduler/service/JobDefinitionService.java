package com.example.cronscheduler.service;

import com.example.cronscheduler.config.CronSchedulerProperties;
import com.example.cronscheduler.domain.entity.Job;
import com.example.cronscheduler.domain.enums.CallbackMethod;
import com.example.cronscheduler.domain.enums.RunStatus;
import com.example.cronscheduler.domain.repository.JobRepository;
import com.example.cronscheduler.domain.repository.JobRunRepository;
import com.example.cronscheduler.domain.repository.RunAttemptLogRepository;
import com.example.cronscheduler.dto.JobDefinitionRequest;
import com.example.cronscheduler.dto.JobResponse;
import com.example.cronscheduler.dto.JobRunResponse;
import com.example.cronscheduler.dto.RunStatistics;
import com.example.cronscheduler.exception.DuplicateJobException;
import com.example.cronscheduler.exception.JobNotFoundException;
import com.example.cronscheduler.exception.JobValidationException;
import com.example.cronscheduler.exception.RunNotFoundException;
import com.example.cronscheduler.mapper.JobMapper;
import com.example.cronscheduler.queue.DispatchQueue;
import com.example.cronscheduler.schedule.DueTimeCalculator;
import com.example.cronscheduler.schedule.JobSchedule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Service behind the job definition API.
 * <p>
 * Provides:
 * - Create, replace and delete with full validation (schedule, callback target, retry settings)
 * - Enable and disable
 * - Run history and statistics
 * <p>
 * Invalid definitions never reach the store. Deleting a job leaves its runs alone, so an
 * in-flight run completes from its own snapshot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobDefinitionService {

    private static final String RESERVED_HEADER_PREFIX = "x-cron-";

    private final JobRepository jobRepository;
    private final JobRunRepository runRepository;
    private final RunAttemptLogRepository attemptLogRepository;
    private final DispatchQueue dispatchQueue;
    private final DueTimeCalculator dueTimeCalculator;
    private final JobMapper jobMapper;
    private final CronSchedulerProperties properties;
    private final Clock clock;

    // === Definition ===

    @Transactional
    public JobResponse createJob(JobDefinitionRequest request) {
        log.info("Creating job {}", request.getName());

        if (jobRepository.existsByName(request.getName())) {
            throw new DuplicateJobException(request.getName());
        }

        var now = clock.instant();
        var schedule = validate(request, now);

        var job = Job.builder().name(request.getName()).build();
        apply(job, request, schedule, now);

        job = jobRepository.save(job);
        log.info("Created job {} ({}), next run at {}", job.getName(), describe(job), job.getNextRunAt());

        return jobMapper.toResponse(job);
    }

    /**
     * Replace the whole definition of an existing job. The schedule restarts from now.
     */
    @Transactional
    public JobResponse replaceJob(String name, JobDefinitionRequest request) {
        if (!name.equals(request.getName())) {
            throw new JobValidationException("name: must match the job name in the path ('" + name + "')");
        }
        var job = findJob(name);

        var now = clock.instant();
        var schedule = validate(request, now);
        apply(job, request, schedule, now);

        job = jobRepository.save(job);
        log.info("Replaced job {} ({}), next run at {}", job.getName(), describe(job), job.getNextRunAt());

        return jobMapper.toResponse(job);
    }

    /**
     * Delete a job. Runs already claimed complete from their snapshot.
     */
    @Transactional
    public void deleteJob(String name) {
        var job = findJob(name);
        var active = runRepository.countByJobIdAndStatusIn(job.getId(), RunStatus.ACTIVE);
        jobRepository.delete(job);
        log.info("Deleted job {} ({} active run(s) will complete)", name, active);
    }

    @Transactional
    public JobResponse enableJob(String name) {
        var job = findJob(name);
        if (job.isEnabled()) {
            return jobMapper.toResponse(job);
        }

        job.setEnabled(true);
        job.setNextRunAt(dueTimeCalculator.nextOccurrence(job, clock.instant()).orElse(null));
        if (job.getNextRunAt() == null) {
            log.warn("Job {} enabled but has no future occurrence", name);
        }
        job = jobRepository.save(job);
        log.info("Enabled job {}, next run at {}", name, job.getNextRunAt());

        return jobMapper.toResponse(job);
    }

    /**
     * Disable a job. A run already in flight is not cancelled; only future claims stop.
     */
    @Transactional
    public JobResponse disableJob(String name) {
        var job = findJob(name);
        if (!job.isEnabled()) {
            return jobMapper.toResponse(job);
        }

        job.setEnabled(false);
        job = jobRepository.save(job);
        log.info("Disabled job {}", name);

        return jobMapper.toResponse(job);
    }

    // === Retrieval ===

    @Transactional(readOnly = true)
    public JobResponse getJob(String name) {
        return jobMapper.toResponse(findJob(name));
    }

    @Transactional(readOnly = true)
    public Page<JobResponse> listJobs(Boolean enabled, Pageable pageable) {
        var jobs = enabled != null ? jobRepository.findByEnabled(enabled, pageable) : jobRepository.findAll(pageable);
        return jobs.map(jobMapper::toResponse);
    }

    /**
     * Run history of a job, newest occurrence first. History outlives the job itself.
     */
    @Transactional(readOnly = true)
    public Page<JobRunResponse> getJobRuns(String name, RunStatus status, Pageable pageable) {
        var runs = status != null
                ? runRepository.findByJobNameAndStatusOrderByScheduledForDesc(name, status, pageable)
                : runRepository.findByJobNameOrderByScheduledForDesc(name, pageable);

        if (runs.isEmpty() && !jobRepository.existsByName(name)) {
            throw new JobNotFoundException(name);
        }
        return runs.map(jobMapper::toRunResponse);
    }

    @Transactional(readOnly = true)
    public JobRunResponse getRun(UUID runId) {
        var run = runRepository.findById(runId).orElseThrow(() -> new RunNotFoundException(runId));
        var response = jobMapper.toRunResponse(run);
        response.setAttempts(jobMapper.toAttemptResponses(attemptLogRepository.findByRunIdOrderByAttemptNumberAsc(runId)));
        return response;
    }

    @Transactional(readOnly = true)
    public RunStatistics getStatistics() {
        var statusDistribution = new LinkedHashMap<String, Long>();
        for (var status : RunStatus.values()) {
            statusDistribution.put(status.name(), 0L);
        }
        for (var row : runRepository.countGroupedByStatus()) {
            statusDistribution.put(((RunStatus) row[0]).name(), (Long) row[1]);
        }

        var errorDistribution = new LinkedHashMap<String, Long>();
        var since = clock.instant().minus(Duration.ofDays(1));
        for (var row : attemptLogRepository.getErrorDistribution(since)) {
            errorDistribution.put((String) row[0], (Long) row[1]);
        }

        var active = RunStatus.ACTIVE.stream().mapToLong(s -> statusDistribution.get(s.name())).sum();

        return RunStatistics.builder()
                .statusDistribution(statusDistribution)
                .errorDistribution(errorDistribution)
                .activeRuns(active)
                .enabledJobs(jobRepository.countByEnabledTrue())
                .queueDepth(dispatchQueue.depth())
                .generatedAt(clock.instant())
                .build();
    }

    // === Helpers ===

    private Job findJob(String name) {
        return jobRepository.findByName(name).orElseThrow(() -> new JobNotFoundException(name));
    }

    /**
     * Check everything the annotations cannot express.
     *
     * @return the parsed schedule
     */
    JobSchedule validate(JobDefinitionRequest request, Instant now) {
        // Malformed cron, unknown zone and both/neither schedule kinds throw InvalidScheduleException
        var schedule = JobSchedule.of(request.getCronExpression(), request.getRunAt(), request.getTimeZone());

        var violations = new ArrayList<String>();
        if (dueTimeCalculator.nextOccurrence(schedule, now).isEmpty()) {
            violations.add(schedule.isRecurring()
                    ? "cronExpression: never matches a future time"
                    : "runAt: must be in the future");
        }

        validateCallbackUrl(request.getCallbackUrl(), violations);

        if (request.getCallbackHeaders() != null) {
            request.getCallbackHeaders().forEach((header, value) -> {
                if (header == null || header.isBlank()) {
                    violations.add("callbackHeaders: header names must not be blank");
                } else if (header.toLowerCase(Locale.ROOT).startsWith(RESERVED_HEADER_PREFIX)) {
                    violations.add("callbackHeaders: '" + header + "' is reserved");
                }
            });
        }

        if (!violations.isEmpty()) {
            throw new JobValidationException(violations);
        }
        return schedule;
    }

    private void validateCallbackUrl(String url, List<String> violations) {
        if (url == null || url.isBlank()) {
            violations.add("callbackUrl: is required");
            return;
        }
        try {
            var uri = URI.create(url.trim());
            var scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : null;
            if (!"http".equals(scheme) && !"https".equals(scheme)) {
                violations.add("callbackUrl: must be an absolute http or https URL");
            } else if (uri.getHost() == null) {
                violations.add("callbackUrl: must include a host");
            }
        } catch (IllegalArgumentException e) {
            violations.add("callbackUrl: " + e.getMessage());
        }
    }

    private void apply(Job job, JobDefinitionRequest request, JobSchedule schedule, Instant now) {
        job.setDescription(request.getDescription());
        job.setCronExpression(schedule.isRecurring() ? schedule.getCron().getExpression() : null);
        job.setTimeZone(schedule.getZone().getId());
        job.setRunAt(schedule.getRunAt());
        job.setCallbackUrl(request.getCallbackUrl().trim());
        job.setCallbackMethod(request.getCallbackMethod() != null ? request.getCallbackMethod() : CallbackMethod.POST);
        job.setPayloadTemplate(request.getPayloadTemplate());
        job.setCallbackHeaders(request.getCallbackHeaders() != null ? new HashMap<>(request.getCallbackHeaders()) : new HashMap<>());
        job.setMaxRetries(request.getMaxRetries() != null ? request.getMaxRetries() : properties.getDefaultMaxRetries());
        job.setRetryBackoffMs(request.getRetryBackoffMs() != null ? request.getRetryBackoffMs() : properties.getDefaultRetryBackoffMs());
        job.setEnabled(request.getEnabled() == null || request.getEnabled());
        job.setNextRunAt(dueTimeCalculator.nextOccurrence(schedule, now).orElse(null));
    }

    private static String describe(Job job) {
        return job.getCronExpression() != null
                ? "cron '" + job.getCronExpression() + "' " + job.getTimeZone()
                : "one-shot at " + job.getRunAt();
    }
}
