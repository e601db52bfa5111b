package me.golemcore.chronicle.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.chronicle.domain.model.JobStatus;
import me.golemcore.chronicle.domain.model.JobType;
import me.golemcore.chronicle.domain.model.ScheduleJob;
import me.golemcore.chronicle.infrastructure.config.ChronicleProperties;
import me.golemcore.chronicle.port.outbound.ScheduleJobPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Domain service owning the job ledger: registration of recurring jobs, the
 * claim/complete/fail lifecycle of a run and next-run computation.
 *
 * <p>
 * Cron expressions are accepted in 5-field (minute-level) or 6-field Spring
 * form and stored as 6 fields. All evaluation happens in the zone configured by
 * {@code chronicle.scheduler.zone}.
 */
@Service
@Slf4j
public class JobLedgerService {

    private static final int CRON_FIVE_FIELDS = 5;
    private static final int CRON_SIX_FIELDS = 6;
    private static final int MAX_ERROR_LENGTH = 4000;
    private static final TypeReference<Map<String, Object>> CONFIG_TYPE_REF = new TypeReference<>() {
    };

    private final ScheduleJobPort scheduleJobPort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ZoneId zone;

    public JobLedgerService(ScheduleJobPort scheduleJobPort, ObjectMapper objectMapper, Clock clock,
            ChronicleProperties properties) {
        this.scheduleJobPort = scheduleJobPort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.zone = ZoneId.of(properties.getScheduler().getZone());
    }

    /**
     * Register a job unless one with the same type and name already exists. An
     * existing row keeps its schedule, state and history.
     *
     * @return true if a new row was created
     * @throws IllegalArgumentException
     *             if the cron expression is invalid
     */
    public boolean register(JobType jobType, String jobName, String cronExpression, Map<String, Object> config,
            boolean enabled) {
        if (jobType == null || jobName == null || jobName.isBlank()) {
            throw new IllegalArgumentException("Job type and name are required");
        }
        String normalizedCron = normalizeCronExpression(cronExpression);
        if (scheduleJobPort.findByTypeAndName(jobType, jobName).isPresent()) {
            log.debug("[Ledger] Job already registered: {} / {}", jobType, jobName);
            return false;
        }

        Instant now = clock.instant();
        ScheduleJob job = ScheduleJob.builder()
                .jobType(jobType)
                .jobName(jobName)
                .cronExpression(normalizedCron)
                .enabled(enabled)
                .status(JobStatus.IDLE)
                .config(writeJson(config != null ? config : Map.of()))
                .nextRunAt(computeNextExecution(normalizedCron, now))
                .createdAt(now)
                .updatedAt(now)
                .build();

        boolean inserted = scheduleJobPort.insertIfAbsent(job);
        if (inserted) {
            log.info("[Ledger] Registered {} job '{}': {}", jobType, jobName, normalizedCron);
        }
        return inserted;
    }

    public Optional<ScheduleJob> findJob(String jobName) {
        return scheduleJobPort.findByName(jobName);
    }

    public List<ScheduleJob> listJobs() {
        return scheduleJobPort.findAll().stream()
                .sorted(Comparator.comparing(ScheduleJob::getId))
                .toList();
    }

    /**
     * Claim a run of the named job. The claim is a single conditional update, so
     * of two concurrent callers at most one gets the job back.
     *
     * @return the job as stored after the claim, or empty if it is missing,
     *         disabled or already running
     */
    public Optional<ScheduleJob> tryStart(String jobName) {
        Optional<ScheduleJob> found = scheduleJobPort.findByName(jobName);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        ScheduleJob job = found.get();
        if (!job.isEnabled() || job.getStatus() == JobStatus.RUNNING) {
            return Optional.empty();
        }
        if (!scheduleJobPort.claim(job.getId(), clock.instant())) {
            return Optional.empty();
        }
        return scheduleJobPort.findById(job.getId());
    }

    /**
     * Record a successful run and schedule the next one.
     */
    public void complete(ScheduleJob job, Map<String, Object> result) {
        Instant now = clock.instant();
        Instant next = computeNextExecution(job.getCronExpression(), now);
        boolean updated = scheduleJobPort.finish(job.getId(), JobStatus.COMPLETED, writeJson(result), null, next, now);
        if (!updated) {
            log.warn("[Ledger] Job '{}' was no longer running when it completed", job.getJobName());
        }
    }

    /**
     * Record a failed run and schedule the next one. There is no retry beyond
     * the next cron firing.
     */
    public void fail(ScheduleJob job, String error) {
        Instant now = clock.instant();
        Instant next = computeNextExecution(job.getCronExpression(), now);
        String message = truncate(error != null ? error : "Unknown error");
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", false);
        result.put("error", message);
        boolean updated = scheduleJobPort.finish(job.getId(), JobStatus.FAILED, writeJson(result), message, next, now);
        if (!updated) {
            log.warn("[Ledger] Job '{}' was no longer running when it failed", job.getJobName());
        }
    }

    /**
     * Get jobs that are due: enabled, not running and with a next run at or
     * before now.
     */
    public List<ScheduleJob> getDueJobs() {
        Instant now = clock.instant();
        return listJobs().stream()
                .filter(ScheduleJob::isEnabled)
                .filter(j -> j.getStatus() != JobStatus.RUNNING)
                .filter(j -> j.getNextRunAt() != null && !j.getNextRunAt().isAfter(now))
                .toList();
    }

    /**
     * Fail runs interrupted by a restart and recompute every next run from now.
     * Windows missed while the process was down are skipped.
     */
    public void recoverInterruptedRuns() {
        Instant now = clock.instant();
        int interrupted = scheduleJobPort.failRunning("Interrupted by restart", now);
        if (interrupted > 0) {
            log.warn("[Ledger] Marked {} interrupted run(s) as failed", interrupted);
        }
        for (ScheduleJob job : scheduleJobPort.findAll()) {
            scheduleJobPort.updateNextRun(job.getId(), computeNextExecution(job.getCronExpression(), now), now);
        }
    }

    /**
     * @throws IllegalArgumentException
     *             if no such job exists
     */
    public void setEnabled(String jobName, boolean enabled) {
        ScheduleJob job = scheduleJobPort.findByName(jobName)
                .orElseThrow(() -> new IllegalArgumentException("Job not found: " + jobName));
        Instant now = clock.instant();
        scheduleJobPort.setEnabled(job.getId(), enabled, now);
        if (enabled) {
            scheduleJobPort.updateNextRun(job.getId(), computeNextExecution(job.getCronExpression(), now), now);
        }
        log.info("[Ledger] Job '{}' {}", jobName, enabled ? "enabled" : "disabled");
    }

    /**
     * Parse the job's JSON config. Malformed config reads as empty.
     */
    public Map<String, Object> readConfig(ScheduleJob job) {
        String json = job.getConfig();
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> config = objectMapper.readValue(json, CONFIG_TYPE_REF);
            return config != null ? config : Map.of();
        } catch (JsonProcessingException e) {
            log.warn("[Ledger] Ignoring malformed config of job '{}': {}", job.getJobName(), e.getOriginalMessage());
            return Map.of();
        }
    }

    /**
     * Normalize a cron expression: converts 5-field (minute-level) to 6-field
     * (Spring format with seconds). Validates the result.
     *
     * @throws IllegalArgumentException
     *             if the cron expression is invalid
     */
    static String normalizeCronExpression(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Cron expression cannot be empty");
        }

        String trimmed = input.trim();
        String[] parts = trimmed.split("\\s+");

        String sixFieldCron;
        if (parts.length == CRON_FIVE_FIELDS) {
            sixFieldCron = "0 " + String.join(" ", parts);
        } else if (parts.length == CRON_SIX_FIELDS) {
            sixFieldCron = String.join(" ", parts);
        } else {
            throw new IllegalArgumentException("Invalid cron expression: expected 5 or 6 fields, got " + parts.length);
        }

        try {
            CronExpression.parse(sixFieldCron);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + trimmed + "': " + e.getMessage(), e);
        }

        return sixFieldCron;
    }

    /**
     * Compute the next firing strictly after the given instant, in the
     * configured zone.
     *
     * @return next firing, or null if the expression never fires again
     */
    Instant computeNextExecution(String cronExpression, Instant after) {
        CronExpression cron = CronExpression.parse(cronExpression);
        ZonedDateTime next = cron.next(after.atZone(zone));
        return next != null ? next.toInstant() : null;
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("[Ledger] Failed to serialize job payload: {}", e.getOriginalMessage());
            return "{\"serializationError\":true}";
        }
    }

    private static String truncate(String value) {
        return value.length() > MAX_ERROR_LENGTH ? value.substring(0, MAX_ERROR_LENGTH) : value;
    }
}
