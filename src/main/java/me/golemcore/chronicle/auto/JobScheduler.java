package me.golemcore.chronicle.auto;

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

import me.golemcore.chronicle.domain.model.JobRunOutcome;
import me.golemcore.chronicle.domain.model.JobType;
import me.golemcore.chronicle.domain.model.ScheduleJob;
import me.golemcore.chronicle.domain.pipeline.JobPipeline;
import me.golemcore.chronicle.domain.service.JobLedgerService;
import me.golemcore.chronicle.infrastructure.config.ChronicleProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runtime loop that fires due ledger jobs.
 *
 * <p>
 * A single background thread ticks at a configurable interval, asks
 * {@link JobLedgerService} for due jobs and runs them one after another.
 * Overlap protection lives in the ledger: a job whose claim fails is skipped
 * and its row is left untouched. Manual runs go through {@link #trigger} and
 * are subject to the same claim.
 *
 * <p>
 * If a tick is still processing when the next one is due, the next tick is
 * skipped.
 *
 * @since 1.0
 * @see JobLedgerService
 * @see JobPipeline
 */
@Component
@Slf4j
public class JobScheduler {

    private final JobLedgerService ledgerService;
    private final JobSeeder jobSeeder;
    private final ChronicleProperties properties;
    private final Clock clock;
    private final Map<JobType, JobPipeline> pipelines = new EnumMap<>(JobType.class);
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public JobScheduler(JobLedgerService ledgerService, JobSeeder jobSeeder, List<JobPipeline> pipelines,
            ChronicleProperties properties, Clock clock) {
        this.ledgerService = ledgerService;
        this.jobSeeder = jobSeeder;
        this.properties = properties;
        this.clock = clock;
        for (JobPipeline pipeline : pipelines) {
            JobPipeline previous = this.pipelines.put(pipeline.getJobType(), pipeline);
            if (previous != null) {
                throw new IllegalStateException("Duplicate pipeline for job type " + pipeline.getJobType());
            }
        }
    }

    @PostConstruct
    public void init() {
        jobSeeder.seedJobs();
        ledgerService.recoverInterruptedRuns();

        if (!properties.getScheduler().isEnabled()) {
            log.info("[Scheduler] Scheduler disabled, jobs run only when triggered manually");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "chronicle-job-scheduler");
            t.setDaemon(true);
            return t;
        });

        int tickIntervalSeconds = Math.max(1, properties.getScheduler().getTickIntervalSeconds());
        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                tickIntervalSeconds,
                tickIntervalSeconds,
                TimeUnit.SECONDS);

        log.info("[Scheduler] Started with tick interval: {}s, zone: {}", tickIntervalSeconds,
                properties.getScheduler().getZone());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Scheduler] Shut down");
    }

    /**
     * Fire every due job. Runs on the scheduler thread; also callable directly.
     */
    public void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Scheduler] Previous tick still running, skipping");
            return;
        }
        try {
            for (ScheduleJob job : ledgerService.getDueJobs()) {
                trigger(job.getJobName());
            }
        } catch (RuntimeException e) {
            log.error("[Scheduler] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    /**
     * Run the named job now if it can be claimed.
     */
    public JobRunOutcome trigger(String jobName) {
        Optional<ScheduleJob> existing = ledgerService.findJob(jobName);
        if (existing.isEmpty()) {
            log.warn("[Scheduler] Unknown job '{}'", jobName);
            return JobRunOutcome.NOT_FOUND;
        }
        if (!existing.get().isEnabled()) {
            log.info("[Scheduler] Job '{}' is disabled, not running", jobName);
            return JobRunOutcome.DISABLED;
        }

        Optional<ScheduleJob> claimed = ledgerService.tryStart(jobName);
        if (claimed.isEmpty()) {
            log.info("[Scheduler] Job '{}' already running, skipping", jobName);
            return JobRunOutcome.SKIPPED;
        }

        ScheduleJob job = claimed.get();
        long startMs = clock.millis();
        log.info("[Scheduler] Running {} job '{}'", job.getJobType(), jobName);
        try {
            JobPipeline pipeline = pipelines.get(job.getJobType());
            if (pipeline == null) {
                throw new IllegalStateException("No pipeline registered for job type " + job.getJobType());
            }
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("success", true);
            result.putAll(pipeline.run(job, ledgerService.readConfig(job)));
            long durationMs = clock.millis() - startMs;
            result.put("durationMs", durationMs);
            ledgerService.complete(job, result);
            log.info("[Scheduler] Job '{}' completed in {}ms", jobName, durationMs);
            return JobRunOutcome.COMPLETED;
        } catch (RuntimeException e) {
            log.error("[Scheduler] Job '{}' failed: {}", jobName, e.getMessage(), e);
            ledgerService.fail(job, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return JobRunOutcome.FAILED;
        } catch (Error e) {
            // Record the run before the error unwinds so the row does not stay RUNNING
            log.error("[Scheduler] Job '{}' aborted: {}", jobName, e.toString(), e);
            ledgerService.fail(job, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            throw e;
        }
    }

    public List<ScheduleJob> listJobs() {
        return ledgerService.listJobs();
    }
}
