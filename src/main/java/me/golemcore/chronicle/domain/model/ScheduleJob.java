package me.golemcore.chronicle.domain.model;

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

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row of the job ledger: a named recurring job with its cron schedule and
 * the outcome of its most recent run. Rows are seeded once and mutated only by
 * the scheduler around each run; they are never deleted.
 */
@Entity
@Table(name = "schedule_jobs", uniqueConstraints = @UniqueConstraint(name = "uk_schedule_jobs_type_name", columnNames = {
        "job_type", "job_name" }))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, length = 30)
    private JobType jobType;

    @Column(name = "job_name", nullable = false, length = 200)
    private String jobName;

    /**
     * Six-field Spring cron expression, evaluated in the configured zone.
     */
    @Column(name = "cron_expression", nullable = false, length = 100)
    private String cronExpression;

    @Builder.Default
    @Column(name = "enabled", nullable = false)
    private boolean enabled = true;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status = JobStatus.IDLE;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Column(name = "next_run_at")
    private Instant nextRunAt;

    /**
     * JSON payload of the last run (per-stage counts, durations).
     */
    @Lob
    @Column(name = "last_result")
    private String lastResult;

    @Column(name = "last_error", length = 4000)
    private String lastError;

    /**
     * Free-form JSON configuration handed to the pipeline.
     */
    @Lob
    @Column(name = "config")
    private String config;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }
}
