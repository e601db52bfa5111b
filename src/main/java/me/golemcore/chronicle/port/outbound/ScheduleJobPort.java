package me.golemcore.chronicle.port.outbound;

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

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of the job ledger. Status changes go through conditional
 * updates so that two processes sharing the store cannot both claim a run.
 */
public interface ScheduleJobPort {

    Optional<ScheduleJob> findByTypeAndName(JobType jobType, String jobName);

    /**
     * Looks up a job by name alone. Names are expected to be unique across
     * types; if they are not, the oldest row wins.
     */
    Optional<ScheduleJob> findByName(String jobName);

    Optional<ScheduleJob> findById(Long id);

    List<ScheduleJob> findAll();

    /**
     * Inserts the job unless a row with the same type and name exists.
     *
     * @return true if a new row was written
     */
    boolean insertIfAbsent(ScheduleJob job);

    /**
     * Sets the row to RUNNING if it is enabled and not already running.
     *
     * @return true if this caller won the claim
     */
    boolean claim(Long id, Instant now);

    /**
     * Moves a RUNNING row to its terminal status. A row that is no longer
     * RUNNING is left alone.
     *
     * @return true if the row was updated
     */
    boolean finish(Long id, JobStatus status, String resultJson, String error, Instant nextRunAt, Instant now);

    /**
     * Fails every row still marked RUNNING.
     *
     * @return number of rows updated
     */
    int failRunning(String error, Instant now);

    void updateNextRun(Long id, Instant nextRunAt, Instant now);

    void setEnabled(Long id, boolean enabled, Instant now);
}
