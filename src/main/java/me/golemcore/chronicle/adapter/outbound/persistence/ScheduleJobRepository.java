package me.golemcore.chronicle.adapter.outbound.persistence;

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
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface ScheduleJobRepository extends JpaRepository<ScheduleJob, Long> {

    Optional<ScheduleJob> findByJobTypeAndJobName(JobType jobType, String jobName);

    Optional<ScheduleJob> findFirstByJobNameOrderByIdAsc(String jobName);

    /**
     * Compare-and-swap claim of a run. Matches only an enabled row that is not
     * already RUNNING.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE ScheduleJob j SET j.status = :running, j.lastRunAt = :now, j.lastError = NULL, j.updatedAt = :now "
            + "WHERE j.id = :id AND j.enabled = true AND j.status <> :running")
    int claim(@Param("id") Long id, @Param("running") JobStatus running, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE ScheduleJob j SET j.status = :status, j.lastResult = :result, j.lastError = :error, "
            + "j.nextRunAt = :nextRunAt, j.updatedAt = :now WHERE j.id = :id AND j.status = :running")
    int finish(@Param("id") Long id, @Param("status") JobStatus status, @Param("result") String result,
            @Param("error") String error, @Param("nextRunAt") Instant nextRunAt, @Param("now") Instant now,
            @Param("running") JobStatus running);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE ScheduleJob j SET j.status = :failed, j.lastError = :error, j.updatedAt = :now "
            + "WHERE j.status = :running")
    int failRunning(@Param("failed") JobStatus failed, @Param("running") JobStatus running,
            @Param("error") String error, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE ScheduleJob j SET j.nextRunAt = :nextRunAt, j.updatedAt = :now WHERE j.id = :id")
    int updateNextRun(@Param("id") Long id, @Param("nextRunAt") Instant nextRunAt, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE ScheduleJob j SET j.enabled = :enabled, j.updatedAt = :now WHERE j.id = :id")
    int updateEnabled(@Param("id") Long id, @Param("enabled") boolean enabled, @Param("now") Instant now);
}
