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
import me.golemcore.chronicle.port.outbound.ScheduleJobPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JPA-backed job ledger.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaScheduleJobAdapter implements ScheduleJobPort {

    private final ScheduleJobRepository repository;

    @Override
    public Optional<ScheduleJob> findByTypeAndName(JobType jobType, String jobName) {
        return repository.findByJobTypeAndJobName(jobType, jobName);
    }

    @Override
    public Optional<ScheduleJob> findByName(String jobName) {
        return repository.findFirstByJobNameOrderByIdAsc(jobName);
    }

    @Override
    public Optional<ScheduleJob> findById(Long id) {
        return repository.findById(id);
    }

    @Override
    public List<ScheduleJob> findAll() {
        return repository.findAll();
    }

    @Override
    public boolean insertIfAbsent(ScheduleJob job) {
        if (repository.findByJobTypeAndJobName(job.getJobType(), job.getJobName()).isPresent()) {
            return false;
        }
        try {
            repository.saveAndFlush(job);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("[Ledger] Job {} / {} registered concurrently", job.getJobType(), job.getJobName());
            return false;
        }
    }

    @Override
    public boolean claim(Long id, Instant now) {
        return repository.claim(id, JobStatus.RUNNING, now) == 1;
    }

    @Override
    public boolean finish(Long id, JobStatus status, String resultJson, String error, Instant nextRunAt,
            Instant now) {
        return repository.finish(id, status, resultJson, error, nextRunAt, now, JobStatus.RUNNING) == 1;
    }

    @Override
    public int failRunning(String error, Instant now) {
        return repository.failRunning(JobStatus.FAILED, JobStatus.RUNNING, error, now);
    }

    @Override
    public void updateNextRun(Long id, Instant nextRunAt, Instant now) {
        repository.updateNextRun(id, nextRunAt, now);
    }

    @Override
    public void setEnabled(Long id, boolean enabled, Instant now) {
        repository.updateEnabled(id, enabled, now);
    }
}
