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

import me.golemcore.chronicle.domain.service.JobLedgerService;
import me.golemcore.chronicle.infrastructure.config.ChronicleProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Registers the configured job definitions in the ledger. Registration is
 * insert-if-absent, so seeding on every start is safe and never resets an
 * existing job.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobSeeder {

    private final JobLedgerService ledgerService;
    private final ChronicleProperties properties;

    /**
     * @return number of jobs newly registered
     */
    public int seedJobs() {
        int created = 0;
        for (ChronicleProperties.JobDefinition definition : properties.getJobs()) {
            try {
                if (ledgerService.register(definition.getType(), definition.getName(), definition.getCron(),
                        definition.getConfig(), definition.isEnabled())) {
                    created++;
                }
            } catch (IllegalArgumentException e) {
                log.error("[Scheduler] Skipping invalid job definition '{}': {}", definition.getName(),
                        e.getMessage());
            }
        }
        log.info("[Scheduler] Seeded {} new job(s) from {} definition(s)", created, properties.getJobs().size());
        return created;
    }
}
