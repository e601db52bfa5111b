package me.golemcore.chronicle.domain.pipeline;

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

import me.golemcore.chronicle.domain.model.JobType;
import me.golemcore.chronicle.domain.model.ScheduleJob;
import me.golemcore.chronicle.domain.service.CorrectionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weekly purge of resolved corrections past their retention period.
 */
@Component
@RequiredArgsConstructor
public class CorrectionCleanupPipeline implements JobPipeline {

    private final CorrectionService correctionService;

    @Override
    public JobType getJobType() {
        return JobType.CLEANUP;
    }

    @Override
    public Map<String, Object> run(ScheduleJob job, Map<String, Object> config) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("correctionsDeleted", correctionService.purgeResolved());
        return result;
    }
}
