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

import me.golemcore.chronicle.domain.model.CompilationResult;
import me.golemcore.chronicle.domain.model.DuplicateScanResult;
import me.golemcore.chronicle.domain.model.JobType;
import me.golemcore.chronicle.domain.model.ScheduleJob;
import me.golemcore.chronicle.domain.service.CompilationService;
import me.golemcore.chronicle.domain.service.DuplicateDetectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Nightly run: flag duplicate knowledge, then compile the day's journal.
 * A failing duplicate scan is recorded and does not stop compilation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NightCompilationPipeline implements JobPipeline {

    static final String DEDUP_STAGE = "dedup";
    static final String COMPILE_STAGE = "compile";

    private final DuplicateDetectionService duplicateDetectionService;
    private final CompilationService compilationService;

    @Override
    public JobType getJobType() {
        return JobType.NIGHT_COMPILE;
    }

    @Override
    public Map<String, Object> run(ScheduleJob job, Map<String, Object> config) {
        Map<String, Object> result = new LinkedHashMap<>();

        if (JobPipeline.isStageEnabled(config, DEDUP_STAGE)) {
            try {
                DuplicateScanResult dedup = duplicateDetectionService.flagDuplicates();
                result.put("duplicates", dedup);
            } catch (RuntimeException e) {
                log.error("[Dedup] Duplicate scan failed: {}", e.getMessage(), e);
                result.put("duplicates", Map.of("error", String.valueOf(e.getMessage())));
            }
        }

        if (JobPipeline.isStageEnabled(config, COMPILE_STAGE)) {
            CompilationResult compilation = compilationService.compile();
            result.put("compilation", compilation);
        }

        return result;
    }
}
