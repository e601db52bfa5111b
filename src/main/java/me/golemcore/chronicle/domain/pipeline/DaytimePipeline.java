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

import me.golemcore.chronicle.domain.model.CaptureResult;
import me.golemcore.chronicle.domain.model.JobType;
import me.golemcore.chronicle.domain.model.ReclassificationResult;
import me.golemcore.chronicle.domain.model.ScheduleJob;
import me.golemcore.chronicle.domain.service.ReclassificationService;
import me.golemcore.chronicle.domain.service.SnippetCaptureService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Daytime organization: snippet capture, then the reclassification pass.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DaytimePipeline implements JobPipeline {

    static final String CAPTURE_STAGE = "capture";
    static final String RECLASSIFY_STAGE = "reclassify";

    private final SnippetCaptureService captureService;
    private final ReclassificationService reclassificationService;

    @Override
    public JobType getJobType() {
        return JobType.DAY_ORGANIZE;
    }

    @Override
    public Map<String, Object> run(ScheduleJob job, Map<String, Object> config) {
        Map<String, Object> result = new LinkedHashMap<>();

        if (JobPipeline.isStageEnabled(config, CAPTURE_STAGE)) {
            CaptureResult capture = captureService.capture();
            result.put("snippets", capture);
        } else {
            log.debug("[Scheduler] Capture stage disabled for '{}'", job.getJobName());
        }

        if (JobPipeline.isStageEnabled(config, RECLASSIFY_STAGE)) {
            ReclassificationResult reclassification = reclassificationService.reclassify();
            result.put("reclassification", reclassification);
        } else {
            log.debug("[Scheduler] Reclassification stage disabled for '{}'", job.getJobName());
        }

        return result;
    }
}
