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

import java.util.Map;

/**
 * Work carried out by one firing of a ledger job. Exactly one pipeline serves
 * each {@link JobType}.
 *
 * <p>
 * Implementations recover locally from per-item failures; anything thrown
 * fails the whole run.
 */
public interface JobPipeline {

    JobType getJobType();

    /**
     * @param config
     *            the job's parsed JSON config, never null
     * @return structured result stored as the job's last result
     */
    Map<String, Object> run(ScheduleJob job, Map<String, Object> config);

    /**
     * Reads a boolean stage toggle from the job config. Missing toggles are on.
     */
    static boolean isStageEnabled(Map<String, Object> config, String stage) {
        Object value = config.get(stage);
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            return !"false".equalsIgnoreCase(text.trim());
        }
        return true;
    }
}
