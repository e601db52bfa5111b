package me.golemcore.chronicle.infrastructure.config;

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
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code chronicle.*} prefix with one
 * nested group per subsystem:
 * <ul>
 * <li>{@link SchedulerProperties} - tick loop and cron zone</li>
 * <li>{@link JobDefinition} - jobs seeded into the ledger at startup</li>
 * <li>{@link CaptureProperties}, {@link ReclassificationProperties} - daytime
 * pipeline</li>
 * <li>{@link DedupProperties}, {@link CompilationProperties} - nightly
 * pipeline</li>
 * <li>{@link CorrectionsProperties} - correction retention</li>
 * <li>{@link LlmProperties} - model provider and tiers</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "chronicle")
@Data
public class ChronicleProperties {

    private SchedulerProperties scheduler = new SchedulerProperties();
    private List<JobDefinition> jobs = defaultJobs();
    private CaptureProperties capture = new CaptureProperties();
    private ReclassificationProperties reclassification = new ReclassificationProperties();
    private DedupProperties dedup = new DedupProperties();
    private CompilationProperties compilation = new CompilationProperties();
    private CorrectionsProperties corrections = new CorrectionsProperties();
    private LlmProperties llm = new LlmProperties();

    @Data
    public static class SchedulerProperties {
        private boolean enabled = true;
        private int tickIntervalSeconds = 30;
        private String zone = "America/Los_Angeles";
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class JobDefinition {
        private JobType type;
        private String name;
        private String cron;
        private boolean enabled = true;
        private Map<String, Object> config = new LinkedHashMap<>();
    }

    @Data
    public static class CaptureProperties {
        private int batchLimit = 500;
        private String defaultProjectPath = "general";
        private int contextLength = 500;
    }

    @Data
    public static class ReclassificationProperties {
        private int windowMinutes = 30;
        private int batchLimit = 100;
        private String cataloger = "chronicle-day-organizer";
        private int previewLength = 300;
    }

    @Data
    public static class DedupProperties {
        private int windowSize = 500;
        private double threshold = 0.85;
        private String creator = "chronicle-cleanup";
    }

    @Data
    public static class CompilationProperties {
        private String creator = "chronicle-night-compiler";
        private int maxTokens = 1500;
    }

    @Data
    public static class CorrectionsProperties {
        private int retentionDays = 30;
        private String actor = "chronicle";
    }

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private String fastModel = "openai/gpt-4o-mini";
        private String qualityModel = "anthropic/claude-sonnet-4-20250514";
        private long timeoutMs = 60_000;
        private int maxRetries = 3;
        private long initialBackoffMs = 1_000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    private static List<JobDefinition> defaultJobs() {
        List<JobDefinition> jobs = new ArrayList<>();
        jobs.add(new JobDefinition(JobType.DAY_ORGANIZE, "Organize Knowledge Buckets", "*/30 6-23 * * *", true,
                new LinkedHashMap<>()));
        jobs.add(new JobDefinition(JobType.NIGHT_COMPILE, "Nightly Compilation", "0 2 * * *", true,
                new LinkedHashMap<>()));
        jobs.add(new JobDefinition(JobType.CLEANUP, "Clean Resolved Corrections", "0 4 * * SUN", true,
                new LinkedHashMap<>()));
        return jobs;
    }
}
