package me.golemcore.chronicle.domain.service;

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

import me.golemcore.chronicle.domain.model.EntryType;
import me.golemcore.chronicle.domain.model.LlmRequest;
import me.golemcore.chronicle.domain.model.LlmResponse;
import me.golemcore.chronicle.domain.model.ModelTier;
import me.golemcore.chronicle.infrastructure.config.ChronicleProperties;
import me.golemcore.chronicle.port.outbound.LlmPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Asks the quality-tier model to organize one category of a project's day
 * into a clean document, using only the supplied material.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentSynthesizer {

    private static final String SYSTEM_PROMPT = """
            You organize engineering journal entries into concise project documentation.
            Never add facts that are not in the supplied entries.
            """;

    private final LlmPort llmPort;
    private final ChronicleProperties properties;

    /**
     * @return the synthesized document, or empty when the model is
     *         unavailable, fails or answers with nothing
     */
    public Optional<String> synthesize(String projectName, EntryType category, String dateLabel, String material) {
        if (!llmPort.isAvailable()) {
            log.debug("[Compiler] LLM unavailable, using raw material for {} / {}", projectName, category);
            return Optional.empty();
        }

        LlmRequest request = LlmRequest.builder()
                .tier(ModelTier.QUALITY)
                .systemPrompt(SYSTEM_PROMPT)
                .userPrompt(buildPrompt(projectName, category, dateLabel, material))
                .maxTokens(properties.getCompilation().getMaxTokens())
                .build();

        long timeoutMs = properties.getLlm().getTimeoutMs();
        try {
            LlmResponse response = llmPort.chat(request).get(timeoutMs, TimeUnit.MILLISECONDS);
            if (response == null || !response.hasContent()) {
                log.warn("[Compiler] Empty synthesis for {} / {}", projectName, category);
                return Optional.empty();
            }
            return Optional.of(response.getContent().trim());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Compiler] Interrupted while synthesizing {} / {}", projectName, category);
            return Optional.empty();
        } catch (TimeoutException e) {
            log.warn("[Compiler] Synthesis for {} / {} timed out after {}ms", projectName, category, timeoutMs);
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Compiler] Synthesis for {} / {} failed: {}", projectName, category, cause.getMessage());
            return Optional.empty();
        }
    }

    String buildPrompt(String projectName, EntryType category, String dateLabel, String material) {
        return "Organize these " + category.getLabel() + " entries for \"" + projectName + "\" from "
                + dateLabel + ".\n\n"
                + "RULES:\n"
                + "- ONLY use the information provided - do NOT invent anything\n"
                + "- Keep ALL important details\n"
                + "- Organize logically with clear structure\n"
                + "- Include timestamps\n"
                + "- Remove redundancy\n"
                + "- Be concise but complete\n\n"
                + "Raw entries:\n"
                + material + "\n\n"
                + "Create a clean, organized document:";
    }
}
