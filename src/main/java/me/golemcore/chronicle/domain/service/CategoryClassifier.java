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

import me.golemcore.chronicle.domain.model.CategoryVerdict;
import me.golemcore.chronicle.domain.model.KnowledgeItem;
import me.golemcore.chronicle.domain.model.LlmRequest;
import me.golemcore.chronicle.domain.model.LlmResponse;
import me.golemcore.chronicle.domain.model.ModelTier;
import me.golemcore.chronicle.infrastructure.config.ChronicleProperties;
import me.golemcore.chronicle.port.outbound.LlmPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM-based check of a knowledge item's category against the fixed
 * vocabulary.
 *
 * <p>
 * The classifier expects a JSON verdict and extracts it from markdown code
 * blocks when the model wraps it. Both {@code {"needsChange", "category"}} and
 * the shorter {@code {"correct", "suggested_category"}} shapes are accepted.
 * Any failure (provider unavailable, timeout, unparsable answer) yields an
 * empty result so the caller leaves the item untouched.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CategoryClassifier {

    public static final List<String> CATEGORIES = List.of(
            "architecture", "bug-fix", "config", "workflow", "feature", "refactor", "documentation", "api",
            "database", "ui", "testing", "deployment", "security", "performance", "lesson", "idea");

    private static final Pattern FENCED_JSON_PATTERN = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```",
            Pattern.DOTALL);
    private static final Pattern RAW_JSON_PATTERN = Pattern.compile("(\\{.*})", Pattern.DOTALL);

    private static final String SYSTEM_PROMPT = """
            You verify how knowledge items about software projects are categorized.
            Respond ONLY with valid JSON (no markdown, no explanation):

            {"needsChange": false}
            or
            {"needsChange": true, "category": "<one of the valid categories>", "subcategory": "...", "reason": "Brief explanation"}
            """;

    private final LlmPort llmPort;
    private final ChronicleProperties properties;
    private final ObjectMapper objectMapper;

    public static boolean isKnownCategory(String category) {
        return category != null && CATEGORIES.contains(category.toLowerCase(Locale.ROOT));
    }

    /**
     * Ask the model whether the item's category is right.
     *
     * @return the verdict, or empty when no usable answer was obtained
     */
    public Optional<CategoryVerdict> classify(KnowledgeItem item) {
        if (!llmPort.isAvailable()) {
            log.debug("[Reclassify] LLM unavailable, not classifying item {}", item.getId());
            return Optional.empty();
        }

        LlmRequest request = LlmRequest.builder()
                .tier(ModelTier.FAST)
                .systemPrompt(SYSTEM_PROMPT)
                .userPrompt(buildPrompt(item))
                .temperature(0.1)
                .maxTokens(200)
                .build();

        long timeoutMs = properties.getLlm().getTimeoutMs();
        try {
            LlmResponse response = llmPort.chat(request).get(timeoutMs, TimeUnit.MILLISECONDS);
            if (response == null || !response.hasContent()) {
                log.warn("[Reclassify] Empty classification for item {}", item.getId());
                return Optional.empty();
            }
            log.debug("[Reclassify] Raw response for item {}: {}", item.getId(), response.getContent());
            return parseVerdict(response.getContent());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Reclassify] Interrupted while classifying item {}", item.getId());
            return Optional.empty();
        } catch (TimeoutException e) {
            log.warn("[Reclassify] Classification of item {} timed out after {}ms", item.getId(), timeoutMs);
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Reclassify] Classification of item {} failed: {}", item.getId(), cause.getMessage());
            return Optional.empty();
        }
    }

    String buildPrompt(KnowledgeItem item) {
        String preview = item.getSummary() != null && !item.getSummary().isBlank()
                ? item.getSummary()
                : item.getContent();
        int previewLength = properties.getReclassification().getPreviewLength();
        return "Verify this knowledge item's categorization:\n\n"
                + "Title: " + item.getTitle() + "\n"
                + "Current Category: " + (item.getCategory() != null ? item.getCategory() : "none") + "\n"
                + "Content Preview: " + truncate(preview, previewLength) + "\n\n"
                + "Valid categories: " + String.join(", ", CATEGORIES) + "\n\n"
                + "Is this correctly categorized? Respond with JSON only.";
    }

    Optional<CategoryVerdict> parseVerdict(String response) {
        try {
            JsonNode node = objectMapper.readTree(extractJson(response));
            if (node == null || !node.isObject()) {
                log.warn("[Reclassify] Classification is not a JSON object");
                return Optional.empty();
            }

            boolean needsChange;
            String category;
            if (node.has("needsChange")) {
                needsChange = node.get("needsChange").asBoolean(false);
                category = textOrNull(node, "category");
            } else if (node.has("correct")) {
                needsChange = !node.get("correct").asBoolean(true);
                category = textOrNull(node, "suggested_category");
            } else {
                log.warn("[Reclassify] Classification has neither needsChange nor correct");
                return Optional.empty();
            }

            return Optional.of(new CategoryVerdict(
                    needsChange,
                    category != null ? category.trim().toLowerCase(Locale.ROOT) : null,
                    textOrNull(node, "subcategory"),
                    textOrNull(node, "reason")));
        } catch (JsonProcessingException e) {
            log.warn("[Reclassify] Failed to parse classification: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private String extractJson(String response) {
        Matcher fenced = FENCED_JSON_PATTERN.matcher(response);
        if (fenced.find()) {
            return fenced.group(1);
        }
        Matcher raw = RAW_JSON_PATTERN.matcher(response);
        if (raw.find()) {
            return raw.group(1);
        }
        return response.trim();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLen ? text : text.substring(0, maxLen);
    }
}
