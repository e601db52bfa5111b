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
import me.golemcore.chronicle.domain.model.ItemOutcome;
import me.golemcore.chronicle.domain.model.ItemResult;
import me.golemcore.chronicle.domain.model.KnowledgeItem;
import me.golemcore.chronicle.domain.model.ReclassificationResult;
import me.golemcore.chronicle.infrastructure.config.ChronicleProperties;
import me.golemcore.chronicle.port.outbound.KnowledgePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Re-validates knowledge categories. Every reviewed item is stamped with this
 * pass's cataloger identity, so an item is reviewed at most once until someone
 * else touches it.
 */
@Service
@Slf4j
public class ReclassificationService {

    private final KnowledgePort knowledgePort;
    private final CategoryClassifier classifier;
    private final ChronicleProperties properties;
    private final Clock clock;

    public ReclassificationService(KnowledgePort knowledgePort, CategoryClassifier classifier,
            ChronicleProperties properties, Clock clock) {
        this.knowledgePort = knowledgePort;
        this.classifier = classifier;
        this.properties = properties;
        this.clock = clock;
    }

    public ReclassificationResult reclassify() {
        ChronicleProperties.ReclassificationProperties config = properties.getReclassification();
        Instant since = clock.instant().minus(Duration.ofMinutes(config.getWindowMinutes()));

        List<KnowledgeItem> candidates = knowledgePort.findReclassificationCandidates(
                config.getCataloger(), since, config.getBatchLimit());
        ReclassificationResult result = new ReclassificationResult();
        result.setCandidates(candidates.size());

        for (KnowledgeItem item : candidates) {
            if (config.getCataloger().equals(item.getCataloger())) {
                continue;
            }
            ItemResult itemResult = review(item);
            switch (itemResult.outcome()) {
            case APPLIED -> {
                result.setReviewed(result.getReviewed() + 1);
                if (itemResult.reason() != null) {
                    result.setRecategorized(result.getRecategorized() + 1);
                }
            }
            case SKIPPED -> {
                result.setReviewed(result.getReviewed() + 1);
                result.setRejected(result.getRejected() + 1);
            }
            case RETRY -> result.setRetries(result.getRetries() + 1);
            default -> throw new IllegalStateException("Unexpected outcome: " + itemResult.outcome());
            }
        }

        if (!candidates.isEmpty()) {
            log.info("[Reclassify] Reviewed {}/{} item(s), recategorized {}, rejected {}, retry {}",
                    result.getReviewed(), result.getCandidates(), result.getRecategorized(), result.getRejected(),
                    result.getRetries());
        }
        return result;
    }

    /**
     * Review one item. An applied result carries the new category as its reason
     * when the category changed, and no reason when only the stamp was written.
     */
    public ItemResult review(KnowledgeItem item) {
        String cataloger = properties.getReclassification().getCataloger();
        if (cataloger.equals(item.getCataloger())) {
            return ItemResult.skipped(item.getId(), "already reviewed");
        }

        Optional<CategoryVerdict> verdict = classifier.classify(item);
        if (verdict.isEmpty()) {
            return ItemResult.retry(item.getId(), "no classification");
        }

        CategoryVerdict answer = verdict.get();
        try {
            if (!answer.needsChange() || answer.category() == null
                    || answer.category().equalsIgnoreCase(item.getCategory())) {
                knowledgePort.stampCataloger(item.getId(), cataloger);
                return ItemResult.applied(item.getId());
            }
            if (!CategoryClassifier.isKnownCategory(answer.category())) {
                log.warn("[Reclassify] Rejected unknown category '{}' for item {}", answer.category(), item.getId());
                knowledgePort.stampCataloger(item.getId(), cataloger);
                return ItemResult.skipped(item.getId(), "unknown category: " + answer.category());
            }
            knowledgePort.updateClassification(item.getId(), answer.category(), cataloger, clock.instant());
            log.info("[Reclassify] Recategorized '{}': {} -> {}", item.getTitle(), item.getCategory(),
                    answer.category());
            return new ItemResult(item.getId(), ItemOutcome.APPLIED,
                    answer.category());
        } catch (RuntimeException e) {
            log.warn("[Reclassify] Failed to update item {}: {}", item.getId(), e.getMessage());
            return ItemResult.retry(item.getId(), e.getMessage());
        }
    }
}
