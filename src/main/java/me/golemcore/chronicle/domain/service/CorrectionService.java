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

import me.golemcore.chronicle.domain.model.CorrectionItemType;
import me.golemcore.chronicle.domain.model.CorrectionRecord;
import me.golemcore.chronicle.domain.model.CorrectionResolution;
import me.golemcore.chronicle.domain.model.CorrectionStatus;
import me.golemcore.chronicle.domain.model.CorrectionType;
import me.golemcore.chronicle.infrastructure.config.ChronicleProperties;
import me.golemcore.chronicle.port.outbound.CorrectionPort;
import me.golemcore.chronicle.port.outbound.DocumentPort;
import me.golemcore.chronicle.port.outbound.JournalPort;
import me.golemcore.chronicle.port.outbound.KnowledgePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * Review tasks against knowledge items, journal entries and generated
 * documents.
 *
 * <p>
 * Applying resolves a pending correction by type: REMOVE deletes the target,
 * MOVE reassigns its project, NOTE is acknowledged. REWORD and MERGE need a
 * human and end up REVIEWED, as does any correction whose target cannot be
 * resolved.
 */
@Service
@Slf4j
public class CorrectionService {

    private static final String TARGET_PROJECT = "target_project";

    private final CorrectionPort correctionPort;
    private final KnowledgePort knowledgePort;
    private final JournalPort journalPort;
    private final DocumentPort documentPort;
    private final ChronicleProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CorrectionService(CorrectionPort correctionPort, KnowledgePort knowledgePort, JournalPort journalPort,
            DocumentPort documentPort, ChronicleProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.correctionPort = correctionPort;
        this.knowledgePort = knowledgePort;
        this.journalPort = journalPort;
        this.documentPort = documentPort;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException
     *             if a type or the item id is missing
     */
    public CorrectionRecord create(CorrectionItemType itemType, Long itemId, CorrectionType correctionType,
            Map<String, Object> details, String createdBy) {
        if (itemType == null) {
            throw new IllegalArgumentException("item type is required");
        }
        if (correctionType == null) {
            throw new IllegalArgumentException("correction type is required");
        }
        if (itemId == null) {
            throw new IllegalArgumentException("item id is required");
        }
        CorrectionRecord saved = correctionPort.save(CorrectionRecord.builder()
                .itemType(itemType)
                .itemId(itemId)
                .correctionType(correctionType)
                .status(CorrectionStatus.PENDING)
                .details(writeDetails(details != null ? details : Map.of()))
                .createdBy(createdBy != null && !createdBy.isBlank() ? createdBy : "user")
                .createdAt(clock.instant())
                .build());
        log.info("[Corrections] New {} correction for {}:{}", correctionType, itemType, itemId);
        return saved;
    }

    public List<CorrectionRecord> listPending() {
        return correctionPort.findByStatus(CorrectionStatus.PENDING);
    }

    /**
     * @throws IllegalArgumentException
     *             if the correction does not exist or is no longer pending
     */
    public CorrectionResolution apply(Long correctionId) {
        CorrectionRecord correction = loadPending(correctionId);

        Resolution resolution = switch (correction.getCorrectionType()) {
        case REMOVE -> applyRemove(correction);
        case MOVE -> applyMove(correction);
        case NOTE -> new Resolution(true, "Note acknowledged");
        case REWORD -> new Resolution(false, "Reword corrections require manual review");
        case MERGE -> new Resolution(false, "Merge corrections require manual review");
        };

        Instant now = clock.instant();
        CorrectionStatus status = resolution.applied() ? CorrectionStatus.APPLIED : CorrectionStatus.REVIEWED;
        correction.setStatus(status);
        correction.setAppliedBy(properties.getCorrections().getActor());
        correction.setAppliedAt(resolution.applied() ? now : null);
        correctionPort.save(correction);

        log.info("[Corrections] {} correction {} -> {}: {}", correction.getCorrectionType(), correctionId, status,
                resolution.message());
        return new CorrectionResolution(correctionId, status, resolution.message());
    }

    /**
     * @throws IllegalArgumentException
     *             if the correction does not exist or is no longer pending
     */
    public CorrectionRecord reject(Long correctionId) {
        CorrectionRecord correction = loadPending(correctionId);
        correction.setStatus(CorrectionStatus.REJECTED);
        correction.setAppliedBy(properties.getCorrections().getActor());
        CorrectionRecord saved = correctionPort.save(correction);
        log.info("[Corrections] Rejected correction {}", correctionId);
        return saved;
    }

    /**
     * Delete applied and rejected corrections older than the retention period.
     *
     * @return number of corrections removed
     */
    public int purgeResolved() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getCorrections().getRetentionDays()));
        int deleted = correctionPort.deleteResolvedBefore(
                EnumSet.of(CorrectionStatus.APPLIED, CorrectionStatus.REJECTED), cutoff);
        log.info("[Corrections] Purged {} resolved correction(s) created before {}", deleted, cutoff);
        return deleted;
    }

    private CorrectionRecord loadPending(Long correctionId) {
        CorrectionRecord correction = correctionPort.findById(correctionId)
                .orElseThrow(() -> new IllegalArgumentException("Correction not found: " + correctionId));
        if (correction.getStatus() != CorrectionStatus.PENDING) {
            throw new IllegalArgumentException(
                    "Correction " + correctionId + " is not pending: " + correction.getStatus());
        }
        return correction;
    }

    private Resolution applyRemove(CorrectionRecord correction) {
        Long itemId = correction.getItemId();
        boolean removed = switch (correction.getItemType()) {
        case KNOWLEDGE -> knowledgePort.deleteById(itemId);
        case JOURNAL -> journalPort.deleteById(itemId);
        case DOC -> documentPort.deleteById(itemId);
        };
        if (!removed) {
            return new Resolution(false, "Target " + correction.getItemType() + ":" + itemId + " not found");
        }
        return new Resolution(true, "Removed " + correction.getItemType() + " item");
    }

    private Resolution applyMove(CorrectionRecord correction) {
        String targetProject = readTargetProject(correction.getDetails());
        if (targetProject == null) {
            return new Resolution(false, "No target_project specified");
        }
        Long itemId = correction.getItemId();
        switch (correction.getItemType()) {
        case KNOWLEDGE -> knowledgePort.updateProjectPath(itemId, targetProject, clock.instant());
        case JOURNAL -> journalPort.updateProjectPath(itemId, targetProject);
        case DOC -> documentPort.updateProjectPath(itemId, targetProject);
        default -> throw new IllegalStateException("Unexpected item type: " + correction.getItemType());
        }
        return new Resolution(true, "Moved to " + targetProject);
    }

    private String readTargetProject(String details) {
        if (details == null || details.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(details);
            JsonNode target = node != null ? node.get(TARGET_PROJECT) : null;
            if (target == null || target.isNull() || target.asText().isBlank()) {
                return null;
            }
            return target.asText();
        } catch (JsonProcessingException e) {
            log.warn("[Corrections] Malformed correction details: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String writeDetails(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Correction details are not serializable", e);
        }
    }

    private record Resolution(boolean applied, String message) {
    }
}
