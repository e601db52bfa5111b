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
import me.golemcore.chronicle.domain.model.CorrectionStatus;
import me.golemcore.chronicle.domain.model.CorrectionType;
import me.golemcore.chronicle.domain.model.DuplicateCluster;
import me.golemcore.chronicle.domain.model.DuplicateMatch;
import me.golemcore.chronicle.domain.model.DuplicateScanResult;
import me.golemcore.chronicle.domain.model.KnowledgeItem;
import me.golemcore.chronicle.infrastructure.config.ChronicleProperties;
import me.golemcore.chronicle.port.outbound.CorrectionPort;
import me.golemcore.chronicle.port.outbound.KnowledgePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Flags near-identical knowledge items for manual merge review. Items are
 * never modified; each cluster becomes one pending MERGE correction against
 * its primary. A cluster touching any item already named by a pending MERGE,
 * as primary or as duplicate, is not flagged again.
 *
 * <p>
 * Clustering is a single greedy pass over the newest items: each unassigned
 * item collects every later unassigned item of the same category whose title
 * similarity reaches the threshold. It is neither a transitive closure nor
 * globally optimal.
 */
@Service
@Slf4j
public class DuplicateDetectionService {

    private final KnowledgePort knowledgePort;
    private final CorrectionPort correctionPort;
    private final ChronicleProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DuplicateDetectionService(KnowledgePort knowledgePort, CorrectionPort correctionPort,
            ChronicleProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.knowledgePort = knowledgePort;
        this.correctionPort = correctionPort;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public DuplicateScanResult flagDuplicates() {
        ChronicleProperties.DedupProperties config = properties.getDedup();
        List<KnowledgeItem> items = knowledgePort.findMostRecent(config.getWindowSize());
        DuplicateScanResult result = new DuplicateScanResult();
        result.setScanned(items.size());
        if (items.size() < 2) {
            return result;
        }

        Set<Long> flagged = pendingMergeItemIds();
        for (DuplicateCluster cluster : findClusters(items, config.getThreshold())) {
            Long primaryId = cluster.primary().getId();
            List<Long> memberIds = memberIds(cluster);
            if (memberIds.stream().anyMatch(flagged::contains)) {
                result.setAlreadyFlagged(result.getAlreadyFlagged() + 1);
                continue;
            }
            correctionPort.save(CorrectionRecord.builder()
                    .itemType(CorrectionItemType.KNOWLEDGE)
                    .itemId(primaryId)
                    .correctionType(CorrectionType.MERGE)
                    .status(CorrectionStatus.PENDING)
                    .details(toDetails(cluster))
                    .createdBy(config.getCreator())
                    .createdAt(clock.instant())
                    .build());
            flagged.addAll(memberIds);
            result.setClusters(result.getClusters() + 1);
            result.setDuplicates(result.getDuplicates() + cluster.duplicates().size());
        }

        if (result.getClusters() > 0) {
            log.info("[Dedup] Flagged {} cluster(s) covering {} duplicate(s) among {} item(s)",
                    result.getClusters(), result.getDuplicates(), result.getScanned());
        }
        return result;
    }

    /**
     * Greedy clustering of {@code items} in the given order.
     */
    public static List<DuplicateCluster> findClusters(List<KnowledgeItem> items, double threshold) {
        List<DuplicateCluster> clusters = new ArrayList<>();
        Set<Long> assigned = new HashSet<>();

        for (int i = 0; i < items.size(); i++) {
            KnowledgeItem primary = items.get(i);
            if (assigned.contains(primary.getId())) {
                continue;
            }
            List<DuplicateMatch> matches = new ArrayList<>();
            for (int j = i + 1; j < items.size(); j++) {
                KnowledgeItem other = items.get(j);
                if (assigned.contains(other.getId()) || !Objects.equals(primary.getCategory(), other.getCategory())) {
                    continue;
                }
                double similarity = JaccardSimilarity.similarity(primary.getTitle(), other.getTitle());
                if (similarity >= threshold) {
                    matches.add(new DuplicateMatch(other.getId(), other.getTitle(), similarity));
                    assigned.add(other.getId());
                }
            }
            if (!matches.isEmpty()) {
                assigned.add(primary.getId());
                clusters.add(new DuplicateCluster(primary, List.copyOf(matches)));
            }
        }
        return clusters;
    }

    /**
     * Ids already under review: the primary of every pending MERGE plus the
     * duplicates listed in its details.
     */
    private Set<Long> pendingMergeItemIds() {
        Set<Long> ids = new HashSet<>();
        for (CorrectionRecord pending : correctionPort.findPending(CorrectionItemType.KNOWLEDGE,
                CorrectionType.MERGE)) {
            ids.add(pending.getItemId());
            if (pending.getDetails() == null || pending.getDetails().isBlank()) {
                continue;
            }
            try {
                JsonNode duplicates = objectMapper.readTree(pending.getDetails()).path("duplicates");
                for (JsonNode duplicate : duplicates) {
                    if (duplicate.hasNonNull("id")) {
                        ids.add(duplicate.get("id").asLong());
                    }
                }
            } catch (JsonProcessingException e) {
                log.warn("[Dedup] Unreadable details on correction {}: {}", pending.getId(), e.getMessage());
            }
        }
        return ids;
    }

    private static List<Long> memberIds(DuplicateCluster cluster) {
        List<Long> ids = new ArrayList<>();
        ids.add(cluster.primary().getId());
        cluster.duplicates().forEach(match -> ids.add(match.id()));
        return ids;
    }

    private String toDetails(DuplicateCluster cluster) {
        List<Map<String, Object>> duplicates = new ArrayList<>();
        for (DuplicateMatch match : cluster.duplicates()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", match.id());
            entry.put("title", match.title());
            entry.put("similarity", match.similarity());
            duplicates.add(entry);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("primary_title", cluster.primary().getTitle());
        details.put("duplicates", duplicates);
        details.put("auto_detected", true);
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize merge details", e);
        }
    }
}
