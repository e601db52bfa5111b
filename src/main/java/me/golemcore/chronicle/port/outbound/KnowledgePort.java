package me.golemcore.chronicle.port.outbound;

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

import me.golemcore.chronicle.domain.model.KnowledgeItem;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface KnowledgePort {

    Optional<KnowledgeItem> findById(Long id);

    KnowledgeItem save(KnowledgeItem item);

    /**
     * Knowledge items never captured into a snippet, least recently updated
     * first.
     */
    List<KnowledgeItem> findUncaptured(int limit);

    /**
     * Items not yet reviewed by {@code cataloger}: never catalogued at all, or
     * catalogued by someone else and updated at or after {@code since}.
     */
    List<KnowledgeItem> findReclassificationCandidates(String cataloger, Instant since, int limit);

    /**
     * Newest items first, ties broken by id descending.
     */
    List<KnowledgeItem> findMostRecent(int limit);

    void markCaptured(Long id, Instant at);

    void updateClassification(Long id, String category, String cataloger, Instant at);

    void stampCataloger(Long id, String cataloger);

    void updateProjectPath(Long id, String projectPath, Instant at);

    boolean deleteById(Long id);
}
