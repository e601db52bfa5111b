package me.golemcore.chronicle.adapter.outbound.persistence;

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
import me.golemcore.chronicle.port.outbound.KnowledgePort;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaKnowledgeAdapter implements KnowledgePort {

    private final KnowledgeItemRepository repository;

    @Override
    public Optional<KnowledgeItem> findById(Long id) {
        return repository.findById(id);
    }

    @Override
    public KnowledgeItem save(KnowledgeItem item) {
        return repository.save(item);
    }

    @Override
    public List<KnowledgeItem> findUncaptured(int limit) {
        return repository.findByCapturedAtIsNullOrderByUpdatedAtAscIdAsc(PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    public List<KnowledgeItem> findReclassificationCandidates(String cataloger, Instant since, int limit) {
        return repository.findReclassificationCandidates(cataloger, since, PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    public List<KnowledgeItem> findMostRecent(int limit) {
        return repository.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    public void markCaptured(Long id, Instant at) {
        repository.markCaptured(id, at);
    }

    @Override
    public void updateClassification(Long id, String category, String cataloger, Instant at) {
        repository.updateClassification(id, category, cataloger, at);
    }

    @Override
    public void stampCataloger(Long id, String cataloger) {
        repository.stampCataloger(id, cataloger);
    }

    @Override
    public void updateProjectPath(Long id, String projectPath, Instant at) {
        repository.updateProjectPath(id, projectPath, at);
    }

    @Override
    public boolean deleteById(Long id) {
        if (!repository.existsById(id)) {
            return false;
        }
        repository.deleteById(id);
        return true;
    }
}
