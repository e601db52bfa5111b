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

import me.golemcore.chronicle.domain.model.JournalEntry;
import me.golemcore.chronicle.port.outbound.JournalPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaJournalAdapter implements JournalPort {

    private final JournalEntryRepository repository;

    @Override
    public Optional<JournalEntry> findById(Long id) {
        return repository.findById(id);
    }

    @Override
    public JournalEntry save(JournalEntry entry) {
        return repository.save(entry);
    }

    @Override
    public List<JournalEntry> findCompilationCandidates(String projectPath, String excludedCreator) {
        return repository.findCompilationCandidates(projectPath, excludedCreator);
    }

    @Override
    public List<String> findProjectPathsWithPendingEntries(String excludedCreator) {
        return repository.findProjectPathsWithPendingEntries(excludedCreator);
    }

    @Override
    public int archive(Collection<Long> ids, Long documentId, Instant at) {
        if (ids.isEmpty()) {
            return 0;
        }
        return repository.archive(ids, documentId, at);
    }

    @Override
    public void updateProjectPath(Long id, String projectPath) {
        repository.updateProjectPath(id, projectPath);
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
