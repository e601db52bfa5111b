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

import me.golemcore.chronicle.domain.model.JournalEntry;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface JournalPort {

    Optional<JournalEntry> findById(Long id);

    JournalEntry save(JournalEntry entry);

    /**
     * Unarchived entries of a project whose author is not
     * {@code excludedCreator}, oldest first. Archiving is the only gate, so
     * entries left over from a failed run are picked up again.
     */
    List<JournalEntry> findCompilationCandidates(String projectPath, String excludedCreator);

    List<String> findProjectPathsWithPendingEntries(String excludedCreator);

    int archive(Collection<Long> ids, Long documentId, Instant at);

    void updateProjectPath(Long id, String projectPath);

    boolean deleteById(Long id);
}
