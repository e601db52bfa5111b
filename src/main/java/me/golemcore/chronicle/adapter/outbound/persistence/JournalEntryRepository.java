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
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntry, Long> {

    @Query("SELECT j FROM JournalEntry j WHERE j.projectPath = :projectPath AND j.archived = false "
            + "AND (j.createdBy IS NULL OR j.createdBy <> :excluded) "
            + "ORDER BY j.createdAt ASC, j.id ASC")
    List<JournalEntry> findCompilationCandidates(@Param("projectPath") String projectPath,
            @Param("excluded") String excludedCreator);

    @Query("SELECT DISTINCT j.projectPath FROM JournalEntry j WHERE j.archived = false "
            + "AND (j.createdBy IS NULL OR j.createdBy <> :excluded)")
    List<String> findProjectPathsWithPendingEntries(@Param("excluded") String excludedCreator);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE JournalEntry j SET j.archived = true, j.archivedAt = :at, j.archivedInto = :documentId "
            + "WHERE j.id IN :ids")
    int archive(@Param("ids") Collection<Long> ids, @Param("documentId") Long documentId, @Param("at") Instant at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE JournalEntry j SET j.projectPath = :projectPath WHERE j.id = :id")
    int updateProjectPath(@Param("id") Long id, @Param("projectPath") String projectPath);
}
