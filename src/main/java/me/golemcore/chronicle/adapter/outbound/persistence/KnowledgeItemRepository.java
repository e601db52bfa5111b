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
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface KnowledgeItemRepository extends JpaRepository<KnowledgeItem, Long> {

    List<KnowledgeItem> findByCapturedAtIsNullOrderByUpdatedAtAscIdAsc(Pageable pageable);

    /**
     * Never catalogued, or catalogued by someone else and touched recently.
     */
    @Query("SELECT k FROM KnowledgeItem k WHERE k.cataloger IS NULL "
            + "OR (k.cataloger <> :cataloger AND k.updatedAt >= :since) "
            + "ORDER BY k.updatedAt DESC, k.id DESC")
    List<KnowledgeItem> findReclassificationCandidates(@Param("cataloger") String cataloger,
            @Param("since") Instant since, Pageable pageable);

    List<KnowledgeItem> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE KnowledgeItem k SET k.capturedAt = :at WHERE k.id = :id")
    int markCaptured(@Param("id") Long id, @Param("at") Instant at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE KnowledgeItem k SET k.category = :category, k.cataloger = :cataloger, k.updatedAt = :at "
            + "WHERE k.id = :id")
    int updateClassification(@Param("id") Long id, @Param("category") String category,
            @Param("cataloger") String cataloger, @Param("at") Instant at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE KnowledgeItem k SET k.cataloger = :cataloger WHERE k.id = :id")
    int stampCataloger(@Param("id") Long id, @Param("cataloger") String cataloger);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE KnowledgeItem k SET k.projectPath = :projectPath, k.updatedAt = :at WHERE k.id = :id")
    int updateProjectPath(@Param("id") Long id, @Param("projectPath") String projectPath, @Param("at") Instant at);
}
