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

import me.golemcore.chronicle.domain.model.CorrectionItemType;
import me.golemcore.chronicle.domain.model.CorrectionRecord;
import me.golemcore.chronicle.domain.model.CorrectionStatus;
import me.golemcore.chronicle.domain.model.CorrectionType;
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
public interface CorrectionRecordRepository extends JpaRepository<CorrectionRecord, Long> {

    List<CorrectionRecord> findByStatusOrderByCreatedAtAscIdAsc(CorrectionStatus status);

    List<CorrectionRecord> findByItemTypeAndCorrectionTypeAndStatusOrderByIdAsc(CorrectionItemType itemType,
            CorrectionType correctionType, CorrectionStatus status);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("DELETE FROM CorrectionRecord c WHERE c.status IN :statuses AND c.createdAt < :cutoff")
    int deleteResolvedBefore(@Param("statuses") Collection<CorrectionStatus> statuses,
            @Param("cutoff") Instant cutoff);
}
