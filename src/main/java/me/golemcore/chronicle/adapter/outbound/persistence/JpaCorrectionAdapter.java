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
import me.golemcore.chronicle.port.outbound.CorrectionPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaCorrectionAdapter implements CorrectionPort {

    private final CorrectionRecordRepository repository;

    @Override
    public CorrectionRecord save(CorrectionRecord correction) {
        return repository.save(correction);
    }

    @Override
    public Optional<CorrectionRecord> findById(Long id) {
        return repository.findById(id);
    }

    @Override
    public List<CorrectionRecord> findByStatus(CorrectionStatus status) {
        return repository.findByStatusOrderByCreatedAtAscIdAsc(status);
    }

    @Override
    public List<CorrectionRecord> findPending(CorrectionItemType itemType, CorrectionType correctionType) {
        return repository.findByItemTypeAndCorrectionTypeAndStatusOrderByIdAsc(itemType, correctionType,
                CorrectionStatus.PENDING);
    }

    @Override
    public int deleteResolvedBefore(Collection<CorrectionStatus> statuses, Instant cutoff) {
        return repository.deleteResolvedBefore(statuses, cutoff);
    }
}
