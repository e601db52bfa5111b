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

import me.golemcore.chronicle.domain.model.GeneratedDocument;
import me.golemcore.chronicle.port.outbound.DocumentPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaDocumentAdapter implements DocumentPort {

    private final GeneratedDocumentRepository repository;

    @Override
    public GeneratedDocument save(GeneratedDocument document) {
        return repository.save(document);
    }

    @Override
    public Optional<GeneratedDocument> findById(Long id) {
        return repository.findById(id);
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
