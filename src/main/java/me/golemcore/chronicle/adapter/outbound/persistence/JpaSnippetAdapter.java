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

import me.golemcore.chronicle.domain.model.Snippet;
import me.golemcore.chronicle.port.outbound.SnippetPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Component
@RequiredArgsConstructor
public class JpaSnippetAdapter implements SnippetPort {

    private final SnippetRepository repository;

    @Override
    public boolean existsByProjectPathAndContentAndSnippetDate(String projectPath, String content,
            LocalDate snippetDate) {
        return repository.existsByProjectPathAndContentAndSnippetDate(projectPath, content, snippetDate);
    }

    @Override
    public Snippet save(Snippet snippet) {
        return repository.save(snippet);
    }

    @Override
    public List<Snippet> findUncompiled(String projectPath) {
        return repository.findByProjectPathAndCompiledFalseOrderByCreatedAtAscIdAsc(projectPath);
    }

    @Override
    public List<String> findProjectPathsWithUncompiled() {
        return repository.findProjectPathsWithUncompiled();
    }

    @Override
    public int markCompiled(Collection<Long> ids, Long documentId, Instant at) {
        if (ids.isEmpty()) {
            return 0;
        }
        return repository.markCompiled(ids, documentId, at);
    }
}
