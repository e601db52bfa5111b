package me.golemcore.chronicle.domain.model;

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

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Dated excerpt derived from exactly one source record, waiting to be absorbed
 * by the nightly compilation.
 */
@Entity
@Table(name = "snippets", indexes = {
        @Index(name = "idx_snippets_project_date", columnList = "project_path, snippet_date"),
        @Index(name = "idx_snippets_compiled_into", columnList = "compiled_into")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Snippet {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_path", nullable = false, length = 1000)
    private String projectPath;

    @Enumerated(EnumType.STRING)
    @Column(name = "snippet_type", nullable = false, length = 30)
    private SnippetType snippetType;

    @Column(name = "content", nullable = false, length = 4000)
    private String content;

    @Column(name = "context", length = 4000)
    private String context;

    @Column(name = "session_id", length = 200)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", length = 20)
    private SnippetSource sourceType;

    @Column(name = "source_id")
    private Long sourceId;

    @Builder.Default
    @Column(name = "compiled", nullable = false)
    private boolean compiled = false;

    /**
     * Generated document that absorbed this snippet.
     */
    @Column(name = "compiled_into")
    private Long compiledInto;

    @Column(name = "compiled_at")
    private Instant compiledAt;

    @Column(name = "snippet_date", nullable = false)
    private LocalDate snippetDate;

    @Column(name = "created_at")
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
