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
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A fact about a project. Reclassification rewrites {@code category} and
 * stamps {@code cataloger}; capture sets {@code capturedAt} once.
 */
@Entity
@Table(name = "knowledge_items", indexes = {
        @Index(name = "idx_knowledge_project", columnList = "project_path"),
        @Index(name = "idx_knowledge_created", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_path", length = 1000)
    private String projectPath;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "summary", length = 2000)
    private String summary;

    @Lob
    @Column(name = "content")
    private String content;

    @Column(name = "category", length = 50)
    private String category;

    /**
     * Identity of the automated pass that last validated {@link #category}.
     */
    @Column(name = "cataloger", length = 100)
    private String cataloger;

    /**
     * Session or conversation the fact was discovered in.
     */
    @Column(name = "source", length = 200)
    private String source;

    @Column(name = "captured_at")
    private Instant capturedAt;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }
}
