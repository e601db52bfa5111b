package me.golemcore.chronicle.domain.service;

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
import me.golemcore.chronicle.domain.model.JournalEntry;
import me.golemcore.chronicle.infrastructure.config.ChronicleProperties;
import me.golemcore.chronicle.port.outbound.DocumentPort;
import me.golemcore.chronicle.port.outbound.JournalPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Publishing of generated documents. A published document is mirrored into
 * the project journal under the compiler identity, which keeps it out of
 * later compilations.
 */
@Service
@Slf4j
public class GeneratedDocumentService {

    private final DocumentPort documentPort;
    private final JournalPort journalPort;
    private final ChronicleProperties properties;
    private final Clock clock;

    public GeneratedDocumentService(DocumentPort documentPort, JournalPort journalPort,
            ChronicleProperties properties, Clock clock) {
        this.documentPort = documentPort;
        this.journalPort = journalPort;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Publish a document. Publishing an already published document changes
     * nothing.
     *
     * @throws IllegalArgumentException
     *             if the document does not exist
     */
    public GeneratedDocument publish(Long documentId) {
        GeneratedDocument document = load(documentId);
        if (document.isPublished()) {
            return document;
        }

        journalPort.save(JournalEntry.builder()
                .projectPath(document.getProjectPath())
                .entryType(document.getDocType())
                .title(document.getTitle())
                .content(document.getContent() != null ? document.getContent() : "")
                .createdBy(properties.getCompilation().getCreator())
                .createdAt(clock.instant())
                .build());

        document.setPublished(true);
        GeneratedDocument saved = documentPort.save(document);
        log.info("[Compiler] Published document {} '{}'", documentId, document.getTitle());
        return saved;
    }

    /**
     * @throws IllegalArgumentException
     *             if the document does not exist
     */
    public GeneratedDocument unpublish(Long documentId) {
        GeneratedDocument document = load(documentId);
        if (!document.isPublished()) {
            return document;
        }
        document.setPublished(false);
        GeneratedDocument saved = documentPort.save(document);
        log.info("[Compiler] Unpublished document {}", documentId);
        return saved;
    }

    private GeneratedDocument load(Long documentId) {
        return documentPort.findById(documentId)
                .orElseThrow(() -> new IllegalArgumentException("Document not found: " + documentId));
    }
}
