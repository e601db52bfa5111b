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

import me.golemcore.chronicle.domain.model.CompilationResult;
import me.golemcore.chronicle.domain.model.EntryType;
import me.golemcore.chronicle.domain.model.GeneratedDocument;
import me.golemcore.chronicle.domain.model.JournalEntry;
import me.golemcore.chronicle.domain.model.Project;
import me.golemcore.chronicle.domain.model.ProjectCompilation;
import me.golemcore.chronicle.domain.model.Snippet;
import me.golemcore.chronicle.infrastructure.config.ChronicleProperties;
import me.golemcore.chronicle.port.outbound.DocumentPort;
import me.golemcore.chronicle.port.outbound.JournalPort;
import me.golemcore.chronicle.port.outbound.ProjectPort;
import me.golemcore.chronicle.port.outbound.SnippetPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Nightly compilation of each project's pending journal entries into one
 * generated document per non-empty category.
 *
 * <p>
 * Sources are archived, never deleted. Every consumed journal entry points at
 * the first document created for its project in the run; snippets point at
 * the work-log document that absorbed them. Entries written by the compiler
 * itself are excluded so published documents are not compiled again.
 * Pending means unarchived: in steady state that is the last day's entries,
 * and material left behind by a failed category is carried into the next run.
 */
@Service
@Slf4j
public class CompilationService {

    private static final DateTimeFormatter DATE_LABEL = DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.US);
    private static final DateTimeFormatter TIME_LABEL = DateTimeFormatter.ofPattern("HH:mm", Locale.US);

    private final ProjectPort projectPort;
    private final JournalPort journalPort;
    private final SnippetPort snippetPort;
    private final DocumentPort documentPort;
    private final DocumentSynthesizer synthesizer;
    private final ChronicleProperties properties;
    private final Clock clock;

    public CompilationService(ProjectPort projectPort, JournalPort journalPort, SnippetPort snippetPort,
            DocumentPort documentPort, DocumentSynthesizer synthesizer, ChronicleProperties properties,
            Clock clock) {
        this.projectPort = projectPort;
        this.journalPort = journalPort;
        this.snippetPort = snippetPort;
        this.documentPort = documentPort;
        this.synthesizer = synthesizer;
        this.properties = properties;
        this.clock = clock;
    }

    public CompilationResult compile() {
        Instant now = clock.instant();
        CompilationResult result = new CompilationResult();

        for (String projectPath : resolveProjects()) {
            try {
                ProjectCompilation compilation = compileProject(projectPath, now);
                if (compilation.getEntriesProcessed() > 0 || compilation.getSnippetsCompiled() > 0) {
                    result.getProjects().add(compilation);
                }
            } catch (RuntimeException e) {
                log.error("[Compiler] Failed to compile project {}: {}", projectPath, e.getMessage(), e);
                result.getProjects().add(ProjectCompilation.builder()
                        .projectPath(projectPath)
                        .error(e.getMessage())
                        .build());
            }
        }

        log.info("[Compiler] Compiled {} entr(ies) into {} document(s) across {} project(s)",
                result.totalEntries(), result.totalDocuments(), result.getProjects().size());
        return result;
    }

    /**
     * Compile one project. Categories are walked in {@link EntryType} order;
     * a category that fails to persist leaves its material unarchived.
     */
    public ProjectCompilation compileProject(String projectPath, Instant now) {
        String creator = properties.getCompilation().getCreator();
        List<JournalEntry> entries = journalPort.findCompilationCandidates(projectPath, creator);
        List<Snippet> snippets = snippetPort.findUncompiled(projectPath);

        ProjectCompilation compilation = ProjectCompilation.builder()
                .projectPath(projectPath)
                .build();
        if (entries.isEmpty() && snippets.isEmpty()) {
            return compilation;
        }

        String projectName = projectName(projectPath);
        String dateLabel = DATE_LABEL.format(now.atZone(zone()));
        List<Long> archivedIds = new ArrayList<>();
        List<Long> compiledSnippetIds = new ArrayList<>();
        Long anchorId = null;
        Long workLogDocumentId = null;
        int docsCreated = 0;

        for (EntryType category : EntryType.values()) {
            List<JournalEntry> material = entries.stream()
                    .filter(e -> e.getEntryType() == category)
                    .toList();
            List<Snippet> categorySnippets = category == EntryType.WORK_LOG ? snippets : List.of();
            if (material.isEmpty() && categorySnippets.isEmpty()) {
                continue;
            }

            try {
                String rendered = render(material, categorySnippets);
                String content = synthesizer.synthesize(projectName, category, dateLabel, rendered)
                        .orElse(rendered);
                GeneratedDocument document = documentPort.save(GeneratedDocument.builder()
                        .projectPath(projectPath)
                        .docType(category)
                        .title(category.getLabel() + " - " + dateLabel)
                        .content(content)
                        .generatedAt(now)
                        .sourceIds(new ArrayList<>(material.stream().map(JournalEntry::getId).toList()))
                        .snippetIds(new ArrayList<>(categorySnippets.stream().map(Snippet::getId).toList()))
                        .published(false)
                        .createdBy(creator)
                        .build());

                docsCreated++;
                if (anchorId == null) {
                    anchorId = document.getId();
                }
                material.forEach(e -> archivedIds.add(e.getId()));
                if (!categorySnippets.isEmpty()) {
                    categorySnippets.forEach(s -> compiledSnippetIds.add(s.getId()));
                    workLogDocumentId = document.getId();
                }
            } catch (RuntimeException e) {
                log.warn("[Compiler] Failed to compile {} for {}: {}", category, projectPath, e.getMessage());
            }
        }

        if (anchorId != null && !archivedIds.isEmpty()) {
            journalPort.archive(archivedIds, anchorId, now);
        }
        if (workLogDocumentId != null) {
            snippetPort.markCompiled(compiledSnippetIds, workLogDocumentId, now);
        }

        compilation.setEntriesProcessed(archivedIds.size());
        compilation.setSnippetsCompiled(compiledSnippetIds.size());
        compilation.setDocsCreated(docsCreated);
        compilation.setAnchorDocumentId(anchorId);
        log.info("[Compiler] {}: {} entr(ies), {} snippet(s) -> {} document(s)", projectName,
                archivedIds.size(), compiledSnippetIds.size(), docsCreated);
        return compilation;
    }

    /**
     * Render material as {@code ### HH:mm - title} blocks in chronological
     * order.
     */
    String render(List<JournalEntry> entries, List<Snippet> snippets) {
        List<RenderedBlock> blocks = new ArrayList<>();
        for (JournalEntry entry : entries) {
            blocks.add(new RenderedBlock(entry.getCreatedAt(), entry.getTitle(), entry.getContent()));
        }
        for (Snippet snippet : snippets) {
            blocks.add(new RenderedBlock(snippet.getCreatedAt(), snippet.getContent(), snippet.getContext()));
        }
        blocks.sort(Comparator.comparing(RenderedBlock::at, Comparator.nullsFirst(Comparator.naturalOrder())));

        StringBuilder sb = new StringBuilder();
        for (RenderedBlock block : blocks) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            String time = block.at() != null ? TIME_LABEL.format(block.at().atZone(zone())) : "--:--";
            sb.append("### ").append(time).append(" - ").append(block.title()).append('\n');
            if (block.body() != null && !block.body().isBlank()) {
                sb.append(block.body()).append('\n');
            }
        }
        return sb.toString();
    }

    private List<String> resolveProjects() {
        List<Project> active = projectPort.findActiveProjects();
        if (!active.isEmpty()) {
            Set<String> paths = new LinkedHashSet<>();
            active.forEach(p -> paths.add(p.resolvePath()));
            return List.copyOf(paths);
        }
        Set<String> paths = new TreeSet<>();
        paths.addAll(journalPort.findProjectPathsWithPendingEntries(properties.getCompilation().getCreator()));
        paths.addAll(snippetPort.findProjectPathsWithUncompiled());
        return List.copyOf(paths);
    }

    private ZoneId zone() {
        return ZoneId.of(properties.getScheduler().getZone());
    }

    static String projectName(String projectPath) {
        String trimmed = projectPath.endsWith("/") ? projectPath.substring(0, projectPath.length() - 1) : projectPath;
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 && slash < trimmed.length() - 1 ? trimmed.substring(slash + 1) : trimmed;
    }

    private record RenderedBlock(Instant at, String title, String body) {
    }
}
