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

import me.golemcore.chronicle.domain.model.BugReport;
import me.golemcore.chronicle.domain.model.CaptureResult;
import me.golemcore.chronicle.domain.model.ItemResult;
import me.golemcore.chronicle.domain.model.KnowledgeItem;
import me.golemcore.chronicle.domain.model.Snippet;
import me.golemcore.chronicle.domain.model.SnippetSource;
import me.golemcore.chronicle.domain.model.SnippetType;
import me.golemcore.chronicle.domain.model.TodoItem;
import me.golemcore.chronicle.infrastructure.config.ChronicleProperties;
import me.golemcore.chronicle.port.outbound.KnowledgePort;
import me.golemcore.chronicle.port.outbound.SnippetPort;
import me.golemcore.chronicle.port.outbound.WorkItemPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns freshly written knowledge items, completed todos and fixed bugs into
 * dated snippets, exactly once per source record.
 *
 * <p>
 * The capture stamp is the only eligibility gate: a source stays a candidate
 * until it is marked, however long ago it was written. The snippet is
 * inserted before the source is marked captured. If marking fails the next
 * pass finds the same-day snippet and only marks the source; if the insert
 * fails the source stays eligible and is retried on the next firing.
 */
@Service
@Slf4j
public class SnippetCaptureService {

    private static final int MAX_CONTENT_LENGTH = 4000;
    private static final String TODO_PREFIX = "COMPLETED: ";
    private static final String BUG_PREFIX = "BUG FIXED: ";

    private static final Map<String, SnippetType> KNOWLEDGE_TYPES = Map.of(
            "bug-fix", SnippetType.BUG_FIX,
            "feature", SnippetType.FEATURE,
            "config", SnippetType.CONFIG,
            "architecture", SnippetType.DISCUSSION,
            "workflow", SnippetType.DISCUSSION,
            "documentation", SnippetType.DISCUSSION,
            "refactor", SnippetType.CODE_CHANGE,
            "idea", SnippetType.IDEA,
            "decision", SnippetType.DECISION);

    private final KnowledgePort knowledgePort;
    private final WorkItemPort workItemPort;
    private final SnippetPort snippetPort;
    private final ChronicleProperties properties;
    private final Clock clock;

    public SnippetCaptureService(KnowledgePort knowledgePort, WorkItemPort workItemPort, SnippetPort snippetPort,
            ChronicleProperties properties, Clock clock) {
        this.knowledgePort = knowledgePort;
        this.workItemPort = workItemPort;
        this.snippetPort = snippetPort;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Run one capture pass over all three sources.
     */
    public CaptureResult capture() {
        LocalDate today = LocalDate.ofInstant(clock.instant(), zone());
        int limit = properties.getCapture().getBatchLimit();

        CaptureResult result = new CaptureResult();
        captureKnowledge(limit, today, result);
        captureTodos(limit, today, result);
        captureBugs(limit, today, result);

        if (result.total() > 0 || result.getRetries() > 0) {
            log.info("[Capture] Captured {} knowledge, {} todo, {} bug snippet(s); {} duplicate(s), {} retry",
                    result.getKnowledge(), result.getTodos(), result.getBugs(), result.getDuplicatesSkipped(),
                    result.getRetries());
        }
        return result;
    }

    public ItemResult captureKnowledgeItem(KnowledgeItem item, LocalDate today) {
        String content = item.getTitle()
                + (item.getSummary() != null && !item.getSummary().isBlank() ? ": " + item.getSummary() : "");
        Snippet snippet = Snippet.builder()
                .projectPath(projectPathOrDefault(item.getProjectPath()))
                .snippetType(snippetTypeFor(item.getCategory()))
                .content(truncate(content, MAX_CONTENT_LENGTH))
                .context(truncate(item.getContent(), properties.getCapture().getContextLength()))
                .sessionId(item.getSource())
                .sourceType(SnippetSource.KNOWLEDGE)
                .sourceId(item.getId())
                .snippetDate(today)
                .build();
        return insertThenMark(snippet, () -> knowledgePort.markCaptured(item.getId(), clock.instant()));
    }

    public ItemResult captureTodo(TodoItem todo, LocalDate today) {
        Snippet snippet = Snippet.builder()
                .projectPath(projectPathOrDefault(todo.getProjectPath()))
                .snippetType("bug".equalsIgnoreCase(todo.getCategory()) ? SnippetType.BUG_FIX : SnippetType.FEATURE)
                .content(truncate(TODO_PREFIX + todo.getTitle(), MAX_CONTENT_LENGTH))
                .context(truncate(todo.getDescription(), MAX_CONTENT_LENGTH))
                .sourceType(SnippetSource.TODO)
                .sourceId(todo.getId())
                .snippetDate(today)
                .build();
        return insertThenMark(snippet, () -> workItemPort.markTodoCaptured(todo.getId(), clock.instant()));
    }

    public ItemResult captureBug(BugReport bug, LocalDate today) {
        String description = bug.getDescription() != null ? bug.getDescription() : "";
        String resolution = bug.getResolution() != null && !bug.getResolution().isBlank()
                ? bug.getResolution()
                : "Not documented";
        Snippet snippet = Snippet.builder()
                .projectPath(projectPathOrDefault(bug.getProjectPath()))
                .snippetType(SnippetType.BUG_FIX)
                .content(truncate(BUG_PREFIX + bug.getTitle(), MAX_CONTENT_LENGTH))
                .context(truncate(description + "\nResolution: " + resolution, MAX_CONTENT_LENGTH))
                .sourceType(SnippetSource.BUG)
                .sourceId(bug.getId())
                .snippetDate(today)
                .build();
        return insertThenMark(snippet, () -> workItemPort.markBugCaptured(bug.getId(), clock.instant()));
    }

    static SnippetType snippetTypeFor(String category) {
        if (category == null) {
            return SnippetType.CONVERSATION;
        }
        return KNOWLEDGE_TYPES.getOrDefault(category.toLowerCase(Locale.ROOT), SnippetType.CONVERSATION);
    }

    private void captureKnowledge(int limit, LocalDate today, CaptureResult result) {
        List<KnowledgeItem> items;
        try {
            items = knowledgePort.findUncaptured(limit);
        } catch (RuntimeException e) {
            log.warn("[Capture] Failed to load knowledge items: {}", e.getMessage());
            return;
        }
        for (KnowledgeItem item : items) {
            tally(captureKnowledgeItem(item, today), result, SnippetSource.KNOWLEDGE);
        }
    }

    private void captureTodos(int limit, LocalDate today, CaptureResult result) {
        List<TodoItem> todos;
        try {
            todos = workItemPort.findUncapturedCompletedTodos(limit);
        } catch (RuntimeException e) {
            log.warn("[Capture] Failed to load completed todos: {}", e.getMessage());
            return;
        }
        for (TodoItem todo : todos) {
            tally(captureTodo(todo, today), result, SnippetSource.TODO);
        }
    }

    private void captureBugs(int limit, LocalDate today, CaptureResult result) {
        List<BugReport> bugs;
        try {
            bugs = workItemPort.findUncapturedFixedBugs(limit);
        } catch (RuntimeException e) {
            log.warn("[Capture] Failed to load fixed bugs: {}", e.getMessage());
            return;
        }
        for (BugReport bug : bugs) {
            tally(captureBug(bug, today), result, SnippetSource.BUG);
        }
    }

    private ItemResult insertThenMark(Snippet snippet, Runnable markCaptured) {
        Long sourceId = snippet.getSourceId();
        try {
            if (snippetPort.existsByProjectPathAndContentAndSnippetDate(snippet.getProjectPath(),
                    snippet.getContent(), snippet.getSnippetDate())) {
                markCaptured.run();
                return ItemResult.skipped(sourceId, "duplicate snippet for " + snippet.getSnippetDate());
            }
            snippetPort.save(snippet);
        } catch (RuntimeException e) {
            log.warn("[Capture] Failed to store snippet for {} {}: {}", snippet.getSourceType(), sourceId,
                    e.getMessage());
            return ItemResult.retry(sourceId, e.getMessage());
        }
        try {
            markCaptured.run();
        } catch (RuntimeException e) {
            log.warn("[Capture] Snippet stored but {} {} not marked captured: {}", snippet.getSourceType(), sourceId,
                    e.getMessage());
        }
        return ItemResult.applied(sourceId);
    }

    private void tally(ItemResult itemResult, CaptureResult result, SnippetSource source) {
        switch (itemResult.outcome()) {
        case APPLIED -> {
            if (source == SnippetSource.KNOWLEDGE) {
                result.setKnowledge(result.getKnowledge() + 1);
            } else if (source == SnippetSource.TODO) {
                result.setTodos(result.getTodos() + 1);
            } else {
                result.setBugs(result.getBugs() + 1);
            }
        }
        case SKIPPED -> result.setDuplicatesSkipped(result.getDuplicatesSkipped() + 1);
        case RETRY -> result.setRetries(result.getRetries() + 1);
        default -> throw new IllegalStateException("Unexpected outcome: " + itemResult.outcome());
        }
    }

    private String projectPathOrDefault(String projectPath) {
        return projectPath != null && !projectPath.isBlank()
                ? projectPath
                : properties.getCapture().getDefaultProjectPath();
    }

    private ZoneId zone() {
        return ZoneId.of(properties.getScheduler().getZone());
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() > max ? value.substring(0, max) : value;
    }
}
