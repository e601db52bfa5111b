package me.golemcore.chronicle.domain.service;

import me.golemcore.chronicle.domain.model.CompilationResult;
import me.golemcore.chronicle.domain.model.EntryType;
import me.golemcore.chronicle.domain.model.GeneratedDocument;
import me.golemcore.chronicle.domain.model.JournalEntry;
import me.golemcore.chronicle.domain.model.Project;
import me.golemcore.chronicle.domain.model.ProjectCompilation;
import me.golemcore.chronicle.domain.model.Snippet;
import me.golemcore.chronicle.domain.model.SnippetType;
import me.golemcore.chronicle.infrastructure.config.ChronicleProperties;
import me.golemcore.chronicle.port.outbound.DocumentPort;
import me.golemcore.chronicle.port.outbound.JournalPort;
import me.golemcore.chronicle.port.outbound.ProjectPort;
import me.golemcore.chronicle.port.outbound.SnippetPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CompilationServiceTest {

    // 02:00 PDT on Wednesday, March 11
    private static final Instant FIXED_NOW = Instant.parse("2026-03-11T09:00:00Z");
    private static final String CREATOR = "chronicle-night-compiler";
    private static final String PROJECT = "/var/www/billing";

    private ProjectPort projectPort;
    private JournalPort journalPort;
    private SnippetPort snippetPort;
    private DocumentPort documentPort;
    private DocumentSynthesizer synthesizer;
    private CompilationService service;
    private List<GeneratedDocument> savedDocuments;

    @BeforeEach
    void setUp() {
        projectPort = mock(ProjectPort.class);
        journalPort = mock(JournalPort.class);
        snippetPort = mock(SnippetPort.class);
        documentPort = mock(DocumentPort.class);
        synthesizer = mock(DocumentSynthesizer.class);
        savedDocuments = new ArrayList<>();

        AtomicLong ids = new AtomicLong(100);
        when(documentPort.save(any())).thenAnswer(inv -> {
            GeneratedDocument document = inv.getArgument(0);
            document.setId(ids.getAndIncrement());
            savedDocuments.add(document);
            return document;
        });
        when(synthesizer.synthesize(anyString(), any(), anyString(), anyString())).thenReturn(Optional.empty());
        when(snippetPort.findUncompiled(anyString())).thenReturn(List.of());

        service = new CompilationService(projectPort, journalPort, snippetPort, documentPort, synthesizer,
                new ChronicleProperties(), Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldCreateOneDocumentPerCategoryAndArchiveUnderFirst() {
        JournalEntry work = entry(1L, EntryType.WORK_LOG, "Shipped v2", "v2 is live", "2026-03-10T16:15:00Z");
        JournalEntry decision = entry(2L, EntryType.DECISION, "Use Postgres", "over MySQL", "2026-03-10T17:00:00Z");
        Snippet snippet = snippet(50L, "COMPLETED: Add retry", "2026-03-10T18:30:00Z");
        when(journalPort.findCompilationCandidates(PROJECT, CREATOR)).thenReturn(List.of(decision, work));
        when(snippetPort.findUncompiled(PROJECT)).thenReturn(List.of(snippet));

        ProjectCompilation compilation = service.compileProject(PROJECT, FIXED_NOW);

        assertEquals(2, compilation.getDocsCreated());
        assertEquals(2, compilation.getEntriesProcessed());
        assertEquals(1, compilation.getSnippetsCompiled());
        assertEquals(100L, compilation.getAnchorDocumentId());

        GeneratedDocument workLog = savedDocuments.get(0);
        assertEquals(EntryType.WORK_LOG, workLog.getDocType());
        assertEquals("Work Log - Wednesday, March 11, 2026", workLog.getTitle());
        assertEquals(List.of(1L), workLog.getSourceIds());
        assertEquals(List.of(50L), workLog.getSnippetIds());
        assertEquals(CREATOR, workLog.getCreatedBy());
        assertTrue(workLog.getContent().contains("### 09:15 - Shipped v2\nv2 is live"));
        assertTrue(workLog.getContent().contains("### 11:30 - COMPLETED: Add retry"));

        GeneratedDocument decisions = savedDocuments.get(1);
        assertEquals("Decisions - Wednesday, March 11, 2026", decisions.getTitle());
        assertEquals(List.of(2L), decisions.getSourceIds());

        verify(journalPort).archive(List.of(1L, 2L), 100L, FIXED_NOW);
        verify(snippetPort).markCompiled(List.of(50L), 100L, FIXED_NOW);
    }

    @Test
    void shouldUseSynthesizedContentWhenAvailable() {
        JournalEntry lesson = entry(3L, EntryType.LESSON, "Pin versions", "always", "2026-03-10T20:00:00Z");
        when(journalPort.findCompilationCandidates(PROJECT, CREATOR)).thenReturn(List.of(lesson));
        when(synthesizer.synthesize(eq("billing"), eq(EntryType.LESSON), eq("Wednesday, March 11, 2026"),
                anyString())).thenReturn(Optional.of("## Lessons\n- Pin versions"));

        service.compileProject(PROJECT, FIXED_NOW);

        assertEquals("## Lessons\n- Pin versions", savedDocuments.get(0).getContent());
    }

    @Test
    void shouldLeaveEntriesOfFailedCategoryUnarchived() {
        JournalEntry work = entry(1L, EntryType.WORK_LOG, "Shipped", "body", "2026-03-10T16:15:00Z");
        JournalEntry idea = entry(2L, EntryType.IDEA, "Dark mode", "maybe", "2026-03-10T17:00:00Z");
        when(journalPort.findCompilationCandidates(PROJECT, CREATOR)).thenReturn(List.of(work, idea));
        doAnswer(inv -> {
            GeneratedDocument document = inv.getArgument(0);
            if (document.getDocType() == EntryType.IDEA) {
                throw new IllegalStateException("disk full");
            }
            document.setId(7L);
            return document;
        }).when(documentPort).save(any());

        ProjectCompilation compilation = service.compileProject(PROJECT, FIXED_NOW);

        assertEquals(1, compilation.getDocsCreated());
        verify(journalPort).archive(List.of(1L), 7L, FIXED_NOW);
    }

    @Test
    void shouldArchiveNothingWhenNoDocumentPersisted() {
        JournalEntry work = entry(1L, EntryType.WORK_LOG, "Shipped", "body", "2026-03-10T16:15:00Z");
        when(journalPort.findCompilationCandidates(PROJECT, CREATOR)).thenReturn(List.of(work));
        doThrow(new IllegalStateException("db down")).when(documentPort).save(any());

        ProjectCompilation compilation = service.compileProject(PROJECT, FIXED_NOW);

        assertEquals(0, compilation.getDocsCreated());
        assertNull(compilation.getAnchorDocumentId());
        verify(journalPort, never()).archive(any(), any(), any());
        verify(snippetPort, never()).markCompiled(any(), any(), any());
    }

    @Test
    void shouldDoNothingForProjectWithoutMaterial() {
        when(journalPort.findCompilationCandidates(PROJECT, CREATOR)).thenReturn(List.of());

        ProjectCompilation compilation = service.compileProject(PROJECT, FIXED_NOW);

        assertEquals(0, compilation.getDocsCreated());
        verify(documentPort, never()).save(any());
    }

    @Test
    void shouldCompileActiveProjects() {
        when(projectPort.findActiveProjects()).thenReturn(List.of(
                Project.builder().slug("billing").serverPath(PROJECT).build(),
                Project.builder().slug("docs").build()));
        when(journalPort.findCompilationCandidates(PROJECT, CREATOR)).thenReturn(List.of(
                entry(1L, EntryType.WORK_LOG, "Shipped", "body", "2026-03-10T16:15:00Z")));
        when(journalPort.findCompilationCandidates("docs", CREATOR)).thenReturn(List.of());

        CompilationResult result = service.compile();

        assertEquals(1, result.getProjects().size());
        assertEquals(PROJECT, result.getProjects().get(0).getProjectPath());
        assertEquals(1, result.totalDocuments());
        verify(journalPort, never()).findProjectPathsWithPendingEntries(anyString());
    }

    @Test
    void shouldFallBackToPathsWithPendingMaterial() {
        when(projectPort.findActiveProjects()).thenReturn(List.of());
        when(journalPort.findProjectPathsWithPendingEntries(CREATOR)).thenReturn(List.of("b", "a"));
        when(snippetPort.findProjectPathsWithUncompiled()).thenReturn(List.of("a", "c"));
        when(journalPort.findCompilationCandidates(anyString(), anyString())).thenReturn(List.of());

        service.compile();

        verify(journalPort, times(3)).findCompilationCandidates(anyString(), eq(CREATOR));
        ArgumentCaptor<String> paths = ArgumentCaptor.forClass(String.class);
        verify(snippetPort, times(3)).findUncompiled(paths.capture());
        assertEquals(List.of("a", "b", "c"), paths.getAllValues());
    }

    @Test
    void shouldIsolateProjectFailures() {
        when(projectPort.findActiveProjects()).thenReturn(List.of(
                Project.builder().slug("broken").build(),
                Project.builder().slug("fine").build()));
        when(journalPort.findCompilationCandidates("broken", CREATOR))
                .thenThrow(new IllegalStateException("timeout"));
        when(journalPort.findCompilationCandidates("fine", CREATOR)).thenReturn(List.of(
                entry(1L, EntryType.IDEA, "Idea", "body", "2026-03-10T16:15:00Z")));

        CompilationResult result = service.compile();

        assertEquals(2, result.getProjects().size());
        assertEquals("timeout", result.getProjects().get(0).getError());
        assertEquals(1, result.getProjects().get(1).getDocsCreated());
    }

    @Test
    void shouldRenderBlocksChronologically() {
        String rendered = service.render(
                List.of(entry(2L, EntryType.WORK_LOG, "Later", "b", "2026-03-10T20:00:00Z"),
                        entry(1L, EntryType.WORK_LOG, "Earlier", "a", "2026-03-10T16:00:00Z")),
                List.of());

        assertEquals("### 09:00 - Earlier\na\n\n### 13:00 - Later\nb\n", rendered);
    }

    @Test
    void shouldDeriveProjectNameFromPath() {
        assertEquals("billing", CompilationService.projectName("/var/www/billing"));
        assertEquals("billing", CompilationService.projectName("/var/www/billing/"));
        assertEquals("general", CompilationService.projectName("general"));
    }

    private static JournalEntry entry(Long id, EntryType type, String title, String content, String createdAt) {
        return JournalEntry.builder()
                .id(id)
                .projectPath(PROJECT)
                .entryType(type)
                .title(title)
                .content(content)
                .createdAt(Instant.parse(createdAt))
                .build();
    }

    private static Snippet snippet(Long id, String content, String createdAt) {
        return Snippet.builder()
                .id(id)
                .projectPath(PROJECT)
                .snippetType(SnippetType.FEATURE)
                .content(content)
                .snippetDate(LocalDate.of(2026, 3, 10))
                .createdAt(Instant.parse(createdAt))
                .build();
    }
}
