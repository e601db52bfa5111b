package me.golemcore.chronicle.adapter.outbound.persistence;

import me.golemcore.chronicle.domain.model.EntryType;
import me.golemcore.chronicle.domain.model.GeneratedDocument;
import me.golemcore.chronicle.domain.model.JournalEntry;
import me.golemcore.chronicle.domain.model.ProjectCompilation;
import me.golemcore.chronicle.domain.service.CompilationService;
import me.golemcore.chronicle.domain.service.DocumentSynthesizer;
import me.golemcore.chronicle.infrastructure.config.ChronicleProperties;
import me.golemcore.chronicle.port.outbound.DocumentPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

@DataJpaTest
@Import({ JpaProjectAdapter.class, JpaJournalAdapter.class, JpaSnippetAdapter.class, JpaDocumentAdapter.class })
class CompilationPersistenceTest {

    private static final String PROJECT = "/srv/billing";
    // 02:00 PDT
    private static final Instant FIRST_NIGHT = Instant.parse("2026-03-11T09:00:00Z");
    private static final Instant SECOND_NIGHT = Instant.parse("2026-03-12T09:00:00Z");

    @Autowired
    private JpaProjectAdapter projectAdapter;

    @Autowired
    private JpaJournalAdapter journalAdapter;

    @Autowired
    private JpaSnippetAdapter snippetAdapter;

    @Autowired
    private JpaDocumentAdapter documentAdapter;

    @Autowired
    private GeneratedDocumentRepository documentRepository;

    private DocumentSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        synthesizer = mock(DocumentSynthesizer.class);
        when(synthesizer.synthesize(anyString(), any(), anyString(), anyString())).thenReturn(Optional.empty());
    }

    @Test
    void shouldNotCreateSecondDocumentWhenNothingNewArrived() {
        journalAdapter.save(entry(EntryType.WORK_LOG, "Shipped invoices v2", "2026-03-10T18:00:00Z"));

        ProjectCompilation first = serviceAt(FIRST_NIGHT, documentAdapter).compileProject(PROJECT, FIRST_NIGHT);
        ProjectCompilation second = serviceAt(FIRST_NIGHT, documentAdapter).compileProject(PROJECT, FIRST_NIGHT);

        assertEquals(1, first.getDocsCreated());
        assertEquals(0, second.getDocsCreated());
        assertEquals(1, documentRepository.count());
    }

    @Test
    void shouldCarryFailedCategoryIntoNextNight() {
        JournalEntry work = journalAdapter.save(entry(EntryType.WORK_LOG, "Shipped", "2026-03-10T18:00:00Z"));
        JournalEntry idea = journalAdapter.save(entry(EntryType.IDEA, "Usage-based pricing", "2026-03-10T19:00:00Z"));

        DocumentPort failingIdeas = spy(documentAdapter);
        doAnswer(inv -> {
            GeneratedDocument document = inv.getArgument(0);
            if (document.getDocType() == EntryType.IDEA) {
                throw new IllegalStateException("write timeout");
            }
            return inv.callRealMethod();
        }).when(failingIdeas).save(any());

        ProjectCompilation firstNight = serviceAt(FIRST_NIGHT, failingIdeas).compileProject(PROJECT, FIRST_NIGHT);
        assertEquals(1, firstNight.getDocsCreated());
        assertTrue(journalAdapter.findById(work.getId()).orElseThrow().isArchived());
        assertFalse(journalAdapter.findById(idea.getId()).orElseThrow().isArchived());

        ProjectCompilation secondNight = serviceAt(SECOND_NIGHT, documentAdapter)
                .compileProject(PROJECT, SECOND_NIGHT);

        assertEquals(1, secondNight.getDocsCreated());
        assertEquals(1, secondNight.getEntriesProcessed());
        JournalEntry archivedIdea = journalAdapter.findById(idea.getId()).orElseThrow();
        assertTrue(archivedIdea.isArchived());
        assertEquals(secondNight.getAnchorDocumentId(), archivedIdea.getArchivedInto());
    }

    private CompilationService serviceAt(Instant now, DocumentPort documentPort) {
        return new CompilationService(projectAdapter, journalAdapter, snippetAdapter, documentPort, synthesizer,
                new ChronicleProperties(), Clock.fixed(now, ZoneOffset.UTC));
    }

    private static JournalEntry entry(EntryType type, String title, String createdAt) {
        return JournalEntry.builder()
                .projectPath(PROJECT)
                .entryType(type)
                .title(title)
                .content(title + " notes")
                .createdBy("dev")
                .createdAt(Instant.parse(createdAt))
                .build();
    }
}
