package me.golemcore.chronicle.adapter.outbound.persistence;

import me.golemcore.chronicle.domain.model.EntryType;
import me.golemcore.chronicle.domain.model.JournalEntry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
@Import(JpaJournalAdapter.class)
class JpaJournalAdapterTest {

    private static final String PROJECT = "/srv/app";
    private static final String COMPILER = "chronicle-night-compiler";

    @Autowired
    private JpaJournalAdapter adapter;

    @Test
    void shouldSelectUnarchivedEntriesNotWrittenByCompiler() {
        JournalEntry second = adapter.save(entry(PROJECT, "second", "dev", "2026-03-10T20:00:00Z"));
        JournalEntry first = adapter.save(entry(PROJECT, "first", null, "2026-03-10T12:00:00Z"));
        JournalEntry leftOver = adapter.save(entry(PROJECT, "left from a failed night", "dev",
                "2026-03-08T12:00:00Z"));
        adapter.save(entry(PROJECT, "published doc", COMPILER, "2026-03-10T13:00:00Z"));
        adapter.save(entry("/srv/other", "other project", "dev", "2026-03-10T12:00:00Z"));
        JournalEntry archived = entry(PROJECT, "archived", "dev", "2026-03-10T14:00:00Z");
        archived.setArchived(true);
        adapter.save(archived);

        List<JournalEntry> candidates = adapter.findCompilationCandidates(PROJECT, COMPILER);

        assertEquals(List.of(leftOver.getId(), first.getId(), second.getId()),
                candidates.stream().map(JournalEntry::getId).toList());
    }

    @Test
    void shouldArchiveIntoDocument() {
        JournalEntry entry = adapter.save(entry(PROJECT, "work", "dev", "2026-03-10T12:00:00Z"));
        Instant at = Instant.parse("2026-03-11T09:00:00Z");

        assertEquals(1, adapter.archive(List.of(entry.getId()), 42L, at));

        JournalEntry stored = adapter.findById(entry.getId()).orElseThrow();
        assertTrue(stored.isArchived());
        assertEquals(42L, stored.getArchivedInto());
        assertEquals(at, stored.getArchivedAt());
        assertTrue(adapter.findCompilationCandidates(PROJECT, COMPILER).isEmpty());
    }

    @Test
    void shouldArchiveNothingForEmptyIds() {
        assertEquals(0, adapter.archive(List.of(), 42L, Instant.parse("2026-03-11T09:00:00Z")));
    }

    @Test
    void shouldListDistinctPendingProjects() {
        adapter.save(entry(PROJECT, "a", "dev", "2026-03-10T12:00:00Z"));
        adapter.save(entry(PROJECT, "b", "dev", "2026-03-10T13:00:00Z"));
        adapter.save(entry("/srv/compiled-only", "doc", COMPILER, "2026-03-10T13:00:00Z"));

        assertEquals(List.of(PROJECT), adapter.findProjectPathsWithPendingEntries(COMPILER));
    }

    @Test
    void shouldMoveEntryToAnotherProject() {
        JournalEntry entry = adapter.save(entry(PROJECT, "misfiled", "dev", "2026-03-10T12:00:00Z"));

        adapter.updateProjectPath(entry.getId(), "/srv/api");

        assertEquals("/srv/api", adapter.findById(entry.getId()).orElseThrow().getProjectPath());
    }

    private static JournalEntry entry(String projectPath, String title, String createdBy, String createdAt) {
        return JournalEntry.builder()
                .projectPath(projectPath)
                .entryType(EntryType.WORK_LOG)
                .title(title)
                .content(title + " body")
                .createdBy(createdBy)
                .createdAt(Instant.parse(createdAt))
                .build();
    }
}
