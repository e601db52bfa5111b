package me.golemcore.chronicle.domain.service;

import me.golemcore.chronicle.domain.model.CorrectionItemType;
import me.golemcore.chronicle.domain.model.CorrectionRecord;
import me.golemcore.chronicle.domain.model.CorrectionResolution;
import me.golemcore.chronicle.domain.model.CorrectionStatus;
import me.golemcore.chronicle.domain.model.CorrectionType;
import me.golemcore.chronicle.infrastructure.config.ChronicleConfiguration;
import me.golemcore.chronicle.infrastructure.config.ChronicleProperties;
import me.golemcore.chronicle.port.outbound.CorrectionPort;
import me.golemcore.chronicle.port.outbound.DocumentPort;
import me.golemcore.chronicle.port.outbound.JournalPort;
import me.golemcore.chronicle.port.outbound.KnowledgePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CorrectionServiceTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-03-15T11:00:00Z");

    private CorrectionPort correctionPort;
    private KnowledgePort knowledgePort;
    private JournalPort journalPort;
    private DocumentPort documentPort;
    private CorrectionService service;

    @BeforeEach
    void setUp() {
        correctionPort = mock(CorrectionPort.class);
        knowledgePort = mock(KnowledgePort.class);
        journalPort = mock(JournalPort.class);
        documentPort = mock(DocumentPort.class);
        when(correctionPort.save(any())).thenAnswer(inv -> inv.getArgument(0));
        service = new CorrectionService(correctionPort, knowledgePort, journalPort, documentPort,
                new ChronicleProperties(), ChronicleConfiguration.objectMapper(),
                Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldCreatePendingCorrectionWithDefaultAuthor() {
        CorrectionRecord created = service.create(CorrectionItemType.JOURNAL, 5L, CorrectionType.MOVE,
                Map.of("target_project", "/srv/api"), null);

        assertEquals(CorrectionStatus.PENDING, created.getStatus());
        assertEquals("user", created.getCreatedBy());
        assertEquals("{\"target_project\":\"/srv/api\"}", created.getDetails());
        assertEquals(FIXED_NOW, created.getCreatedAt());
    }

    @Test
    void shouldRejectCreateWithoutItemId() {
        assertThrows(IllegalArgumentException.class,
                () -> service.create(CorrectionItemType.JOURNAL, null, CorrectionType.NOTE, Map.of(), "ops"));
    }

    @Test
    void shouldApplyRemove() {
        stub(correction(1L, CorrectionItemType.KNOWLEDGE, 9L, CorrectionType.REMOVE, null));
        when(knowledgePort.deleteById(9L)).thenReturn(true);

        CorrectionResolution resolution = service.apply(1L);

        assertEquals(CorrectionStatus.APPLIED, resolution.status());
        verify(knowledgePort).deleteById(9L);
    }

    @Test
    void shouldMarkRemoveOfMissingTargetReviewed() {
        CorrectionRecord correction = correction(1L, CorrectionItemType.DOC, 9L, CorrectionType.REMOVE, null);
        stub(correction);
        when(documentPort.deleteById(9L)).thenReturn(false);

        CorrectionResolution resolution = service.apply(1L);

        assertEquals(CorrectionStatus.REVIEWED, resolution.status());
        assertNull(correction.getAppliedAt());
        assertEquals("chronicle", correction.getAppliedBy());
    }

    @Test
    void shouldApplyMoveToTargetProject() {
        CorrectionRecord correction = correction(2L, CorrectionItemType.KNOWLEDGE, 9L, CorrectionType.MOVE,
                "{\"target_project\":\"/srv/api\"}");
        stub(correction);

        CorrectionResolution resolution = service.apply(2L);

        assertEquals(CorrectionStatus.APPLIED, resolution.status());
        assertEquals(FIXED_NOW, correction.getAppliedAt());
        verify(knowledgePort).updateProjectPath(9L, "/srv/api", FIXED_NOW);
    }

    @Test
    void shouldApplyJournalMove() {
        stub(correction(2L, CorrectionItemType.JOURNAL, 4L, CorrectionType.MOVE, "{\"target_project\":\"x\"}"));

        service.apply(2L);

        verify(journalPort).updateProjectPath(4L, "x");
    }

    @Test
    void shouldMarkMoveWithoutTargetReviewed() {
        stub(correction(2L, CorrectionItemType.KNOWLEDGE, 9L, CorrectionType.MOVE, "{}"));

        assertEquals(CorrectionStatus.REVIEWED, service.apply(2L).status());
        verify(knowledgePort, never()).updateProjectPath(anyLong(), any(), any());
    }

    @Test
    void shouldLeaveMergeForManualReview() {
        stub(correction(3L, CorrectionItemType.KNOWLEDGE, 9L, CorrectionType.MERGE, "{\"duplicates\":[]}"));

        CorrectionResolution resolution = service.apply(3L);

        assertEquals(CorrectionStatus.REVIEWED, resolution.status());
        verify(knowledgePort, never()).deleteById(anyLong());
    }

    @Test
    void shouldAcknowledgeNote() {
        stub(correction(4L, CorrectionItemType.JOURNAL, 1L, CorrectionType.NOTE, null));

        assertEquals(CorrectionStatus.APPLIED, service.apply(4L).status());
    }

    @Test
    void shouldRefuseToApplyResolvedCorrection() {
        CorrectionRecord correction = correction(5L, CorrectionItemType.JOURNAL, 1L, CorrectionType.NOTE, null);
        correction.setStatus(CorrectionStatus.APPLIED);
        stub(correction);

        assertThrows(IllegalArgumentException.class, () -> service.apply(5L));
        assertThrows(IllegalArgumentException.class, () -> service.reject(5L));
    }

    @Test
    void shouldThrowForUnknownCorrection() {
        when(correctionPort.findById(99L)).thenReturn(Optional.empty());

        assertThrows(IllegalArgumentException.class, () -> service.apply(99L));
    }

    @Test
    void shouldRejectPendingCorrection() {
        stub(correction(6L, CorrectionItemType.KNOWLEDGE, 1L, CorrectionType.MERGE, null));

        assertEquals(CorrectionStatus.REJECTED, service.reject(6L).getStatus());
    }

    @Test
    void shouldPurgeResolvedOlderThanRetention() {
        when(correctionPort.deleteResolvedBefore(any(), any())).thenReturn(4);

        assertEquals(4, service.purgeResolved());
        verify(correctionPort).deleteResolvedBefore(EnumSet.of(CorrectionStatus.APPLIED, CorrectionStatus.REJECTED),
                Instant.parse("2026-02-13T11:00:00Z"));
    }

    private void stub(CorrectionRecord correction) {
        when(correctionPort.findById(correction.getId())).thenReturn(Optional.of(correction));
    }

    private static CorrectionRecord correction(Long id, CorrectionItemType itemType, Long itemId,
            CorrectionType type, String details) {
        return CorrectionRecord.builder()
                .id(id)
                .itemType(itemType)
                .itemId(itemId)
                .correctionType(type)
                .status(CorrectionStatus.PENDING)
                .details(details)
                .build();
    }
}
