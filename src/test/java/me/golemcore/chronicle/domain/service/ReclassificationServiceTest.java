package me.golemcore.chronicle.domain.service;

import me.golemcore.chronicle.domain.model.CategoryVerdict;
import me.golemcore.chronicle.domain.model.ItemOutcome;
import me.golemcore.chronicle.domain.model.ItemResult;
import me.golemcore.chronicle.domain.model.KnowledgeItem;
import me.golemcore.chronicle.domain.model.ReclassificationResult;
import me.golemcore.chronicle.infrastructure.config.ChronicleProperties;
import me.golemcore.chronicle.port.outbound.KnowledgePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReclassificationServiceTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-03-10T18:00:00Z");
    private static final String CATALOGER = "chronicle-day-organizer";

    private KnowledgePort knowledgePort;
    private CategoryClassifier classifier;
    private ReclassificationService service;

    @BeforeEach
    void setUp() {
        knowledgePort = mock(KnowledgePort.class);
        classifier = mock(CategoryClassifier.class);
        service = new ReclassificationService(knowledgePort, classifier, new ChronicleProperties(),
                Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldRecategorizeToKnownCategory() {
        KnowledgeItem item = item(1L, "api", null);
        when(classifier.classify(item)).thenReturn(Optional.of(new CategoryVerdict(true, "database", null, "SQL")));

        ItemResult result = service.review(item);

        assertEquals(ItemOutcome.APPLIED, result.outcome());
        assertEquals("database", result.reason());
        verify(knowledgePort).updateClassification(1L, "database", CATALOGER, FIXED_NOW);
    }

    @Test
    void shouldOnlyStampWhenCategoryIsCorrect() {
        KnowledgeItem item = item(1L, "api", "someone-else");
        when(classifier.classify(item)).thenReturn(Optional.of(new CategoryVerdict(false, null, null, null)));

        ItemResult result = service.review(item);

        assertEquals(ItemOutcome.APPLIED, result.outcome());
        assertNull(result.reason());
        verify(knowledgePort).stampCataloger(1L, CATALOGER);
        verify(knowledgePort, never()).updateClassification(anyLong(), anyString(), anyString(), any());
    }

    @Test
    void shouldOnlyStampWhenSuggestionEqualsCurrent() {
        KnowledgeItem item = item(1L, "API", null);
        when(classifier.classify(item)).thenReturn(Optional.of(new CategoryVerdict(true, "api", null, null)));

        assertEquals(ItemOutcome.APPLIED, service.review(item).outcome());
        verify(knowledgePort).stampCataloger(1L, CATALOGER);
        verify(knowledgePort, never()).updateClassification(anyLong(), anyString(), anyString(), any());
    }

    @Test
    void shouldRejectCategoryOutsideVocabulary() {
        KnowledgeItem item = item(1L, "api", null);
        when(classifier.classify(item)).thenReturn(Optional.of(new CategoryVerdict(true, "misc", null, null)));

        ItemResult result = service.review(item);

        assertEquals(ItemOutcome.SKIPPED, result.outcome());
        verify(knowledgePort).stampCataloger(1L, CATALOGER);
        verify(knowledgePort, never()).updateClassification(anyLong(), anyString(), anyString(), any());
    }

    @Test
    void shouldLeaveItemUntouchedWhenClassifierGivesNothing() {
        KnowledgeItem item = item(1L, "api", null);
        when(classifier.classify(item)).thenReturn(Optional.empty());

        assertEquals(ItemOutcome.RETRY, service.review(item).outcome());
        verify(knowledgePort, never()).stampCataloger(anyLong(), anyString());
    }

    @Test
    void shouldRetryWhenWriteFails() {
        KnowledgeItem item = item(1L, "api", null);
        when(classifier.classify(item)).thenReturn(Optional.of(new CategoryVerdict(true, "ui", null, null)));
        doThrow(new IllegalStateException("db")).when(knowledgePort)
                .updateClassification(anyLong(), anyString(), anyString(), any());

        assertEquals(ItemOutcome.RETRY, service.review(item).outcome());
    }

    @Test
    void shouldTallyBatchAndSkipAlreadyReviewed() {
        KnowledgeItem recategorized = item(1L, "api", null);
        KnowledgeItem confirmed = item(2L, "ui", null);
        KnowledgeItem rejected = item(3L, "api", null);
        KnowledgeItem failed = item(4L, "api", null);
        KnowledgeItem alreadyReviewed = item(5L, "api", CATALOGER);
        when(knowledgePort.findReclassificationCandidates(CATALOGER, FIXED_NOW.minusSeconds(1800), 100))
                .thenReturn(List.of(recategorized, confirmed, rejected, failed, alreadyReviewed));
        when(classifier.classify(recategorized))
                .thenReturn(Optional.of(new CategoryVerdict(true, "testing", null, null)));
        when(classifier.classify(confirmed)).thenReturn(Optional.of(new CategoryVerdict(false, null, null, null)));
        when(classifier.classify(rejected)).thenReturn(Optional.of(new CategoryVerdict(true, "stuff", null, null)));
        when(classifier.classify(failed)).thenReturn(Optional.empty());

        ReclassificationResult result = service.reclassify();

        assertEquals(5, result.getCandidates());
        assertEquals(3, result.getReviewed());
        assertEquals(1, result.getRecategorized());
        assertEquals(1, result.getRejected());
        assertEquals(1, result.getRetries());
        verify(classifier, never()).classify(alreadyReviewed);
    }

    private static KnowledgeItem item(Long id, String category, String cataloger) {
        return KnowledgeItem.builder()
                .id(id)
                .title("Item " + id)
                .category(category)
                .cataloger(cataloger)
                .build();
    }
}
