package me.golemcore.chronicle.domain.pipeline;

import me.golemcore.chronicle.domain.model.CaptureResult;
import me.golemcore.chronicle.domain.model.JobType;
import me.golemcore.chronicle.domain.model.ReclassificationResult;
import me.golemcore.chronicle.domain.model.ScheduleJob;
import me.golemcore.chronicle.domain.service.ReclassificationService;
import me.golemcore.chronicle.domain.service.SnippetCaptureService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DaytimePipelineTest {

    private SnippetCaptureService captureService;
    private ReclassificationService reclassificationService;
    private DaytimePipeline pipeline;
    private final ScheduleJob job = ScheduleJob.builder().id(1L).jobType(JobType.DAY_ORGANIZE).jobName("day").build();

    @BeforeEach
    void setUp() {
        captureService = mock(SnippetCaptureService.class);
        reclassificationService = mock(ReclassificationService.class);
        pipeline = new DaytimePipeline(captureService, reclassificationService);
    }

    @Test
    void shouldCaptureBeforeReclassifying() {
        CaptureResult capture = CaptureResult.builder().knowledge(2).build();
        ReclassificationResult reclassification = ReclassificationResult.builder().reviewed(3).build();
        when(captureService.capture()).thenReturn(capture);
        when(reclassificationService.reclassify()).thenReturn(reclassification);

        Map<String, Object> result = pipeline.run(job, Map.of());

        InOrder order = inOrder(captureService, reclassificationService);
        order.verify(captureService).capture();
        order.verify(reclassificationService).reclassify();
        assertSame(capture, result.get("snippets"));
        assertSame(reclassification, result.get("reclassification"));
        assertEquals(JobType.DAY_ORGANIZE, pipeline.getJobType());
    }

    @Test
    void shouldSkipDisabledStage() {
        when(captureService.capture()).thenReturn(new CaptureResult());

        Map<String, Object> result = pipeline.run(job, Map.of("reclassify", false));

        verify(reclassificationService, never()).reclassify();
        assertFalse(result.containsKey("reclassification"));
    }

    @Test
    void shouldReadStringToggles() {
        assertFalse(JobPipeline.isStageEnabled(Map.of("capture", " FALSE "), "capture"));
        assertTrue(JobPipeline.isStageEnabled(Map.of("capture", 0), "capture"));
        assertTrue(JobPipeline.isStageEnabled(Map.of(), "capture"));
    }
}
