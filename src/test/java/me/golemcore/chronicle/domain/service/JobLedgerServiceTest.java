package me.golemcore.chronicle.domain.service;

import me.golemcore.chronicle.domain.model.JobStatus;
import me.golemcore.chronicle.domain.model.JobType;
import me.golemcore.chronicle.domain.model.ScheduleJob;
import me.golemcore.chronicle.infrastructure.config.ChronicleConfiguration;
import me.golemcore.chronicle.infrastructure.config.ChronicleProperties;
import me.golemcore.chronicle.port.outbound.ScheduleJobPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobLedgerServiceTest {

    // 02:00 in Los Angeles (PST, UTC-8)
    private static final Instant FIXED_NOW = Instant.parse("2026-02-11T10:00:00Z");
    private static final String DAY_JOB = "Organize Knowledge Buckets";

    private ScheduleJobPort port;
    private JobLedgerService service;

    @BeforeEach
    void setUp() {
        port = mock(ScheduleJobPort.class);
        Clock clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
        service = new JobLedgerService(port, ChronicleConfiguration.objectMapper(), clock, new ChronicleProperties());
    }

    @Test
    void shouldPrependSecondsToFiveFieldCron() {
        assertEquals("0 */30 6-23 * * *", JobLedgerService.normalizeCronExpression("*/30 6-23 * * *"));
    }

    @Test
    void shouldKeepSixFieldCron() {
        assertEquals("0 0 4 * * SUN", JobLedgerService.normalizeCronExpression("  0 0 4 * * SUN "));
    }

    @Test
    void shouldRejectInvalidCron() {
        assertThrows(IllegalArgumentException.class, () -> JobLedgerService.normalizeCronExpression("* * *"));
        assertThrows(IllegalArgumentException.class, () -> JobLedgerService.normalizeCronExpression(""));
        assertThrows(IllegalArgumentException.class,
                () -> JobLedgerService.normalizeCronExpression("99 * * * *"));
    }

    @Test
    void shouldComputeNextRunInConfiguredZone() {
        // 02:00 PST has just fired, next is tomorrow at 02:00 PST
        assertEquals(Instant.parse("2026-02-12T10:00:00Z"),
                service.computeNextExecution("0 0 2 * * *", FIXED_NOW));
        // daytime window opens at 06:00 PST
        assertEquals(Instant.parse("2026-02-11T14:00:00Z"),
                service.computeNextExecution("0 */30 6-23 * * *", FIXED_NOW));
    }

    @Test
    void shouldRegisterNewJobAsIdle() {
        when(port.findByTypeAndName(JobType.DAY_ORGANIZE, DAY_JOB)).thenReturn(Optional.empty());
        when(port.insertIfAbsent(any())).thenReturn(true);

        boolean created = service.register(JobType.DAY_ORGANIZE, DAY_JOB, "*/30 6-23 * * *", Map.of("capture", true),
                true);

        assertTrue(created);
        ArgumentCaptor<ScheduleJob> captor = ArgumentCaptor.forClass(ScheduleJob.class);
        verify(port).insertIfAbsent(captor.capture());
        ScheduleJob job = captor.getValue();
        assertEquals("0 */30 6-23 * * *", job.getCronExpression());
        assertEquals(JobStatus.IDLE, job.getStatus());
        assertEquals(Instant.parse("2026-02-11T14:00:00Z"), job.getNextRunAt());
        assertEquals("{\"capture\":true}", job.getConfig());
    }

    @Test
    void shouldLeaveExistingJobUntouchedOnRegister() {
        when(port.findByTypeAndName(JobType.DAY_ORGANIZE, DAY_JOB))
                .thenReturn(Optional.of(job(1L, JobStatus.COMPLETED, true)));

        assertFalse(service.register(JobType.DAY_ORGANIZE, DAY_JOB, "*/30 6-23 * * *", Map.of(), true));
        verify(port, never()).insertIfAbsent(any());
    }

    @Test
    void shouldClaimIdleJob() {
        ScheduleJob idle = job(1L, JobStatus.IDLE, true);
        ScheduleJob running = job(1L, JobStatus.RUNNING, true);
        when(port.findByName(DAY_JOB)).thenReturn(Optional.of(idle));
        when(port.claim(1L, FIXED_NOW)).thenReturn(true);
        when(port.findById(1L)).thenReturn(Optional.of(running));

        Optional<ScheduleJob> claimed = service.tryStart(DAY_JOB);

        assertTrue(claimed.isPresent());
        assertEquals(JobStatus.RUNNING, claimed.get().getStatus());
    }

    @Test
    void shouldNotClaimRunningJob() {
        when(port.findByName(DAY_JOB)).thenReturn(Optional.of(job(1L, JobStatus.RUNNING, true)));

        assertTrue(service.tryStart(DAY_JOB).isEmpty());
        verify(port, never()).claim(anyLong(), any());
    }

    @Test
    void shouldNotClaimDisabledJob() {
        when(port.findByName(DAY_JOB)).thenReturn(Optional.of(job(1L, JobStatus.IDLE, false)));

        assertTrue(service.tryStart(DAY_JOB).isEmpty());
        verify(port, never()).claim(anyLong(), any());
    }

    @Test
    void shouldReturnEmptyWhenClaimLosesRace() {
        when(port.findByName(DAY_JOB)).thenReturn(Optional.of(job(1L, JobStatus.COMPLETED, true)));
        when(port.claim(1L, FIXED_NOW)).thenReturn(false);

        assertTrue(service.tryStart(DAY_JOB).isEmpty());
        verify(port, never()).findById(anyLong());
    }

    @Test
    void shouldCompleteWithResultAndNextRun() {
        ScheduleJob job = job(1L, JobStatus.RUNNING, true);
        when(port.finish(anyLong(), any(), any(), any(), any(), any())).thenReturn(true);

        service.complete(job, Map.of("success", true));

        ArgumentCaptor<String> result = ArgumentCaptor.forClass(String.class);
        verify(port).finish(eq(1L), eq(JobStatus.COMPLETED), result.capture(), isNull(),
                eq(Instant.parse("2026-02-11T14:00:00Z")), eq(FIXED_NOW));
        assertEquals("{\"success\":true}", result.getValue());
    }

    @Test
    void shouldFailWithErrorAndNextRun() {
        ScheduleJob job = job(1L, JobStatus.RUNNING, true);
        when(port.finish(anyLong(), any(), any(), any(), any(), any())).thenReturn(true);

        service.fail(job, "boom");

        ArgumentCaptor<String> result = ArgumentCaptor.forClass(String.class);
        verify(port).finish(eq(1L), eq(JobStatus.FAILED), result.capture(), eq("boom"),
                eq(Instant.parse("2026-02-11T14:00:00Z")), eq(FIXED_NOW));
        assertTrue(result.getValue().contains("\"success\":false"));
        assertTrue(result.getValue().contains("\"error\":\"boom\""));
    }

    @Test
    void shouldReturnOnlyDueJobs() {
        ScheduleJob due = job(1L, JobStatus.COMPLETED, true);
        due.setNextRunAt(FIXED_NOW.minusSeconds(60));
        ScheduleJob future = job(2L, JobStatus.IDLE, true);
        future.setNextRunAt(FIXED_NOW.plusSeconds(60));
        ScheduleJob disabled = job(3L, JobStatus.IDLE, false);
        disabled.setNextRunAt(FIXED_NOW.minusSeconds(60));
        ScheduleJob running = job(4L, JobStatus.RUNNING, true);
        running.setNextRunAt(FIXED_NOW.minusSeconds(60));
        when(port.findAll()).thenReturn(List.of(running, future, disabled, due));

        List<ScheduleJob> dueJobs = service.getDueJobs();

        assertEquals(1, dueJobs.size());
        assertEquals(1L, dueJobs.get(0).getId());
    }

    @Test
    void shouldRecoverInterruptedRunsAndSkipMissedWindows() {
        ScheduleJob job = job(1L, JobStatus.IDLE, true);
        job.setNextRunAt(Instant.parse("2026-02-01T00:00:00Z"));
        when(port.failRunning(any(), any())).thenReturn(1);
        when(port.findAll()).thenReturn(List.of(job));

        service.recoverInterruptedRuns();

        verify(port).failRunning("Interrupted by restart", FIXED_NOW);
        verify(port).updateNextRun(1L, Instant.parse("2026-02-11T14:00:00Z"), FIXED_NOW);
    }

    @Test
    void shouldThrowWhenEnablingUnknownJob() {
        when(port.findByName("missing")).thenReturn(Optional.empty());

        assertThrows(IllegalArgumentException.class, () -> service.setEnabled("missing", true));
    }

    @Test
    void shouldReadMalformedConfigAsEmpty() {
        ScheduleJob job = job(1L, JobStatus.IDLE, true);
        job.setConfig("{not json");

        assertTrue(service.readConfig(job).isEmpty());
    }

    @Test
    void shouldReadConfigFlags() {
        ScheduleJob job = job(1L, JobStatus.IDLE, true);
        job.setConfig("{\"dedup\":false}");

        assertEquals(Boolean.FALSE, service.readConfig(job).get("dedup"));
    }

    private static ScheduleJob job(Long id, JobStatus status, boolean enabled) {
        return ScheduleJob.builder()
                .id(id)
                .jobType(JobType.DAY_ORGANIZE)
                .jobName(DAY_JOB)
                .cronExpression("0 */30 6-23 * * *")
                .status(status)
                .enabled(enabled)
                .build();
    }
}
