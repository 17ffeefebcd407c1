package net.syncron.core.service;

import net.syncron.core.log.LogLevel;
import net.syncron.core.log.SchedulerLog;
import net.syncron.core.model.ExecutionResult;
import net.syncron.core.model.ExecutionResult.Outcome;
import net.syncron.core.model.JobDefinition;
import net.syncron.core.model.RunRecord;
import net.syncron.core.spi.TxRunner;
import net.syncron.core.support.InMemoryRunLedger;
import net.syncron.core.support.MutableClock;
import net.syncron.core.support.RecordingLogSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionCoordinatorTest {

    static final Instant AT = Instant.parse("2030-03-01T10:15:00Z");

    InMemoryRunLedger ledger;
    RecordingLogSink sink;
    MutableClock clock;
    ExecutionCoordinator coordinator;
    AtomicInteger runs;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryRunLedger();
        sink = new RecordingLogSink();
        clock = new MutableClock(AT.plusMillis(20));
        coordinator = new ExecutionCoordinator(ledger, TxRunner.direct(), clock,
                new SchedulerLog(true, sink, SchedulerLog.DEFAULT_TAG));
        runs = new AtomicInteger();
    }

    JobDefinition counting(String name) {
        return JobDefinition.of(name, p -> p.at(AT), (at, n) -> {
            runs.incrementAndGet();
            return "ok";
        });
    }

    @Test
    void same_occurrence_is_run_once_and_second_attempt_sees_first_record() throws Exception {
        JobDefinition job = counting("report");

        ExecutionResult first = coordinator.execute(job, AT.plusMillis(200));
        ExecutionResult second = coordinator.execute(job, AT.plusMillis(900));

        assertEquals(Outcome.COMPLETED, first.outcome());
        assertEquals(Outcome.SKIPPED_DUPLICATE, second.outcome());
        assertEquals(first.recordId(), second.recordId());
        assertEquals(AT, first.intendedAt());
        assertEquals(1, runs.get());
        assertEquals(1, ledger.size());

        RunRecord r = ledger.findById(first.recordId()).orElseThrow();
        assertEquals(AT, r.intendedAt());
        assertEquals("ok", r.result());
        assertNull(r.error());
        assertNotNull(r.finishedAt());
        assertTrue(r.succeeded());
        assertTrue(sink.contains(LogLevel.INFO, "Not running \"report\" again."));
    }

    @Test
    void different_names_at_same_instant_both_run() {
        coordinator.execute(counting("a"), AT);
        coordinator.execute(counting("b"), AT);

        assertEquals(2, runs.get());
        assertEquals(2, ledger.size());
    }

    @Test
    void failure_is_recorded_as_error_only() throws Exception {
        JobDefinition job = JobDefinition.of("broken", p -> p.at(AT), (at, n) -> {
            throw new IllegalStateException("disk full");
        });

        ExecutionResult res = coordinator.execute(job, AT);

        assertEquals(Outcome.FAILED, res.outcome());
        RunRecord r = ledger.findById(res.recordId()).orElseThrow();
        assertNull(r.result());
        assertTrue(r.error().contains("disk full"));
        assertTrue(r.isFinished());
        assertFalse(r.succeeded());
        assertTrue(sink.contains(LogLevel.ERROR, "Exception \"broken\""));
    }

    @Test
    void null_result_is_stored_as_null() throws Exception {
        JobDefinition job = JobDefinition.of("quiet", p -> p.at(AT), (at, n) -> null);

        ExecutionResult res = coordinator.execute(job, AT);

        RunRecord r = ledger.findById(res.recordId()).orElseThrow();
        assertNull(r.result());
        assertNull(r.error());
        assertTrue(r.succeeded());
    }

    @Test
    void job_receives_truncated_intended_instant_and_name() {
        Instant[] seen = new Instant[1];
        String[] seenName = new String[1];
        JobDefinition job = JobDefinition.of("echo", p -> p.at(AT), (at, n) -> {
            seen[0] = at;
            seenName[0] = n;
            return at;
        });

        coordinator.execute(job, AT.plusMillis(999));

        assertEquals(AT, seen[0]);
        assertEquals("echo", seenName[0]);
    }

    @Test
    void unpersisted_job_runs_every_time_without_records() {
        JobDefinition job = counting("volatile").withPersist(false);

        ExecutionResult first = coordinator.execute(job, AT);
        ExecutionResult second = coordinator.execute(job, AT);

        assertEquals(Outcome.UNRECORDED_COMPLETED, first.outcome());
        assertEquals(Outcome.UNRECORDED_COMPLETED, second.outcome());
        assertNull(first.recordId());
        assertEquals(2, runs.get());
        assertEquals(0, ledger.size());
    }

    @Test
    void unpersisted_failure_is_only_logged() {
        JobDefinition job = JobDefinition.of("volatile", p -> p.at(AT), (at, n) -> {
            throw new RuntimeException("nope");
        }).withPersist(false);

        ExecutionResult res = coordinator.execute(job, AT);

        assertEquals(Outcome.UNRECORDED_FAILED, res.outcome());
        assertTrue(res.ran());
        assertEquals(0, ledger.size());
        assertTrue(sink.contains(LogLevel.ERROR, "nope"));
    }

    @Test
    void store_error_on_claim_skips_the_run() {
        ledger.claimFailure = new SQLException("connection reset");

        ExecutionResult res = coordinator.execute(counting("report"), AT);

        assertEquals(Outcome.SKIPPED_STORE_ERROR, res.outcome());
        assertFalse(res.ran());
        assertEquals(0, runs.get());
        assertTrue(sink.contains(LogLevel.ERROR, "connection reset"));
    }

    @Test
    void store_error_on_completion_still_reports_the_run() {
        ledger.finishFailure = new SQLException("timeout");

        ExecutionResult res = coordinator.execute(counting("report"), AT);

        assertEquals(Outcome.COMPLETED, res.outcome());
        assertEquals(1, runs.get());
        assertTrue(sink.contains(LogLevel.ERROR, "Could not record outcome of \"report\""));
    }

    @Test
    void start_and_finish_are_logged_with_tag() {
        coordinator.execute(counting("report"), AT);

        assertTrue(sink.contains(LogLevel.INFO, "Starting \"report\"."));
        assertTrue(sink.contains(LogLevel.INFO, "Finished \"report\"."));
        assertTrue(sink.events().stream().allMatch(e -> SchedulerLog.DEFAULT_TAG.equals(e.tag())));
    }

    @Test
    void error_thrown_by_job_is_recorded_before_it_propagates() throws Exception {
        JobDefinition job = JobDefinition.of("broken", p -> p.at(AT), (at, n) -> {
            throw new AssertionError("bad");
        });

        AssertionError thrown = assertThrows(AssertionError.class, () -> coordinator.execute(job, AT));
        assertEquals("bad", thrown.getMessage());

        RunRecord r = ledger.findByOccurrence(AT, "broken").orElseThrow();
        assertNotNull(r.finishedAt());
        assertNotNull(r.error());
        assertTrue(r.error().contains("AssertionError: bad"));
        assertNull(r.result());
        assertTrue(sink.contains(LogLevel.ERROR, "Exception \"broken\""));
    }

    @Test
    void error_from_unrecorded_job_is_logged_and_propagates() {
        JobDefinition job = JobDefinition.of("quiet", p -> p.at(AT), (at, n) -> {
            throw new NoClassDefFoundError("gone");
        }).withPersist(false);

        assertThrows(NoClassDefFoundError.class, () -> coordinator.execute(job, AT));
        assertEquals(0, ledger.size());
        assertTrue(sink.contains(LogLevel.ERROR, "Exception \"quiet\""));
    }
}
