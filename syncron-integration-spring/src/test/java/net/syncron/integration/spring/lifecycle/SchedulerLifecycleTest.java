package net.syncron.integration.spring.lifecycle;

import net.syncron.core.config.SchedulerOptions;
import net.syncron.core.model.JobDefinition;
import net.syncron.core.model.SchedulerState;
import net.syncron.core.service.SyncedScheduler;
import net.syncron.core.support.InMemoryRunLedger;
import net.syncron.core.support.ManualTimerService;
import net.syncron.core.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchedulerLifecycleTest {

    InMemoryRunLedger ledger;
    SyncedScheduler scheduler;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2030-01-01T00:00:00Z"));
        ledger = new InMemoryRunLedger();
        scheduler = SyncedScheduler.builder()
                .options(SchedulerOptions.builder().log(false).build())
                .ledger(ledger)
                .timerService(new ManualTimerService(clock))
                .clock(clock)
                .build();
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    SchedulerConfigurer oneJob() {
        return s -> s.add(JobDefinition.of("job", p -> p.every(Duration.ofMinutes(1)), (at, n) -> null));
    }

    @Test
    void start_initializes_registers_and_starts() {
        SchedulerLifecycle lifecycle = new SchedulerLifecycle(scheduler, List.of(oneJob()), true);

        lifecycle.start();

        assertThat(ledger.prepareCalls.get()).isEqualTo(1);
        assertThat(scheduler.jobNames()).containsExactly("job");
        assertThat(scheduler.state()).isEqualTo(SchedulerState.RUNNING);
        assertThat(lifecycle.isRunning()).isTrue();
    }

    @Test
    void auto_start_off_leaves_scheduler_stopped() {
        SchedulerLifecycle lifecycle = new SchedulerLifecycle(scheduler, List.of(oneJob()), false);

        lifecycle.start();

        assertThat(scheduler.jobNames()).containsExactly("job");
        assertThat(scheduler.state()).isEqualTo(SchedulerState.STOPPED);
    }

    @Test
    void stop_pauses_and_restart_resumes_without_reregistering() {
        SchedulerLifecycle lifecycle = new SchedulerLifecycle(scheduler, List.of(oneJob()), true);
        lifecycle.start();

        lifecycle.stop();
        assertThat(scheduler.state()).isEqualTo(SchedulerState.PAUSED);
        assertThat(lifecycle.isRunning()).isFalse();

        lifecycle.start();
        assertThat(scheduler.state()).isEqualTo(SchedulerState.RUNNING);
        assertThat(scheduler.jobNames()).containsExactly("job");
    }

    @Test
    void init_failure_aborts_startup() {
        ledger.prepareFailure = new SQLException("denied");
        SchedulerLifecycle lifecycle = new SchedulerLifecycle(scheduler, List.of(), true);

        assertThatThrownBy(lifecycle::start)
                .isInstanceOf(IllegalStateException.class)
                .hasRootCauseInstanceOf(SQLException.class);
        assertThat(lifecycle.isRunning()).isFalse();
    }
}
