package net.syncron.core.service;

import net.syncron.core.config.SchedulerOptions;
import net.syncron.core.error.LedgerInitializationException;
import net.syncron.core.log.SchedulerLog;
import net.syncron.core.maintenance.RetentionService;
import net.syncron.core.model.ExecutionResult;
import net.syncron.core.model.JobDefinition;
import net.syncron.core.model.RunRecord;
import net.syncron.core.model.SchedulerState;
import net.syncron.core.schedule.BasicScheduleParser;
import net.syncron.core.spi.Clock;
import net.syncron.core.spi.RunLedger;
import net.syncron.core.spi.ScheduleParserFactory;
import net.syncron.core.spi.TxRunner;
import net.syncron.core.timer.Cancellable;
import net.syncron.core.timer.ExecutorTimerService;
import net.syncron.core.timer.RecurringTimer;
import net.syncron.core.timer.TimerService;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;

/**
 * 호스트 프로세스가 소유하는 스케줄러 인스턴스.
 * 여러 프로세스가 같은 원장을 공유하면 발생 1건은 그중 한 곳에서만 실행된다.
 *
 * <pre>{@code
 * SyncedScheduler scheduler = SyncedScheduler.builder()
 *         .options(options)
 *         .ledger(ledger)
 *         .txRunner(tx)
 *         .build();
 * scheduler.initialize();
 * scheduler.add(JobDefinition.of("report", p -> p.cron("0 15 10 * * ?"), (at, name) -> render(at)));
 * scheduler.start();
 * }</pre>
 */
public final class SyncedScheduler implements AutoCloseable {
    static final String TTL_FLOOR_WARNING =
            "Not going to use a TTL that is shorter than: " + SchedulerOptions.MIN_RETENTION_SECONDS;

    private final SchedulerOptions options;
    private final SchedulerLog log;
    private final RunLedger ledger;
    private final TxRunner tx;
    private final TimerService timers;
    private final boolean ownsTimers;
    private final JobRegistry registry;
    private final ExecutionCoordinator coordinator;
    private final RetentionService retention; // null 이면 만료 비활성

    private boolean initialized;
    private boolean closed;
    private Cancellable purge;

    private SyncedScheduler(Builder b) {
        this.options = b.options;
        this.log = new SchedulerLog(options.log(), options.logger().orElse(null), SchedulerLog.DEFAULT_TAG);
        this.ledger = Objects.requireNonNull(b.ledger, "ledger");
        this.tx = b.tx;
        this.ownsTimers = b.timers == null;
        this.timers = ownsTimers ? ExecutorTimerService.create(options.workerThreads()) : b.timers;

        RecurringTimer timer = b.maxTimerDelay == null
                ? new RecurringTimer(timers, b.clock, log)
                : new RecurringTimer(timers, b.clock, log, b.maxTimerDelay);
        this.coordinator = new ExecutionCoordinator(ledger, tx, b.clock, log);
        this.registry = new JobRegistry(b.parsers.create(options.timeMode().zone()), timer, coordinator, b.clock, log);
        this.retention = options.effectiveRetention()
                .map(d -> new RetentionService(ledger, tx, b.clock, d))
                .orElse(null);
    }

    public static Builder builder() { return new Builder(); }

    /**
     * 원장 준비(유니크 인덱스 포함)와 보존 기간 정리 예약. 두 번째 호출부터는 아무것도 하지 않는다.
     *
     * @throws LedgerInitializationException 준비 실패 + failOnInitError=true
     */
    public synchronized void initialize() throws LedgerInitializationException {
        if (initialized) return;
        try {
            ledger.prepare();
        } catch (Exception e) {
            log.error("Error creating indexes: " + e.getMessage(), e);
            if (options.failOnInitError()) {
                throw new LedgerInitializationException(
                        "Could not prepare run ledger '" + options.storeName() + "'", e);
            }
            log.warn("Continuing without a prepared run ledger, duplicate runs are possible.");
        }
        if (options.retentionBelowFloor()) {
            log.warn(TTL_FLOOR_WARNING);
        }
        initialized = true;
        if (retention != null) {
            schedulePurge();
        }
    }

    /** @return 새로 등록했으면 true. 같은 이름이 있으면 false */
    public boolean add(JobDefinition definition) { return registry.add(definition); }

    public void start() { registry.start(); }

    public void pause() { registry.pause(); }

    public void stop() { registry.stop(); }

    public boolean remove(String name) { return registry.remove(name); }

    public Optional<Instant> nextOccurrence(String name) { return registry.nextOccurrence(name); }

    public List<String> jobNames() { return registry.jobNames(); }

    public SchedulerState state() { return registry.state(); }

    public boolean isRunning() { return registry.isRunning(); }

    /**
     * 등록된 잡의 발생 1건을 호출 스레드에서 바로 처리한다. 원장 선점 규칙은 타이머 발화와 같다.
     *
     * @return 모르는 이름이면 empty
     */
    public Optional<ExecutionResult> runNow(String name, Instant intendedAt) {
        return registry.definition(name).map(def -> coordinator.execute(def, intendedAt));
    }

    /** 최근 실행 기록(최신 순) */
    public List<RunRecord> history(String name, int limit) throws Exception {
        return tx.required(() -> ledger.findByName(name, limit));
    }

    /** 테스트용: 전부 멈추고 등록/원장 기록을 비운다 */
    public void reset() throws Exception {
        registry.stop();
        int deleted = tx.requiresNew(ledger::deleteAll);
        log.debug("Reset removed " + deleted + " run records.");
    }

    public SchedulerOptions options() { return options; }

    JobRegistry registry() { return registry; }

    @Override
    public void close() {
        registry.stop();
        synchronized (this) {
            closed = true;
            if (purge != null) {
                purge.cancel();
                purge = null;
            }
        }
        if (ownsTimers) {
            timers.close();
        }
    }

    private synchronized void schedulePurge() {
        if (closed) return;
        try {
            purge = timers.schedule(() -> timers.execute(this::purgeAndReschedule), options.purgeInterval());
        } catch (RejectedExecutionException e) {
            log.debug("Retention sweep not scheduled: " + e.getMessage());
        }
    }

    private void purgeAndReschedule() {
        try {
            RetentionService.RetentionReport report = retention.runOnce();
            if (report.expired > 0) {
                log.debug("Expired " + report.expired + " run records started before " + report.threshold);
            }
        } catch (Exception e) {
            log.warn("Retention sweep failed: " + e.getMessage());
        }
        schedulePurge();
    }

    public static final class Builder {
        private SchedulerOptions options = SchedulerOptions.defaults();
        private RunLedger ledger;
        private TxRunner tx = TxRunner.direct();
        private ScheduleParserFactory parsers = zone -> new BasicScheduleParser();
        private TimerService timers;
        private Clock clock = Clock.system();
        private Duration maxTimerDelay;

        private Builder() {}

        public Builder options(SchedulerOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        public Builder ledger(RunLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        public Builder txRunner(TxRunner tx) {
            this.tx = Objects.requireNonNull(tx, "txRunner");
            return this;
        }

        /** cron 이 필요하면 cron 지원 파서를 넘긴다. 시간대는 options.timeMode 에서 온다 */
        public Builder scheduleParser(ScheduleParserFactory parsers) {
            this.parsers = Objects.requireNonNull(parsers, "scheduleParser");
            return this;
        }

        /** 넘기면 수명은 호출자 소유. 생략하면 스케줄러가 만들고 close() 에서 닫는다 */
        public Builder timerService(TimerService timers) {
            this.timers = timers;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /** 타이머 1회 대기 상한. 기본은 {@link RecurringTimer#MAX_DELAY} */
        public Builder maxTimerDelay(Duration maxTimerDelay) {
            this.maxTimerDelay = maxTimerDelay;
            return this;
        }

        public SyncedScheduler build() {
            return new SyncedScheduler(this);
        }
    }
}
