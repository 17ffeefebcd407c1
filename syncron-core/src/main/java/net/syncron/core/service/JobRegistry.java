package net.syncron.core.service;

import net.syncron.core.error.InvalidJobException;
import net.syncron.core.log.SchedulerLog;
import net.syncron.core.model.JobDefinition;
import net.syncron.core.model.SchedulerState;
import net.syncron.core.spi.Clock;
import net.syncron.core.spi.OccurrenceSource;
import net.syncron.core.spi.ScheduleParser;
import net.syncron.core.timer.RecurringTimer;
import net.syncron.core.timer.TimerHandle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * 이름 → 잡 엔트리 맵과 STOPPED/RUNNING/PAUSED 수명주기.
 * 호스트 스레드와 타이머 스레드가 동시에 부를 수 있어 모든 변경은 this 로 동기화한다.
 */
public final class JobRegistry {
    private final ScheduleParser parser;
    private final RecurringTimer timer;
    private final ExecutionCoordinator coordinator;
    private final Clock clock;
    private final SchedulerLog log;

    private final Map<String, ScheduledEntry> entries = new LinkedHashMap<>();
    /** 취소됐지만 콜백이 아직 도는 타이머. 같은 이름의 새 연쇄는 이게 끝난 뒤에 계획한다 */
    private final Map<String, TimerHandle> retiring = new HashMap<>();
    private SchedulerState state = SchedulerState.STOPPED;

    public JobRegistry(ScheduleParser parser,
                       RecurringTimer timer,
                       ExecutionCoordinator coordinator,
                       Clock clock,
                       SchedulerLog log) {
        this.parser = parser;
        this.timer = timer;
        this.coordinator = coordinator;
        this.clock = clock;
        this.log = log;
    }

    /**
     * 잡 등록. 같은 이름이 이미 있으면 아무것도 하지 않는다.
     *
     * @return 새로 등록했으면 true
     * @throws InvalidJobException 정의가 잘못됐거나 스케줄을 평가할 수 없을 때
     */
    public synchronized boolean add(JobDefinition definition) {
        validate(definition);
        if (entries.containsKey(definition.name())) {
            log.debug("Job \"" + definition.name() + "\" already registered, ignoring.");
            return false;
        }
        ScheduledEntry entry = new ScheduledEntry(definition, evaluate(definition));
        entries.put(definition.name(), entry);
        if (state == SchedulerState.RUNNING) {
            schedule(entry);
        }
        return true;
    }

    public synchronized void start() {
        for (ScheduledEntry entry : entries.values()) {
            if (!entry.isScheduled()) {
                schedule(entry);
            }
        }
        state = SchedulerState.RUNNING;
    }

    /** 타이머만 멈추고 엔트리는 유지. start() 로 재개 */
    public synchronized void pause() {
        for (ScheduledEntry entry : entries.values()) {
            retire(entry);
        }
        if (state == SchedulerState.RUNNING) {
            state = SchedulerState.PAUSED;
        }
    }

    public synchronized boolean remove(String name) {
        ScheduledEntry entry = entries.remove(name);
        if (entry == null) return false;
        retire(entry);
        log.info("Removed \"" + name + "\"");
        return true;
    }

    public synchronized void stop() {
        for (String name : new ArrayList<>(entries.keySet())) {
            remove(name);
        }
        state = SchedulerState.STOPPED;
    }

    /** 지금 기준 다음 발생. 모르는 이름이거나 소진됐으면 empty */
    public Optional<Instant> nextOccurrence(String name) {
        OccurrenceSource source;
        synchronized (this) {
            ScheduledEntry entry = entries.get(name);
            if (entry == null) return Optional.empty();
            source = entry.source;
        }
        try {
            return source.next(clock.now());
        } catch (RuntimeException e) {
            log.warn("Could not evaluate schedule of \"" + name + "\": " + e.getMessage());
            return Optional.empty();
        }
    }

    public synchronized Optional<JobDefinition> definition(String name) {
        ScheduledEntry entry = entries.get(name);
        return entry == null ? Optional.empty() : Optional.of(entry.definition);
    }

    public synchronized List<String> jobNames() {
        List<String> names = new ArrayList<>(entries.keySet());
        names.sort(null);
        return names;
    }

    public synchronized boolean contains(String name) { return entries.containsKey(name); }

    public synchronized SchedulerState state() { return state; }

    public synchronized boolean isRunning() { return state.isRunning(); }

    /** 테스트/진단용: 해당 잡의 타이머 핸들 */
    synchronized Optional<TimerHandle> timerOf(String name) {
        ScheduledEntry entry = entries.get(name);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.timer());
    }

    private void schedule(ScheduledEntry entry) {
        JobDefinition definition = entry.definition;
        TimerHandle previous = retiring.get(definition.name());
        CompletionStage<Void> after = previous == null ? null : previous.settled();
        TimerHandle handle = timer.start(
                intendedAt -> coordinator.execute(definition, intendedAt),
                entry.source,
                after);
        entry.attach(handle);
        if (after != null) {
            log.debug("\"" + definition.name() + "\" is still running, next run is planned after it finishes.");
            return;
        }
        handle.pendingOccurrence().ifPresentOrElse(
                at -> log.info("Scheduled \"" + definition.name() + "\" next run @ " + at),
                () -> log.debug("No upcoming occurrence for \"" + definition.name() + "\"."));
    }

    private void retire(ScheduledEntry entry) {
        TimerHandle cancelled = entry.cancel();
        if (cancelled == null || cancelled.settled().toCompletableFuture().isDone()) return;
        String name = entry.definition.name();
        retiring.put(name, cancelled);
        cancelled.settled().whenComplete((v, e) -> forget(name, cancelled));
    }

    private synchronized void forget(String name, TimerHandle handle) {
        retiring.remove(name, handle);
    }

    private OccurrenceSource evaluate(JobDefinition definition) {
        OccurrenceSource source;
        try {
            source = definition.schedule().schedule(parser);
        } catch (RuntimeException e) {
            throw new InvalidJobException("Invalid schedule for \"" + definition.name() + "\": " + e.getMessage(), e);
        }
        if (source == null) {
            throw new InvalidJobException("Schedule of \"" + definition.name() + "\" produced no occurrence source");
        }
        return source;
    }

    private static void validate(JobDefinition definition) {
        if (definition == null) {
            throw new InvalidJobException("job definition is required");
        }
        String name = definition.name();
        if (name == null || name.isBlank()) {
            throw new InvalidJobException("job name is required");
        }
        if (name.length() > JobDefinition.MAX_NAME_LENGTH) {
            throw new InvalidJobException("job name longer than " + JobDefinition.MAX_NAME_LENGTH + " chars: " + name);
        }
        if (definition.schedule() == null) {
            throw new InvalidJobException("schedule is required for \"" + name + "\"");
        }
        if (definition.job() == null) {
            throw new InvalidJobException("job is required for \"" + name + "\"");
        }
    }
}
