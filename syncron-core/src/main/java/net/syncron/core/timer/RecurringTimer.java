package net.syncron.core.timer;

import net.syncron.core.log.SchedulerLog;
import net.syncron.core.spi.Clock;
import net.syncron.core.spi.OccurrenceSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;

/**
 * 발생 시각 소스를 단발 타이머의 연쇄로 바꾼다. 고정 주기가 아니라 매 사이클마다
 * "지금" 기준으로 다음 발생을 다시 계산한다.
 * <ul>
 *   <li>1초 미만으로 남은 발생은 건너뛰고 그 다음 발생을 쓴다</li>
 *   <li>대기 시간이 타이머 상한을 넘으면 상한만큼 기다린 뒤 재평가만 한다(콜백 호출 없음)</li>
 *   <li>콜백 실패는 로그만 남기고 연쇄는 계속된다</li>
 * </ul>
 */
public final class RecurringTimer {
    public static final Duration MIN_FIRE_DELAY = Duration.ofSeconds(1);
    /** 32bit 밀리초 타이머 상한 (약 24.8일) */
    public static final Duration MAX_DELAY = Duration.ofMillis(Integer.MAX_VALUE);

    private final TimerService timers;
    private final Clock clock;
    private final SchedulerLog log;
    private final Duration maxDelay;

    public RecurringTimer(TimerService timers, Clock clock, SchedulerLog log) {
        this(timers, clock, log, MAX_DELAY);
    }

    public RecurringTimer(TimerService timers, Clock clock, SchedulerLog log, Duration maxDelay) {
        this.timers = Objects.requireNonNull(timers);
        this.clock = Objects.requireNonNull(clock);
        this.log = Objects.requireNonNull(log);
        if (maxDelay.compareTo(MIN_FIRE_DELAY) <= 0) {
            throw new IllegalArgumentException("maxDelay must be longer than " + MIN_FIRE_DELAY + ": " + maxDelay);
        }
        this.maxDelay = maxDelay;
    }

    public TimerHandle start(OccurrenceCallback callback, OccurrenceSource source) {
        return start(callback, source, null);
    }

    /**
     * after 가 끝난 뒤에야 첫 계획을 세운다. 같은 잡의 이전 연쇄가 아직 콜백을 돌리는 중이면
     * 그 연쇄의 {@link TimerHandle#settled()} 를 넘겨 실행이 겹치지 않게 한다.
     */
    public TimerHandle start(OccurrenceCallback callback, OccurrenceSource source, CompletionStage<?> after) {
        Chain chain = new Chain(Objects.requireNonNull(callback), Objects.requireNonNull(source));
        if (after == null) {
            chain.plan();
        } else {
            after.whenComplete((v, e) -> chain.plan());
        }
        return chain;
    }

    /**
     * 잡 하나의 타이머 상태 기계. IDLE → WAITING → FIRING → WAITING ... , 언제든 → CANCELLED.
     */
    private final class Chain implements TimerHandle {
        private final OccurrenceCallback callback;
        private final OccurrenceSource source;

        private final CompletableFuture<Void> settled = new CompletableFuture<>();

        private TimerState state = TimerState.IDLE;
        private boolean inFlight;
        private Cancellable pending;
        private Instant pendingOccurrence;
        private boolean exhausted;

        Chain(OccurrenceCallback callback, OccurrenceSource source) {
            this.callback = callback;
            this.source = source;
        }

        /** 다음 사이클 계획. 콜백 완료 후와 상한 재평가 시에도 호출된다 */
        void plan() {
            boolean done;
            synchronized (this) {
                done = planLocked();
            }
            if (done) settled.complete(null);
        }

        /** @return 이번 계획으로 소진됐으면 true */
        private boolean planLocked() {
            if (state == TimerState.CANCELLED) return false;
            pending = null;
            pendingOccurrence = null;

            Instant now = clock.now();
            List<Instant> next;
            try {
                next = source.next(2, now);
            } catch (RuntimeException e) {
                log.error("Could not evaluate schedule, timer stopped.", e);
                exhaust();
                return true;
            }
            if (next.isEmpty()) {
                exhaust();
                return true;
            }

            Instant intendedAt = next.get(0);
            Duration delay = Duration.between(now, intendedAt);
            if (delay.compareTo(MIN_FIRE_DELAY) < 0) {
                if (next.size() < 2) {
                    log.debug("Only remaining occurrence " + intendedAt + " is less than "
                            + MIN_FIRE_DELAY.toMillis() + "ms away, schedule exhausted.");
                    exhaust();
                    return true;
                }
                intendedAt = next.get(1);
                delay = Duration.between(now, intendedAt);
            }
            if (delay.isNegative()) delay = Duration.ZERO;

            pendingOccurrence = intendedAt;
            state = TimerState.WAITING;
            try {
                if (delay.compareTo(maxDelay) > 0) {
                    pending = timers.schedule(this::plan, maxDelay);
                } else {
                    Instant target = intendedAt;
                    pending = timers.schedule(() -> wake(target), delay);
                }
            } catch (RejectedExecutionException e) {
                // 타이머 서비스가 이미 닫힘
                log.debug("Timer service rejected schedule: " + e.getMessage());
                state = TimerState.IDLE;
                pendingOccurrence = null;
            }
            return false;
        }

        private void wake(Instant intendedAt) {
            synchronized (this) {
                if (state == TimerState.CANCELLED) return;
                state = TimerState.FIRING;
                inFlight = true;
                pending = null;
                pendingOccurrence = null;
            }
            try {
                timers.execute(() -> fire(intendedAt));
            } catch (RejectedExecutionException e) {
                log.debug("Worker rejected occurrence " + intendedAt + ": " + e.getMessage());
                synchronized (this) {
                    if (state != TimerState.CANCELLED) state = TimerState.IDLE;
                }
                finishFlight();
            }
        }

        private void fire(Instant intendedAt) {
            boolean cancelled;
            synchronized (this) {
                cancelled = state == TimerState.CANCELLED;
            }
            // 작업 풀에 넘긴 뒤 실행 전에 취소된 경우
            if (!cancelled) {
                try {
                    callback.fire(intendedAt);
                } catch (Throwable t) {
                    log.error("Exception running scheduled job", t);
                }
            }
            finishFlight();
            plan();
        }

        /** settled 완료는 모니터 밖에서 (이어지는 연쇄가 같은 스레드에서 계획을 세운다) */
        private void finishFlight() {
            boolean done;
            synchronized (this) {
                inFlight = false;
                done = state == TimerState.CANCELLED;
            }
            if (done) settled.complete(null);
        }

        private void exhaust() {
            exhausted = true;
            state = TimerState.IDLE;
        }

        @Override
        public void cancel() {
            boolean done;
            synchronized (this) {
                if (state == TimerState.CANCELLED) return;
                state = TimerState.CANCELLED;
                pendingOccurrence = null;
                if (pending != null) {
                    pending.cancel();
                    pending = null;
                }
                done = !inFlight;
            }
            if (done) settled.complete(null);
        }

        @Override
        public synchronized TimerState state() { return state; }

        @Override
        public synchronized boolean exhausted() { return exhausted; }

        @Override
        public synchronized Optional<Instant> pendingOccurrence() {
            return state == TimerState.WAITING ? Optional.ofNullable(pendingOccurrence) : Optional.empty();
        }

        @Override
        public CompletionStage<Void> settled() { return settled; }
    }
}
