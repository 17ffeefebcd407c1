package net.syncron.core.timer;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ScheduledExecutorService(대기) + 별도 작업 풀(잡 실행) 기반 구현.
 * 잡이 멈춰도 그 잡의 연쇄만 막히고 다른 잡 타이머는 영향이 없다.
 */
public final class ExecutorTimerService implements TimerService {
    private final ScheduledExecutorService timers;
    private final ExecutorService workers;
    private final boolean owned;

    /** 외부에서 넘긴 실행기. 수명 관리는 호출자 책임 */
    public ExecutorTimerService(ScheduledExecutorService timers, ExecutorService workers) {
        this(timers, workers, false);
    }

    private ExecutorTimerService(ScheduledExecutorService timers, ExecutorService workers, boolean owned) {
        this.timers = Objects.requireNonNull(timers);
        this.workers = Objects.requireNonNull(workers);
        this.owned = owned;
    }

    /**
     * @param coreWorkers 유지할 작업 스레드 수. 부족하면 스레드를 더 만든다(큐잉하지 않음)
     */
    public static ExecutorTimerService create(int coreWorkers) {
        ScheduledExecutorService timers = Executors.newSingleThreadScheduledExecutor(daemonFactory("syncron-timer"));
        ThreadPoolExecutor workers = new ThreadPoolExecutor(
                coreWorkers, Integer.MAX_VALUE,
                60, TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                daemonFactory("syncron-worker"));
        return new ExecutorTimerService(timers, workers, true);
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> f = timers.schedule(task, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        return () -> f.cancel(false);
    }

    @Override
    public void execute(Runnable task) {
        workers.execute(task);
    }

    @Override
    public void close() {
        if (!owned) return;
        timers.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
