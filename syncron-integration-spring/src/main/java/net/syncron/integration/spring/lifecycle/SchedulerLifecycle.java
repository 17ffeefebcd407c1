package net.syncron.integration.spring.lifecycle;

import net.syncron.core.service.SyncedScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.List;

/**
 * 스프링 컨텍스트 수명에 스케줄러를 묶는다.
 * start: initialize → 등록 콜백 → (autoStart 면) start. stop: pause. 자원 해제는 빈 destroy(close) 에서.
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLifecycle.class);

    private final SyncedScheduler scheduler;
    private final List<SchedulerConfigurer> configurers;
    private final boolean autoStart;

    private volatile boolean running;
    private boolean configured;

    public SchedulerLifecycle(SyncedScheduler scheduler, List<SchedulerConfigurer> configurers, boolean autoStart) {
        this.scheduler = scheduler;
        this.configurers = List.copyOf(configurers);
        this.autoStart = autoStart;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        try {
            scheduler.initialize();
            if (!configured) {
                for (SchedulerConfigurer c : configurers) {
                    c.configure(scheduler);
                }
                configured = true;
            }
        } catch (Exception e) {
            throw new IllegalStateException("Could not start synced scheduler", e);
        }
        if (autoStart) {
            scheduler.start();
            log.info("Synced scheduler started with jobs {}", scheduler.jobNames());
        } else {
            log.info("Synced scheduler ready, auto-start disabled (jobs {})", scheduler.jobNames());
        }
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        scheduler.pause();
        running = false;
    }

    @Override
    public boolean isRunning() { return running; }
}
