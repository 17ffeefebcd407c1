package net.syncron.core.timer;

import java.time.Duration;

/**
 * 단발 타이머 + 작업 실행기 추상화. 실제 대기 없이 타이머 동작을 테스트할 수 있게 분리.
 */
public interface TimerService extends AutoCloseable {
    /** delay 뒤 task 를 한 번 실행. task 는 짧게 끝나야 한다(타이머 스레드). */
    Cancellable schedule(Runnable task, Duration delay);

    /** 잡 실행처럼 오래 걸릴 수 있는 일은 여기로 */
    void execute(Runnable task);

    @Override
    void close();
}
