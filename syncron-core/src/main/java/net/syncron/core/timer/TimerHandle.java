package net.syncron.core.timer;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

public interface TimerHandle {
    /** 이후 발생을 모두 막는다. 실행 중인 콜백은 끝까지 돈다. 여러 번 호출해도 된다. */
    void cancel();

    TimerState state();

    /** 스케줄에 더 이상 발생이 없어 멈춘 상태 */
    boolean exhausted();

    /** 대기 중인 발생 시각 (WAITING 일 때만) */
    Optional<Instant> pendingOccurrence();

    /** 취소 또는 소진 뒤, 실행 중이던 콜백까지 끝나면 완료된다 */
    CompletionStage<Void> settled();
}
