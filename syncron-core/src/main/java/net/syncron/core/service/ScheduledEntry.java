package net.syncron.core.service;

import net.syncron.core.model.JobDefinition;
import net.syncron.core.spi.OccurrenceSource;
import net.syncron.core.timer.TimerHandle;
import net.syncron.core.timer.TimerState;

/** 레지스트리 전용: 잡 정의 + 살아있는 타이머 핸들 */
final class ScheduledEntry {
    final JobDefinition definition;
    final OccurrenceSource source;
    private TimerHandle timer;

    ScheduledEntry(JobDefinition definition, OccurrenceSource source) {
        this.definition = definition;
        this.source = source;
    }

    /** 살아있는 타이머가 있는지. 소진/취소된 핸들은 없는 것으로 본다 */
    boolean isScheduled() {
        return timer != null && !timer.exhausted() && timer.state() != TimerState.CANCELLED;
    }

    TimerHandle timer() { return timer; }

    void attach(TimerHandle handle) { this.timer = handle; }

    /** @return 취소한 핸들. 없었으면 null */
    TimerHandle cancel() {
        TimerHandle cancelled = timer;
        if (cancelled != null) {
            cancelled.cancel();
            timer = null;
        }
        return cancelled;
    }
}
