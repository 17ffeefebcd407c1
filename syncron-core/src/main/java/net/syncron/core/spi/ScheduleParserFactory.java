package net.syncron.core.spi;

import java.time.ZoneId;

/** 스케줄러 시간대(SchedulerOptions.timeMode)로 파서를 만든다 */
@FunctionalInterface
public interface ScheduleParserFactory {
    ScheduleParser create(ZoneId zone);
}
