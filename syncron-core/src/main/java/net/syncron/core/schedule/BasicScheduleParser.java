package net.syncron.core.schedule;

import net.syncron.core.spi.OccurrenceSource;
import net.syncron.core.spi.ScheduleParser;

import java.time.Duration;
import java.time.Instant;

/**
 * cron 구현이 없는 기본 파서. cron 은 integration 모듈(cron-utils)에서 제공한다.
 */
public class BasicScheduleParser implements ScheduleParser {

    @Override
    public OccurrenceSource cron(String expression) {
        throw new UnsupportedOperationException("cron schedules need a cron-capable ScheduleParser: " + expression);
    }

    @Override
    public OccurrenceSource at(Instant instant) {
        return new OneOffOccurrenceSource(instant);
    }

    @Override
    public OccurrenceSource every(Duration interval) {
        return new IntervalOccurrenceSource(interval);
    }
}
