package net.syncron.core.schedule;

import net.syncron.core.spi.OccurrenceSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * epoch 기준으로 정렬된 고정 간격. 모든 프로세스가 같은 발생 시각(=같은 원장 키)을 얻는다.
 */
public final class IntervalOccurrenceSource implements OccurrenceSource {
    private final long intervalMillis;

    public IntervalOccurrenceSource(Duration interval) {
        if (interval == null || interval.compareTo(Duration.ofSeconds(1)) < 0) {
            throw new IllegalArgumentException("interval must be at least 1 second: " + interval);
        }
        this.intervalMillis = interval.toMillis();
    }

    @Override
    public List<Instant> next(int count, Instant after) {
        List<Instant> out = new ArrayList<>(Math.max(count, 0));
        long slot = Math.floorDiv(after.toEpochMilli(), intervalMillis) + 1;
        for (int i = 0; i < count; i++) {
            out.add(Instant.ofEpochMilli((slot + i) * intervalMillis));
        }
        return out;
    }

    @Override
    public String toString() { return "every(" + Duration.ofMillis(intervalMillis) + ")"; }
}
