package net.syncron.core.schedule;

import net.syncron.core.spi.OccurrenceSource;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** 고정 시각 1회. 그 시각이 지나면 소진 */
public final class OneOffOccurrenceSource implements OccurrenceSource {
    private final Instant at;

    public OneOffOccurrenceSource(Instant at) {
        this.at = Objects.requireNonNull(at, "at");
    }

    @Override
    public List<Instant> next(int count, Instant after) {
        if (count <= 0 || !at.isAfter(after)) return List.of();
        return List.of(at);
    }

    @Override
    public String toString() { return "at(" + at + ")"; }
}
