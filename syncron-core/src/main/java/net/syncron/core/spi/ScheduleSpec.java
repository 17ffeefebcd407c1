package net.syncron.core.spi;

@FunctionalInterface
public interface ScheduleSpec {
    OccurrenceSource schedule(ScheduleParser parser);
}
