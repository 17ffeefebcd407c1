package net.syncron.core.timer;

import java.time.Instant;

@FunctionalInterface
public interface OccurrenceCallback {
    void fire(Instant intendedAt) throws Exception;
}
