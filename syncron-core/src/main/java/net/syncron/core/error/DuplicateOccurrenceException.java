package net.syncron.core.error;

import java.time.Instant;

/**
 * 같은 (intendedAt, name) 이 이미 원장에 있음. 오류가 아니라 "다른 인스턴스가 가져갔다"는 신호.
 */
public class DuplicateOccurrenceException extends Exception {
    private final String name;
    private final Instant intendedAt;

    public DuplicateOccurrenceException(String name, Instant intendedAt, Throwable cause) {
        super("Occurrence already claimed: " + name + " @ " + intendedAt, cause);
        this.name = name;
        this.intendedAt = intendedAt;
    }

    public DuplicateOccurrenceException(String name, Instant intendedAt) {
        this(name, intendedAt, null);
    }

    public String name() { return name; }

    public Instant intendedAt() { return intendedAt; }
}
