package net.syncron.core.model;

import java.time.Instant;

public record RunRecord(
        Long id,
        String name,
        Instant intendedAt,   // 초 단위로 절삭된 발생 시각 (name 과 함께 유니크)
        Instant startedAt,
        Instant finishedAt,
        String result,
        String error
) {
    public static RunRecord claimed(String name, Instant intendedAt, Instant startedAt) {
        return new RunRecord(null, name, intendedAt, startedAt, null, null, null);
    }

    public boolean isFinished() { return finishedAt != null; }

    public boolean succeeded() { return isFinished() && error == null; }

    public RunRecord withId(long id) {
        return new RunRecord(id, name, intendedAt, startedAt, finishedAt, result, error);
    }

    public RunRecord completed(Instant at, String result) {
        return new RunRecord(id, name, intendedAt, startedAt, at, result, null);
    }

    public RunRecord failed(Instant at, String error) {
        return new RunRecord(id, name, intendedAt, startedAt, at, null, error);
    }
}
