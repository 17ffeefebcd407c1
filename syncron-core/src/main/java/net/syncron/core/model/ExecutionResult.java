package net.syncron.core.model;

import java.time.Instant;

/** 발생 1건을 처리한 결과. recordId 는 원장에 행이 있을 때만 채워진다. */
public record ExecutionResult(
        String name,
        Instant intendedAt,
        Outcome outcome,
        Long recordId
) {
    public enum Outcome {
        COMPLETED,
        FAILED,
        SKIPPED_DUPLICATE,      // 다른 프로세스(또는 이전 시도)가 이미 선점
        SKIPPED_STORE_ERROR,    // claim 단계 저장소 오류 → 보수적으로 실행 안 함
        UNRECORDED_COMPLETED,   // persist=false
        UNRECORDED_FAILED;

        public boolean ran() {
            return this == COMPLETED || this == FAILED
                    || this == UNRECORDED_COMPLETED || this == UNRECORDED_FAILED;
        }
    }

    public boolean ran() { return outcome.ran(); }
}
