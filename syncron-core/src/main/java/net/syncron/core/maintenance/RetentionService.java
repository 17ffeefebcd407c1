package net.syncron.core.maintenance;

import net.syncron.core.spi.Clock;
import net.syncron.core.spi.RunLedger;
import net.syncron.core.spi.TxRunner;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 원장 보존 기간 정리. TTL 인덱스가 없는 저장소를 위해 주기적으로 호출된다.
 * 정리 대상은 startedAt 기준이라 끝나지 않은(매달린) 기록도 결국 지워진다.
 */
public final class RetentionService {
    private final RunLedger ledger;
    private final TxRunner tx;
    private final Clock clock;
    private final Duration retention;

    public RetentionService(RunLedger ledger, TxRunner tx, Clock clock, Duration retention) {
        this.ledger = Objects.requireNonNull(ledger);
        this.tx = Objects.requireNonNull(tx);
        this.clock = Objects.requireNonNull(clock);
        if (retention == null || retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("retention must be positive: " + retention);
        }
        this.retention = retention;
    }

    public RetentionReport runOnce() throws Exception {
        Instant now = clock.now();
        RetentionReport r = new RetentionReport();
        r.threshold = now.minus(retention);
        r.expired = tx.requiresNew(() -> ledger.expireStartedBefore(r.threshold));
        r.timestamp = now;
        return r;
    }

    /** 간단 리포트 DTO */
    public static final class RetentionReport {
        public Instant timestamp;
        public Instant threshold;
        public int expired;

        @Override public String toString() {
            return "RetentionReport{" +
                    "timestamp=" + timestamp +
                    ", threshold=" + threshold +
                    ", expired=" + expired +
                    '}';
        }
    }
}
