package net.syncron.core.config;

import net.syncron.core.log.LogSink;
import net.syncron.core.model.TimeMode;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 스케줄러 설정. 생성 시점에 기본값이 채워지고 이후 불변.
 */
public final class SchedulerOptions {
    /** 이보다 짧은 보존 기간은 분산 선점 경합을 관찰하기 전에 기록이 사라질 수 있어 쓰지 않는다 */
    public static final long MIN_RETENTION_SECONDS = 300;
    public static final long DEFAULT_RETENTION_SECONDS = 172_800; // 2일
    public static final String DEFAULT_STORE_NAME = "CRON_HISTORY";

    // 테이블/인덱스 이름에 그대로 들어가므로 식별자 규칙 + Oracle 30자 제한(접두/접미 포함) 고려
    private static final Pattern STORE_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]{0,19}");

    private final boolean log;
    private final LogSink logger;
    private final String storeName;
    private final TimeMode timeMode;
    private final long retentionSeconds;
    private final boolean failOnInitError;
    private final Duration purgeInterval;
    private final int workerThreads;

    private SchedulerOptions(Builder b) {
        this.log = b.log;
        this.logger = b.logger;
        this.storeName = b.storeName;
        this.timeMode = b.timeMode;
        this.retentionSeconds = b.retentionSeconds;
        this.failOnInitError = b.failOnInitError;
        this.purgeInterval = b.purgeInterval;
        this.workerThreads = b.workerThreads;
    }

    public static Builder builder() { return new Builder(); }

    public static SchedulerOptions defaults() { return builder().build(); }

    public boolean log() { return log; }

    public Optional<LogSink> logger() { return Optional.ofNullable(logger); }

    public String storeName() { return storeName; }

    public TimeMode timeMode() { return timeMode; }

    public long retentionSeconds() { return retentionSeconds; }

    public boolean failOnInitError() { return failOnInitError; }

    public Duration purgeInterval() { return purgeInterval; }

    public int workerThreads() { return workerThreads; }

    /** 0 이면 만료 비활성(의도적 해제) */
    public boolean retentionDisabled() { return retentionSeconds == 0; }

    /** 하한 미만 요청: 만료를 켜지 않는다 */
    public boolean retentionBelowFloor() {
        return retentionSeconds > 0 && retentionSeconds < MIN_RETENTION_SECONDS;
    }

    /** 실제로 적용할 보존 기간. 비활성/하한 미만이면 empty */
    public Optional<Duration> effectiveRetention() {
        if (retentionDisabled() || retentionBelowFloor()) return Optional.empty();
        return Optional.of(Duration.ofSeconds(retentionSeconds));
    }

    public Builder toBuilder() {
        return new Builder()
                .log(log)
                .logger(logger)
                .storeName(storeName)
                .timeMode(timeMode)
                .retentionSeconds(retentionSeconds)
                .failOnInitError(failOnInitError)
                .purgeInterval(purgeInterval)
                .workerThreads(workerThreads);
    }

    @Override
    public String toString() {
        return "SchedulerOptions{" +
                "log=" + log +
                ", customLogger=" + (logger != null) +
                ", storeName='" + storeName + '\'' +
                ", timeMode=" + timeMode +
                ", retentionSeconds=" + retentionSeconds +
                ", failOnInitError=" + failOnInitError +
                ", purgeInterval=" + purgeInterval +
                ", workerThreads=" + workerThreads +
                '}';
    }

    public static final class Builder {
        private boolean log = true;
        private LogSink logger;
        private String storeName = DEFAULT_STORE_NAME;
        private TimeMode timeMode = TimeMode.LOCAL;
        private long retentionSeconds = DEFAULT_RETENTION_SECONDS;
        private boolean failOnInitError = true;
        private Duration purgeInterval = Duration.ofSeconds(60);
        private int workerThreads = 4;

        private Builder() {}

        public Builder log(boolean log) {
            this.log = log;
            return this;
        }

        /** null 이면 slf4j */
        public Builder logger(LogSink logger) {
            this.logger = logger;
            return this;
        }

        public Builder storeName(String storeName) {
            this.storeName = Objects.requireNonNull(storeName, "storeName");
            return this;
        }

        public Builder timeMode(TimeMode timeMode) {
            this.timeMode = Objects.requireNonNull(timeMode, "timeMode");
            return this;
        }

        public Builder retentionSeconds(long retentionSeconds) {
            this.retentionSeconds = retentionSeconds;
            return this;
        }

        public Builder failOnInitError(boolean failOnInitError) {
            this.failOnInitError = failOnInitError;
            return this;
        }

        public Builder purgeInterval(Duration purgeInterval) {
            this.purgeInterval = Objects.requireNonNull(purgeInterval, "purgeInterval");
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public SchedulerOptions build() {
            if (!STORE_NAME.matcher(storeName).matches()) {
                throw new IllegalArgumentException("storeName must be a SQL identifier of at most 20 chars: " + storeName);
            }
            if (retentionSeconds < 0) {
                throw new IllegalArgumentException("retentionSeconds must be >= 0: " + retentionSeconds);
            }
            if (purgeInterval.isZero() || purgeInterval.isNegative()) {
                throw new IllegalArgumentException("purgeInterval must be positive: " + purgeInterval);
            }
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be >= 1: " + workerThreads);
            }
            return new SchedulerOptions(this);
        }
    }
}
