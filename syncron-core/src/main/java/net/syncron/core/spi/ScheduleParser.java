package net.syncron.core.spi;

import java.time.Duration;
import java.time.Instant;

/** {@link ScheduleSpec} 에 넘겨지는 스케줄 빌더 */
public interface ScheduleParser {
    /** Quartz(초 포함 6~7필드) 또는 Unix(5필드) cron */
    OccurrenceSource cron(String expression);

    /** 1회성 고정 시각 */
    OccurrenceSource at(Instant instant);

    /** epoch 정렬 고정 간격 */
    OccurrenceSource every(Duration interval);
}
