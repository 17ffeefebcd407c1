package net.syncron.core.spi;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 발생 시각 생성기. 같은 스케줄과 기준 시각이면 항상 같은 결과(결정적)여야 한다.
 */
public interface OccurrenceSource {
    /**
     * {@code after} 보다 엄격히 뒤에 오는 발생 시각을 최대 {@code count}개, 오름차순으로.
     * 빈 리스트는 스케줄 소진(예: 이미 지난 1회성 일정)을 뜻한다.
     */
    List<Instant> next(int count, Instant after);

    default Optional<Instant> next(Instant after) {
        List<Instant> list = next(1, after);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }
}
