package net.syncron.core.spi;

import java.time.Instant;

@FunctionalInterface
public interface JobHandler {
    /**
     * @param intendedAt 스케줄상 발생 시각(초 절삭). 실제 실행 시각이 아님
     * @return 원장 result 로 기록될 값 (toString)
     */
    Object run(Instant intendedAt, String name) throws Exception;
}
