package net.syncron.core.model;

import net.syncron.core.spi.JobHandler;
import net.syncron.core.spi.ScheduleSpec;

/**
 * 등록 단위 잡 정의. 등록 이후에는 바뀌지 않는다.
 *
 * @param name     레지스트리 안에서 유일한 이름 (원장 키의 일부)
 * @param schedule 파서를 받아 발생 시각 소스를 만드는 함수
 * @param job      실제 작업
 * @param persist  false면 원장 기록/중복 방지 없이 실행만 한다
 */
public record JobDefinition(
        String name,
        ScheduleSpec schedule,
        JobHandler job,
        boolean persist
) {
    public static final int MAX_NAME_LENGTH = 200;

    public static JobDefinition of(String name, ScheduleSpec schedule, JobHandler job) {
        return new JobDefinition(name, schedule, job, true);
    }

    public JobDefinition withPersist(boolean persist) {
        return new JobDefinition(name, schedule, job, persist);
    }
}
