package net.syncron.integration.spring.lifecycle;

import net.syncron.core.service.SyncedScheduler;

/**
 * 컨텍스트 시작 시 잡을 등록하는 콜백. 원장 준비 직후, start() 직전에 호출된다.
 */
@FunctionalInterface
public interface SchedulerConfigurer {
    void configure(SyncedScheduler scheduler) throws Exception;
}
