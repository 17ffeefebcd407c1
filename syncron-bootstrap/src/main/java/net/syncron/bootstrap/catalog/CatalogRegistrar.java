package net.syncron.bootstrap.catalog;

import net.syncron.bootstrap.props.SyncronProperties;
import net.syncron.core.model.JobDefinition;
import net.syncron.core.service.SyncedScheduler;
import net.syncron.core.spi.JobHandler;
import net.syncron.core.spi.ScheduleSpec;
import net.syncron.integration.spring.lifecycle.SchedulerConfigurer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanFactory;

import java.time.Duration;

/**
 * syncron.catalog.jobs[*] 를 JobDefinition 으로 바꿔 등록한다. 핸들러는 JobHandler 빈 이름으로 찾는다.
 */
public class CatalogRegistrar implements SchedulerConfigurer {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final BeanFactory beans;
    private final SyncronProperties.Catalog catalog;

    public CatalogRegistrar(BeanFactory beans, SyncronProperties.Catalog catalog) {
        this.beans = beans;
        this.catalog = catalog;
    }

    @Override
    public void configure(SyncedScheduler scheduler) {
        for (var def : catalog.getJobs()) {
            boolean added = scheduler.add(toDefinition(def));
            if (added) {
                log.info("Catalog registered: job='{}' handler='{}' persist={}", def.getName(), def.getHandler(), def.isPersist());
            } else {
                log.warn("Catalog job '{}' already registered, skipped", def.getName());
            }
        }
    }

    JobDefinition toDefinition(SyncronProperties.JobDef def) {
        if (def.getName() == null || def.getHandler() == null) {
            throw new IllegalArgumentException("job.name and job.handler are required: " + def);
        }
        boolean hasCron = def.getCron() != null && !def.getCron().isBlank();
        boolean hasEvery = def.getEvery() != null;
        if (hasCron == hasEvery) {
            throw new IllegalArgumentException("exactly one of job.cron / job.every is required: " + def);
        }

        JobHandler handler = beans.getBean(def.getHandler(), JobHandler.class);
        ScheduleSpec schedule;
        if (hasCron) {
            String cron = def.getCron();
            schedule = p -> p.cron(cron);
        } else {
            Duration every = def.getEvery();
            schedule = p -> p.every(every);
        }
        return new JobDefinition(def.getName(), schedule, handler, def.isPersist());
    }
}
