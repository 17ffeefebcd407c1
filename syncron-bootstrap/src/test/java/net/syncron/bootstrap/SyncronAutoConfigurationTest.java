package net.syncron.bootstrap;

import net.syncron.bootstrap.autoconfigure.SyncronAutoConfiguration;
import net.syncron.core.config.SchedulerOptions;
import net.syncron.core.model.SchedulerState;
import net.syncron.core.model.TimeMode;
import net.syncron.core.service.SyncedScheduler;
import net.syncron.core.spi.JobHandler;
import net.syncron.integration.spring.lifecycle.SchedulerLifecycle;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SyncronAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    DataSourceAutoConfiguration.class,
                    DataSourceTransactionManagerAutoConfiguration.class,
                    SyncronAutoConfiguration.class))
            .withUserConfiguration(Handlers.class)
            .withPropertyValues(
                    "spring.datasource.url=jdbc:h2:mem:syncron_" + UUID.randomUUID() + ";MODE=Oracle;DB_CLOSE_DELAY=-1",
                    "spring.datasource.username=sa");

    @Test
    void binds_options_from_properties() {
        runner.withPropertyValues(
                        "syncron.store-name=BOOT_RUNS",
                        "syncron.time-mode=utc",
                        "syncron.retention-seconds=600",
                        "syncron.purge-interval=30s",
                        "syncron.worker-threads=2",
                        "syncron.log=false")
                .run(ctx -> {
                    SchedulerOptions options = ctx.getBean(SchedulerOptions.class);
                    assertThat(options.storeName()).isEqualTo("BOOT_RUNS");
                    assertThat(options.timeMode()).isEqualTo(TimeMode.UTC);
                    assertThat(options.retentionSeconds()).isEqualTo(600);
                    assertThat(options.purgeInterval()).hasSeconds(30);
                    assertThat(options.workerThreads()).isEqualTo(2);
                    assertThat(options.log()).isFalse();
                    assertThat(ctx.getBean(SyncedScheduler.class).options()).isSameAs(options);
                });
    }

    @Test
    void registers_catalog_jobs_and_starts() {
        runner.withPropertyValues(
                        "syncron.catalog.jobs[0].name=heartbeat",
                        "syncron.catalog.jobs[0].every=1h",
                        "syncron.catalog.jobs[0].handler=beat",
                        "syncron.catalog.jobs[1].name=nightly",
                        "syncron.catalog.jobs[1].cron=0 0 3 * * ?",
                        "syncron.catalog.jobs[1].handler=beat",
                        "syncron.catalog.jobs[1].persist=false")
                .run(ctx -> {
                    assertThat(ctx).hasNotFailed();
                    SyncedScheduler scheduler = ctx.getBean(SyncedScheduler.class);
                    assertThat(scheduler.jobNames()).containsExactly("heartbeat", "nightly");
                    assertThat(scheduler.state()).isEqualTo(SchedulerState.RUNNING);
                    assertThat(scheduler.nextOccurrence("nightly")).isPresent();
                    assertThat(ctx.getBean(SchedulerLifecycle.class).isRunning()).isTrue();
                });
    }

    @Test
    void auto_start_disabled_registers_but_does_not_start() {
        runner.withPropertyValues(
                        "syncron.auto-start=false",
                        "syncron.catalog.jobs[0].name=heartbeat",
                        "syncron.catalog.jobs[0].every=1h",
                        "syncron.catalog.jobs[0].handler=beat")
                .run(ctx -> {
                    SyncedScheduler scheduler = ctx.getBean(SyncedScheduler.class);
                    assertThat(scheduler.jobNames()).containsExactly("heartbeat");
                    assertThat(scheduler.state()).isEqualTo(SchedulerState.STOPPED);
                });
    }

    @Test
    void catalog_disabled_skips_registrar() {
        runner.withPropertyValues(
                        "syncron.catalog.enabled=false",
                        "syncron.catalog.jobs[0].name=heartbeat",
                        "syncron.catalog.jobs[0].every=1h",
                        "syncron.catalog.jobs[0].handler=beat")
                .run(ctx -> {
                    assertThat(ctx).doesNotHaveBean("catalogRegistrar");
                    assertThat(ctx.getBean(SyncedScheduler.class).jobNames()).isEmpty();
                });
    }

    @Test
    void unknown_handler_fails_startup() {
        runner.withPropertyValues(
                        "syncron.catalog.jobs[0].name=heartbeat",
                        "syncron.catalog.jobs[0].every=1h",
                        "syncron.catalog.jobs[0].handler=missing")
                .run(ctx -> assertThat(ctx).hasFailed());
    }

    @Test
    void disabled_property_backs_off() {
        runner.withPropertyValues("syncron.enabled=false")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(SyncedScheduler.class));
    }

    @Test
    void no_datasource_backs_off() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(SyncronAutoConfiguration.class))
                .run(ctx -> assertThat(ctx).doesNotHaveBean(SyncedScheduler.class));
    }

    @Test
    void user_options_bean_wins() {
        runner.withUserConfiguration(CustomOptions.class)
                .withPropertyValues("syncron.store-name=IGNORED")
                .run(ctx -> assertThat(ctx.getBean(SyncedScheduler.class).options().storeName())
                        .isEqualTo("CUSTOM_RUNS"));
    }

    @Configuration(proxyBeanMethods = false)
    static class Handlers {
        @Bean
        JobHandler beat() {
            return (at, name) -> "beat";
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomOptions {
        @Bean
        SchedulerOptions customOptions() {
            return SchedulerOptions.builder().storeName("CUSTOM_RUNS").build();
        }
    }
}
