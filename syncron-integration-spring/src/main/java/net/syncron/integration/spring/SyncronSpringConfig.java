package net.syncron.integration.spring;

import net.syncron.adapter.jdbc.repo.JdbcRunLedger;
import net.syncron.core.config.SchedulerOptions;
import net.syncron.core.service.SyncedScheduler;
import net.syncron.core.spi.Clock;
import net.syncron.core.spi.RunLedger;
import net.syncron.core.spi.ScheduleParserFactory;
import net.syncron.core.spi.TxRunner;
import net.syncron.integration.spring.cron.CronUtilsScheduleParser;
import net.syncron.integration.spring.tx.SpringTxRunner;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/**
 * DataSource + PlatformTransactionManager 가 있는 컨텍스트에 원장/스케줄러를 올린다.
 * SchedulerOptions, Clock 빈이 없으면 기본값을 쓴다.
 */
@Configuration(proxyBeanMethods = false)
public class SyncronSpringConfig {

    @Bean
    public TxRunner syncronTxRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean
    public RunLedger runLedger(DataSource ds, ObjectProvider<SchedulerOptions> options) {
        return new JdbcRunLedger(ds, resolve(options).storeName());
    }

    /** 시간대는 스케줄러가 options.timeMode 로 정해서 넘긴다 */
    @Bean
    public ScheduleParserFactory scheduleParser() {
        return CronUtilsScheduleParser::new;
    }

    @Bean(destroyMethod = "close")
    public SyncedScheduler syncedScheduler(ObjectProvider<SchedulerOptions> options,
                                           RunLedger ledger,
                                           TxRunner syncronTxRunner,
                                           ScheduleParserFactory scheduleParser,
                                           ObjectProvider<Clock> clock) {
        return SyncedScheduler.builder()
                .options(resolve(options))
                .ledger(ledger)
                .txRunner(syncronTxRunner)
                .scheduleParser(scheduleParser)
                .clock(clock.getIfAvailable(Clock::system))
                .build();
    }

    private static SchedulerOptions resolve(ObjectProvider<SchedulerOptions> options) {
        return options.getIfAvailable(SchedulerOptions::defaults);
    }
}
