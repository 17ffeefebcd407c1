package net.syncron.bootstrap.autoconfigure;

import net.syncron.bootstrap.catalog.CatalogRegistrar;
import net.syncron.bootstrap.props.SyncronProperties;
import net.syncron.core.config.SchedulerOptions;
import net.syncron.core.service.SyncedScheduler;
import net.syncron.integration.spring.SyncronSpringConfig;
import net.syncron.integration.spring.lifecycle.SchedulerConfigurer;
import net.syncron.integration.spring.lifecycle.SchedulerLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import javax.sql.DataSource;
import java.util.stream.Collectors;

@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "syncron", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(SyncronProperties.class)
@Import(SyncronSpringConfig.class) // integration-spring: 원장/tx/파서/스케줄러 조립
public class SyncronAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(SyncronAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public SchedulerOptions schedulerOptions(SyncronProperties props) {
        SchedulerOptions options = props.toOptions();
        log.debug("Syncron options: {}", options);
        return options;
    }

    @Bean
    @ConditionalOnProperty(prefix = "syncron.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CatalogRegistrar catalogRegistrar(BeanFactory beans, SyncronProperties props) {
        if (log.isDebugEnabled()) {
            log.debug("Syncron catalog:\n{}", props.getCatalog().getJobs().stream()
                    .map(SyncronProperties.JobDef::toString)
                    .collect(Collectors.joining("\n")));
        }
        return new CatalogRegistrar(beans, props.getCatalog());
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerLifecycle schedulerLifecycle(SyncedScheduler scheduler,
                                                 ObjectProvider<SchedulerConfigurer> configurers,
                                                 SyncronProperties props) {
        return new SchedulerLifecycle(scheduler,
                configurers.orderedStream().collect(Collectors.toList()),
                props.isAutoStart());
    }
}
