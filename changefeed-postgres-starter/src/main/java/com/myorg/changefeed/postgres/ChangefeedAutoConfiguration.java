package com.myorg.changefeed.postgres;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.myorg.changefeed.ChangeWriter;
import com.myorg.changefeed.ChangefeedTransactions;
import com.myorg.changefeed.FeedReader;
import com.myorg.changefeed.FeedRegistry;
import com.myorg.changefeed.Longpoller;
import com.myorg.changefeed.OutboxWriter;
import com.myorg.changefeed.SweepLoop;
import com.myorg.changefeed.WriterLockCoordinator;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;

@AutoConfiguration(after = {
        JacksonAutoConfiguration.class,
        DataSourceAutoConfiguration.class,
        JdbcTemplateAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class
}, afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
})
@EnableConfigurationProperties(ChangefeedProperties.class)
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "changefeed", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ChangefeedAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "changefeedObjectMapper")
    public ObjectMapper changefeedObjectMapper() {
        return JsonMapper.builder().findAndAddModules().build();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock changefeedClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(name = "changefeedTxTemplate")
    public TransactionTemplate changefeedTxTemplate(PlatformTransactionManager txManager) {
        return new TransactionTemplate(txManager);
    }

    @Bean
    @ConditionalOnMissingBean
    public JdbcFeedRegistry jdbcFeedRegistry(JdbcTemplate jdbc) {
        return new JdbcFeedRegistry(jdbc);
    }

    @Bean
    @ConditionalOnProperty(prefix = "changefeed.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnBean(MeterRegistry.class)
    public ChangefeedMetrics changefeedMetrics(MeterRegistry registry, JdbcFeedRegistry feeds) {
        ChangefeedMetrics m = new ChangefeedMetrics(registry, feeds);
        m.preRegister();
        return m;
    }

    @Bean
    @ConditionalOnMissingBean
    public WriterLockCoordinator writerLockCoordinator(DataSource dataSource,
                                                       ChangefeedProperties props,
                                                       Clock changefeedClock,
                                                       ObjectProvider<ChangefeedMetrics> metricsProvider) {
        return new PgWriterLockCoordinator(dataSource, props, changefeedClock, metricsProvider.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public ChangefeedTransactions changefeedTransactions(DataSource dataSource,
                                                         FeedRegistry feeds,
                                                         WriterLockCoordinator coordinator,
                                                         ObjectMapper changefeedObjectMapper,
                                                         Clock changefeedClock) {
        return new JdbcChangefeedTransactions(dataSource, feeds, coordinator, changefeedObjectMapper, changefeedClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SweepHooks sweepHooks() {
        return new SweepHooks() {};
    }

    @Bean
    @ConditionalOnMissingBean
    public JdbcSweeper jdbcSweeper(JdbcTemplate jdbc,
                                   TransactionTemplate changefeedTxTemplate,
                                   ChangefeedProperties props,
                                   Clock changefeedClock,
                                   SweepHooks hooks,
                                   ObjectProvider<ChangefeedMetrics> metricsProvider) {
        return new JdbcSweeper(jdbc, changefeedTxTemplate, props, changefeedClock, hooks, metricsProvider.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public SweepLoop sweepLoop(JdbcTemplate jdbc,
                               JdbcSweeper sweeper,
                               Clock changefeedClock,
                               ObjectProvider<ChangefeedMetrics> metricsProvider) {
        return new JdbcSweepLoop(jdbc, sweeper, changefeedClock, metricsProvider.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public Longpoller longpoller(DataSource dataSource,
                                 JdbcTemplate jdbc,
                                 ChangefeedProperties props,
                                 ObjectProvider<ChangefeedMetrics> metricsProvider) {
        return new JdbcLongpoller(dataSource, jdbc, props, metricsProvider.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public FeedReader feedReader(DataSource dataSource,
                                 JdbcTemplate jdbc,
                                 TransactionTemplate changefeedTxTemplate,
                                 FeedRegistry feeds,
                                 WriterLockCoordinator coordinator,
                                 ObjectMapper changefeedObjectMapper,
                                 ChangefeedProperties props) {
        return new JdbcFeedReader(dataSource, jdbc, changefeedTxTemplate, feeds, coordinator, changefeedObjectMapper, props);
    }

    @Bean
    @ConditionalOnMissingBean
    public ChangeWriter changeWriter(JdbcTemplate jdbc, FeedRegistry feeds, ObjectMapper changefeedObjectMapper) {
        return new JdbcChangeWriter(jdbc, feeds, changefeedObjectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public OutboxWriter outboxWriter(JdbcTemplate jdbc, FeedRegistry feeds, ObjectMapper changefeedObjectMapper) {
        return new JdbcOutboxWriter(jdbc, feeds, changefeedObjectMapper);
    }

    @Bean(name = "changefeedSchedule")
    public ChangefeedScheduleValues changefeedScheduleValues(ChangefeedProperties props) {
        return new ChangefeedScheduleValues(props);
    }

    @Bean
    @ConditionalOnProperty(prefix = "changefeed.sweep", name = "scheduling-enabled", havingValue = "true")
    public SweepScheduler sweepScheduler(ChangefeedProperties props, SweepLoop sweepLoop) {
        return new SweepScheduler(props, sweepLoop);
    }

    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(prefix = "changefeed.sweep", name = "scheduling-enabled", havingValue = "true")
    static class SchedulingConfig {}
}
