package io.jobworker.spring.boot;

import io.jobworker.broadcast.AutoBroadcastTrigger;
import io.jobworker.broadcast.BroadcastMessageFactory;
import io.jobworker.broadcast.LiveMetric;
import io.jobworker.dispatch.DefaultJobHandlerRegistry;
import io.jobworker.dispatch.JobDispatcher;
import io.jobworker.dispatch.UpdateRouter;
import io.jobworker.jdbc.DataSourceConnectionProvider;
import io.jobworker.jdbc.JdbcLiveNotificationStore;
import io.jobworker.jdbc.JdbcSettingsStore;
import io.jobworker.jdbc.TableNames;
import io.jobworker.jdbc.store.AbstractJdbcJobStore;
import io.jobworker.jdbc.store.JdbcJobStores;
import io.jobworker.model.JobType;
import io.jobworker.notify.LiveNotificationDeduplicator;
import io.jobworker.notify.LiveNotificationHandler;
import io.jobworker.notify.MessageGateway;
import io.jobworker.notify.NotificationTargets;
import io.jobworker.ratelimit.RateLimitRules;
import io.jobworker.ratelimit.SlidingWindowRateLimiter;
import io.jobworker.spi.ConnectionProvider;
import io.jobworker.spi.LiveNotificationStore;
import io.jobworker.spi.MetricsExporter;
import io.jobworker.spi.SettingsStore;
import io.jobworker.worker.JobWorker;
import io.jobworker.worker.PeriodicTask;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;

/**
 * Auto-configuration for the job worker.
 *
 * <p>Wires a {@link JobWorker} from a {@link DataSource} and {@link JobWorkerProperties}.
 * Business handlers plug in through {@link JobHandlerRegistryCustomizer} and
 * {@link UpdateRouterCustomizer} beans. Live alerts are handled when a
 * {@link MessageGateway} and {@link NotificationTargets} bean exist; the auto-broadcast
 * runs when a {@link LiveMetric} and {@link BroadcastMessageFactory} bean exist. Any
 * {@link PeriodicTask} bean joins the worker's periodic check.
 *
 * @see JobWorkerProperties
 * @see JobWorkerMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JobWorker.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(JobWorkerProperties.class)
public class JobWorkerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcJobStore jobStore(DataSource dataSource, JobWorkerProperties props) {
    String tableName = props.getTables().getJobs();
    AbstractJdbcJobStore detected = JdbcJobStores.detect(dataSource);
    return TableNames.JOBS.equals(tableName) ? detected : detected.withTableName(tableName);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(SettingsStore.class)
  public JdbcSettingsStore settingsStore(JobWorkerProperties props) {
    return new JdbcSettingsStore(props.getTables().getSettings());
  }

  @Bean
  @ConditionalOnMissingBean(LiveNotificationStore.class)
  public JdbcLiveNotificationStore liveNotificationStore(JobWorkerProperties props) {
    return new JdbcLiveNotificationStore(props.getTables().getLiveNotifications());
  }

  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock jobWorkerClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public RateLimitRules rateLimitRules(JobWorkerProperties props) {
    RateLimitRules.Builder rules = RateLimitRules.builder().from(RateLimitRules.defaults());
    for (Map.Entry<String, JobWorkerProperties.Limit> entry : props.getRateLimit().getLimits().entrySet()) {
      rules.limit(entry.getKey(), entry.getValue().getMaxRequests(), entry.getValue().getWindow());
    }
    return rules.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public SlidingWindowRateLimiter rateLimiter(RateLimitRules rules, Clock clock, JobWorkerProperties props) {
    return new SlidingWindowRateLimiter(rules, clock, props.getRateLimit().getSweepInterval());
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(MessageGateway.class)
  public LiveNotificationDeduplicator liveNotificationDeduplicator(ConnectionProvider connectionProvider,
      LiveNotificationStore liveNotificationStore, MessageGateway gateway, Clock clock,
      JobWorkerProperties props) {
    return LiveNotificationDeduplicator.builder()
        .connectionProvider(connectionProvider)
        .store(liveNotificationStore)
        .gateway(gateway)
        .clock(clock)
        .retractWindow(props.getNotifications().getRetractWindow())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultJobHandlerRegistry jobHandlerRegistry(
      ObjectProvider<JobHandlerRegistryCustomizer> customizers,
      ObjectProvider<LiveNotificationDeduplicator> deduplicator,
      ObjectProvider<NotificationTargets> notificationTargets) {
    DefaultJobHandlerRegistry registry = new DefaultJobHandlerRegistry();
    customizers.orderedStream().forEach(customizer -> customizer.customize(registry));

    LiveNotificationDeduplicator dedup = deduplicator.getIfAvailable();
    NotificationTargets targets = notificationTargets.getIfAvailable();
    if (dedup != null && targets != null && registry.handlerFor(JobType.NOTIFY_LIVE.value()).isEmpty()) {
      registry.register(JobType.NOTIFY_LIVE, new LiveNotificationHandler(dedup, targets));
    }
    return registry;
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public UpdateRouter updateRouter(SlidingWindowRateLimiter rateLimiter, JobWorkerProperties props,
      ObjectProvider<UpdateRouterCustomizer> customizers,
      ObjectProvider<MetricsExporter> metricsProvider) {
    JobWorkerProperties.PreCheckout preCheckout = props.getPreCheckout();
    UpdateRouter.Builder builder = UpdateRouter.builder()
        .rateLimiter(rateLimiter)
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .preCheckoutDeadline(preCheckout.getDeadline())
        .preCheckoutResponseMargin(preCheckout.getResponseMargin())
        .preCheckoutThreads(preCheckout.getThreads());
    customizers.orderedStream().forEach(customizer -> customizer.customize(builder));
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public JobDispatcher jobDispatcher(DefaultJobHandlerRegistry registry, UpdateRouter updateRouter) {
    return JobDispatcher.builder()
        .registry(registry)
        .updateRouter(updateRouter)
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean({LiveMetric.class, BroadcastMessageFactory.class})
  @ConditionalOnProperty(prefix = "jobworker.auto-broadcast", name = "enabled", matchIfMissing = true)
  public AutoBroadcastTrigger autoBroadcastTrigger(ConnectionProvider connectionProvider,
      AbstractJdbcJobStore jobStore, SettingsStore settingsStore, LiveMetric liveMetric,
      BroadcastMessageFactory messageFactory, JobWorkerProperties props,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return AutoBroadcastTrigger.builder()
        .connectionProvider(connectionProvider)
        .jobStore(jobStore)
        .settingsStore(settingsStore)
        .liveMetric(liveMetric)
        .messageFactory(messageFactory)
        .threshold(props.getAutoBroadcast().getThreshold())
        .cooldown(props.getAutoBroadcast().getCooldown())
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public JobWorker jobWorker(JobWorkerProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcJobStore jobStore,
      JobDispatcher jobDispatcher,
      Clock clock,
      ObjectProvider<PeriodicTask> periodicTasks,
      ObjectProvider<LiveNotificationDeduplicator> deduplicator,
      ObjectProvider<MetricsExporter> metricsProvider) {
    JobWorkerProperties.Worker worker = props.getWorker();
    JobWorker.Builder builder = JobWorker.builder()
        .connectionProvider(connectionProvider)
        .jobStore(jobStore)
        .dispatcher(jobDispatcher)
        .clock(clock)
        .pollInterval(worker.getPollInterval())
        .periodicCheckInterval(worker.getPeriodicCheckInterval())
        .slowJobThreshold(worker.getSlowJobThreshold())
        .retryCeiling(worker.getRetryCeiling())
        .excludedTypes(new HashSet<>(worker.getExcludedTypes()))
        .runOnce(worker.isRunOnce())
        .runOnceAttempts(worker.getRunOnceAttempts())
        .runOnceRetryDelay(worker.getRunOnceRetryDelay())
        .staleProcessingTimeout(worker.getStaleProcessingTimeout())
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
    periodicTasks.orderedStream().forEach(builder::periodicTask);
    LiveNotificationDeduplicator dedup = deduplicator.getIfAvailable();
    if (dedup != null) {
      builder.periodicTask(new PeriodicTask() {
        @Override
        public void run(Instant now) throws Exception {
          dedup.purgeExpired();
        }

        @Override
        public String name() {
          return "live-notification-purge";
        }
      });
    }
    JobWorker jobWorker = builder.build();
    if (props.isAutoStart()) {
      jobWorker.start();
    }
    return jobWorker;
  }
}
