package io.jobworker.spring.boot;

import io.jobworker.DispatchResult;
import io.jobworker.broadcast.AutoBroadcastTrigger;
import io.jobworker.broadcast.BroadcastMessageFactory;
import io.jobworker.broadcast.LiveMetric;
import io.jobworker.dispatch.DefaultJobHandlerRegistry;
import io.jobworker.dispatch.JobDispatcher;
import io.jobworker.dispatch.UpdateRouter;
import io.jobworker.jdbc.DataSourceConnectionProvider;
import io.jobworker.jdbc.JdbcLiveNotificationStore;
import io.jobworker.jdbc.JdbcSettingsStore;
import io.jobworker.jdbc.store.AbstractJdbcJobStore;
import io.jobworker.jdbc.store.H2JobStore;
import io.jobworker.model.Job;
import io.jobworker.model.JobStatus;
import io.jobworker.notify.LiveNotificationDeduplicator;
import io.jobworker.notify.MessageGateway;
import io.jobworker.notify.NotificationTargets;
import io.jobworker.ratelimit.RateLimit;
import io.jobworker.ratelimit.RateLimitRules;
import io.jobworker.ratelimit.SlidingWindowRateLimiter;
import io.jobworker.spi.ConnectionProvider;
import io.jobworker.worker.CycleResult;
import io.jobworker.worker.JobWorker;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JobWorkerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          JobWorkerAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:schema/h2.sql",
          "jobworker.auto-start=false");

  @Test
  void createsCoreBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("jobStore"));
      assertTrue(ctx.containsBean("connectionProvider"));
      assertTrue(ctx.containsBean("settingsStore"));
      assertTrue(ctx.containsBean("liveNotificationStore"));
      assertTrue(ctx.containsBean("rateLimiter"));
      assertTrue(ctx.containsBean("jobHandlerRegistry"));
      assertTrue(ctx.containsBean("updateRouter"));
      assertTrue(ctx.containsBean("jobDispatcher"));
      assertTrue(ctx.containsBean("jobWorker"));

      assertInstanceOf(H2JobStore.class, ctx.getBean(AbstractJdbcJobStore.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(JdbcSettingsStore.class, ctx.getBean("settingsStore"));
      assertInstanceOf(JdbcLiveNotificationStore.class, ctx.getBean("liveNotificationStore"));

      assertFalse(ctx.containsBean("liveNotificationDeduplicator"));
      assertFalse(ctx.containsBean("autoBroadcastTrigger"));
    });
  }

  @Test
  void backsOffWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(JobWorkerAutoConfiguration.class))
        .run(ctx -> assertFalse(ctx.containsBean("jobWorker")));
  }

  @Test
  void liveAlertsAreWiredWhenGatewayAndTargetsExist() {
    runner.withUserConfiguration(LiveAlertConfig.class).run(ctx -> {
      assertNotNull(ctx.getBean(LiveNotificationDeduplicator.class));
      DefaultJobHandlerRegistry registry = ctx.getBean(DefaultJobHandlerRegistry.class);
      assertTrue(registry.handlerFor("notify_live").isPresent());

      AbstractJdbcJobStore store = ctx.getBean(AbstractJdbcJobStore.class);
      long id;
      try (Connection conn = ctx.getBean(ConnectionProvider.class).getConnection()) {
        id = store.enqueue(conn, "notify_live", "{\"entity\":\"alice\",\"link\":\"https://live.example/alice\"}",
            Instant.now());
      }

      JobWorker worker = ctx.getBean(JobWorker.class);
      assertEquals(CycleResult.PROCESSED, worker.runCycle());

      try (Connection conn = ctx.getBean(ConnectionProvider.class).getConnection()) {
        Job job = store.findById(conn, id).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.status());
      }
      assertEquals(List.of("42:alice is live now: https://live.example/alice"),
          ctx.getBean(LiveAlertConfig.class).sent);
    });
  }

  @Test
  void customizersContributeHandlers() {
    runner.withUserConfiguration(CustomizerConfig.class).run(ctx -> {
      DefaultJobHandlerRegistry registry = ctx.getBean(DefaultJobHandlerRegistry.class);
      assertTrue(registry.handlerFor("broadcast_message").isPresent());

      JobDispatcher dispatcher = ctx.getBean(JobDispatcher.class);
      Instant now = Instant.now();
      DispatchResult result = dispatcher.dispatch(new Job(1L, "process_update",
          "{\"message\":{\"from\":{\"id\":7},\"text\":\"/start\"}}", JobStatus.PROCESSING, 0, now, now));

      assertInstanceOf(DispatchResult.Ok.class, result);
      assertEquals(List.of("start:7"), ctx.getBean(CustomizerConfig.class).commands);
    });
  }

  @Test
  void autoBroadcastNeedsMetricAndFactory() {
    runner.withUserConfiguration(AutoBroadcastConfig.class).run(ctx -> {
      assertNotNull(ctx.getBean(AutoBroadcastTrigger.class));
    });
  }

  @Test
  void autoBroadcastCanBeDisabled() {
    runner
        .withPropertyValues("jobworker.auto-broadcast.enabled=false")
        .withUserConfiguration(AutoBroadcastConfig.class)
        .run(ctx -> assertFalse(ctx.containsBean("autoBroadcastTrigger")));
  }

  @Test
  void rateLimitOverridesMergeWithDefaults() {
    runner
        .withPropertyValues(
            "jobworker.rate-limit.limits[button_click].max-requests=2",
            "jobworker.rate-limit.limits[button_click].window=30s",
            "jobworker.rate-limit.limits[promote].max-requests=1")
        .run(ctx -> {
          RateLimitRules rules = ctx.getBean(RateLimitRules.class);
          assertEquals(new RateLimit(2, Duration.ofSeconds(30)), rules.limitFor("button_click").orElseThrow());
          assertEquals(new RateLimit(1, Duration.ofSeconds(60)), rules.limitFor("promote").orElseThrow());
          assertEquals(new RateLimit(3, Duration.ofSeconds(300)), rules.limitFor("payment").orElseThrow());
        });
  }

  @Test
  void customJobsTableName() {
    runner
        .withPropertyValues("jobworker.tables.jobs=bot_jobs")
        .run(ctx -> assertInstanceOf(H2JobStore.class, ctx.getBean(AbstractJdbcJobStore.class)));
  }

  @Test
  void autoStartRunsWorkerUntilContextCloses() {
    List<JobWorker> seen = new ArrayList<>();
    runner
        .withPropertyValues("jobworker.auto-start=true", "jobworker.worker.poll-interval=50ms")
        .run(ctx -> {
          JobWorker worker = ctx.getBean(JobWorker.class);
          assertFalse(worker.isClosed());
          assertThrows(IllegalStateException.class, worker::start);
          seen.add(worker);
        });
    assertTrue(seen.get(0).isClosed());
  }

  @Test
  void userDefinedRouterWins() {
    runner.withUserConfiguration(UpdateRouterOnlyConfig.class).run(ctx -> {
      assertSame(ctx.getBean(UpdateRouterOnlyConfig.class).router, ctx.getBean(UpdateRouter.class));
    });
  }

  @Configuration
  static class LiveAlertConfig {
    final List<String> sent = Collections.synchronizedList(new ArrayList<>());

    @Bean
    MessageGateway messageGateway() {
      return new MessageGateway() {
        @Override
        public String send(String targetId, String text) {
          sent.add(targetId + ":" + text);
          return "m" + sent.size();
        }

        @Override
        public void delete(String targetId, String messageId) {
        }
      };
    }

    @Bean
    NotificationTargets notificationTargets() {
      return entityKey -> List.of("42");
    }
  }

  @Configuration
  static class CustomizerConfig {
    final List<String> commands = Collections.synchronizedList(new ArrayList<>());

    @Bean
    JobHandlerRegistryCustomizer broadcastHandler() {
      return registry -> registry.register("broadcast_message", ctx -> DispatchResult.ok());
    }

    @Bean
    UpdateRouterCustomizer startCommand() {
      return builder -> builder.command("/start", message -> {
        commands.add("start:" + message.senderId());
        return DispatchResult.ok();
      });
    }
  }

  @Configuration
  static class AutoBroadcastConfig {
    @Bean
    LiveMetric liveMetric() {
      return () -> 12L;
    }

    @Bean
    BroadcastMessageFactory broadcastMessageFactory() {
      return (value, now) -> Map.of("text", value + " live now");
    }
  }

  @Configuration
  static class UpdateRouterOnlyConfig {
    final UpdateRouter router = UpdateRouter.builder()
        .rateLimiter(new SlidingWindowRateLimiter(RateLimitRules.defaults(), Clock.systemUTC()))
        .build();

    @Bean(destroyMethod = "close")
    UpdateRouter updateRouter() {
      return router;
    }
  }
}
