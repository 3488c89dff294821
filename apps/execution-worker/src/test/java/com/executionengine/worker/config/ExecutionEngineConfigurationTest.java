package com.executionengine.worker.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.executionengine.execution.config.ExecutionStrategy;
import com.executionengine.execution.config.ExecutorConfig;
import com.executionengine.execution.router.OrderRouter;
import com.executionengine.infra.events.OrderEventBus;
import com.executionengine.infra.events.config.OrderEventsAutoConfiguration;
import com.executionengine.integration.venue.Venue;
import com.executionengine.integration.venue.VenueConnectionMode;
import com.executionengine.worker.batch.BatchExecutionService;
import com.executionengine.worker.batch.BatchSummaryNotifier;
import com.executionengine.worker.batch.LoggingBatchSummaryNotifier;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class ExecutionEngineConfigurationTest {
  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(OrderEventsAutoConfiguration.class))
          .withUserConfiguration(ExecutionEngineConfiguration.class)
          .withPropertyValues(
              "execution.executor.execution=FAST",
              "execution.executor.max-spread-pct=0.02",
              "execution.executor.timeout=90s",
              "execution.executor.max-ws-reconnect-attempts=3",
              "execution.venues[0].id=paper-stream",
              "execution.venues[0].connection-mode=STREAM",
              "execution.venues[0].leverage=3",
              "execution.venues[0].books[0].symbol=BTC/USDT",
              "execution.venues[0].books[0].best-bid=100",
              "execution.venues[0].books[0].best-ask=101",
              "execution.venues[1].id=paper-rest");

  @Test
  void shouldWireEngineBeans() {
    contextRunner.run(
        context -> {
          assertThat(context).hasSingleBean(OrderRouter.class);
          assertThat(context).hasSingleBean(OrderEventBus.class);
          assertThat(context).hasSingleBean(BatchExecutionService.class);
          assertThat(context).hasBean("orderTaskExecutor");
          assertThat(context).hasBean("streamPumpExecutor");
          assertThat(context.getBean(BatchSummaryNotifier.class))
              .isInstanceOf(LoggingBatchSummaryNotifier.class);
          assertThat(context).doesNotHaveBean(ApplicationRunner.class);
        });
  }

  @Test
  void shouldBindExecutorSettings() {
    contextRunner.run(
        context -> {
          ExecutorConfig config = context.getBean(ExecutorConfig.class);
          assertThat(config.execution()).isEqualTo(ExecutionStrategy.FAST);
          assertThat(config.maxSpreadPct()).isEqualByComparingTo(new BigDecimal("0.02"));
          assertThat(config.timeout()).isEqualTo(Duration.ofSeconds(90));
          assertThat(config.maxWsReconnectAttempts()).isEqualTo(3);
          assertThat(config.wsStalenessWindow())
              .isEqualTo(ExecutorConfig.DEFAULT_WS_STALENESS_WINDOW);
        });
  }

  @Test
  void shouldBuildPaperVenuesWithSeededBooks() {
    contextRunner.run(
        context -> {
          VenueCatalog catalog = context.getBean(VenueCatalog.class);
          assertThat(catalog.venues()).extracting(Venue::id).containsExactly("paper-stream", "paper-rest");
          Venue streaming = catalog.venues().get(0);
          assertThat(streaming.connectionMode()).isEqualTo(VenueConnectionMode.STREAM);
          assertThat(streaming.streamingCapable()).isTrue();
          assertThat(streaming.leverage()).isEqualTo(3);
          assertThat(streaming.client().fetchOrderBook("BTC/USDT").bids()).hasSize(6);
          assertThat(catalog.venues().get(1).streamingCapable()).isFalse();
        });
  }

  @Test
  void shouldKeepCustomNotifier() {
    contextRunner
        .withBean(BatchSummaryNotifier.class, () -> message -> {})
        .run(
            context ->
                assertThat(context.getBean(BatchSummaryNotifier.class))
                    .isNotInstanceOf(LoggingBatchSummaryNotifier.class));
  }

  @Test
  void shouldRegisterStartupRunnerWhenEnabled() {
    contextRunner
        .withPropertyValues("execution.startup-batch.enabled=true")
        .run(context -> assertThat(context).hasSingleBean(ApplicationRunner.class));
  }
}
