package com.executionengine.worker.config;

import com.executionengine.domain.orders.OrderRequest;
import com.executionengine.domain.orders.OrdersToExecute;
import com.executionengine.execution.config.ExecutorConfig;
import com.executionengine.execution.router.OrderRouter;
import com.executionengine.infra.events.BatchSummarySink;
import com.executionengine.infra.events.OrderEventBus;
import com.executionengine.integration.venue.OrderBookLevel;
import com.executionengine.integration.venue.OrderBookSnapshot;
import com.executionengine.integration.venue.PaperVenueClient;
import com.executionengine.integration.venue.Venue;
import com.executionengine.integration.venue.VenueConnectionMode;
import com.executionengine.worker.batch.BatchExecutionService;
import com.executionengine.worker.batch.BatchSummaryNotifier;
import com.executionengine.worker.batch.LoggingBatchSummaryNotifier;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
  ExecutorProperties.class,
  VenueProperties.class,
  StartupBatchProperties.class
})
public class ExecutionEngineConfiguration {
  private static final Logger log = LoggerFactory.getLogger(ExecutionEngineConfiguration.class);

  @Bean
  ExecutorConfig executorConfig(ExecutorProperties properties) {
    ExecutorConfig config = properties.toExecutorConfig();
    log.info(
        "Executor configured execution={} maxSpreadPct={} timeout={} maxConcurrentOrdersPerExchange={}",
        config.execution(),
        config.maxSpreadPct(),
        config.timeout(),
        config.maxConcurrentOrdersPerExchange());
    return config;
  }

  @Bean(destroyMethod = "shutdownNow")
  ExecutorService orderTaskExecutor(ExecutorProperties properties) {
    return Executors.newFixedThreadPool(
        Math.max(1, properties.getOrderThreads()), daemonThreads("order-task-"));
  }

  @Bean(destroyMethod = "shutdownNow")
  ExecutorService streamPumpExecutor() {
    return Executors.newCachedThreadPool(daemonThreads("stream-pump-"));
  }

  @Bean
  OrderRouter orderRouter(
      ExecutorConfig executorConfig,
      OrderEventBus orderEventBus,
      @Qualifier("orderTaskExecutor") ExecutorService orderTaskExecutor,
      @Qualifier("streamPumpExecutor") ExecutorService streamPumpExecutor) {
    return new OrderRouter(executorConfig, orderEventBus, orderTaskExecutor, streamPumpExecutor);
  }

  @Bean
  VenueCatalog venueCatalog(VenueProperties properties) {
    List<Venue> venues = new ArrayList<>();
    for (VenueProperties.PaperVenue paperVenue : properties.getVenues()) {
      PaperVenueClient client =
          new PaperVenueClient(
              paperVenue.getId(),
              paperVenue.getConnectionMode() == VenueConnectionMode.STREAM,
              paperVenue.getRestingFillDelay());
      for (VenueProperties.BookSeed seed : paperVenue.getBooks()) {
        client.updateOrderBook(seededBook(seed));
      }
      venues.add(
          new Venue(
              paperVenue.getId(),
              client,
              paperVenue.getConnectionMode(),
              paperVenue.getLeverage(),
              paperVenue.getMarginMode()));
      log.info(
          "Paper venue registered venue={} connectionMode={} books={}",
          paperVenue.getId(),
          paperVenue.getConnectionMode(),
          paperVenue.getBooks().size());
    }
    return new VenueCatalog(venues);
  }

  @Bean
  @ConditionalOnMissingBean(BatchSummaryNotifier.class)
  BatchSummaryNotifier loggingBatchSummaryNotifier() {
    return new LoggingBatchSummaryNotifier();
  }

  @Bean
  BatchExecutionService batchExecutionService(
      OrderRouter orderRouter,
      ObjectProvider<BatchSummarySink> batchSummarySink,
      BatchSummaryNotifier batchSummaryNotifier) {
    return new BatchExecutionService(
        orderRouter, batchSummarySink.getIfAvailable(), batchSummaryNotifier);
  }

  @Bean
  @ConditionalOnProperty(prefix = "execution.startup-batch", name = "enabled", havingValue = "true")
  ApplicationRunner startupBatchRunner(
      BatchExecutionService batchExecutionService,
      VenueCatalog venueCatalog,
      StartupBatchProperties properties) {
    return args -> {
      List<OrderRequest> orders = new ArrayList<>();
      for (StartupBatchProperties.Order order : properties.getOrders()) {
        orders.add(
            new OrderRequest(
                order.getSymbol(),
                order.getSide(),
                order.getType(),
                order.getAmount(),
                order.getPrice(),
                order.getStyle(),
                order.getVenue(),
                Map.of(),
                null,
                "startup-batch"));
      }
      batchExecutionService.executeOrders(venueCatalog.venues(), OrdersToExecute.ofNew(orders));
    };
  }

  static OrderBookSnapshot seededBook(VenueProperties.BookSeed seed) {
    List<OrderBookLevel> bids = new ArrayList<>();
    List<OrderBookLevel> asks = new ArrayList<>();
    for (int level = 0; level < Math.max(1, seed.getDepth()); level++) {
      BigDecimal offset = seed.getTickSize().multiply(BigDecimal.valueOf(level));
      bids.add(new OrderBookLevel(seed.getBestBid().subtract(offset), seed.getLevelAmount()));
      asks.add(new OrderBookLevel(seed.getBestAsk().add(offset), seed.getLevelAmount()));
    }
    return new OrderBookSnapshot(seed.getSymbol(), bids, asks, Instant.now());
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
