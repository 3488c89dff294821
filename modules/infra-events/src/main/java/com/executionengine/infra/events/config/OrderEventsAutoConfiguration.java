package com.executionengine.infra.events.config;

import com.executionengine.infra.events.BatchSummarySink;
import com.executionengine.infra.events.EventSink;
import com.executionengine.infra.events.LoggingEventSink;
import com.executionengine.infra.events.OrderEventBus;
import com.executionengine.infra.events.observability.MicrometerEventSink;
import com.executionengine.infra.events.observability.NoOpEventSink;
import com.executionengine.infra.events.observability.OrderEventTelemetry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(
    afterName = {
      "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
    })
@EnableConfigurationProperties(OrderEventsProperties.class)
public class OrderEventsAutoConfiguration {
  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnProperty(
      prefix = "execution.events",
      name = "metrics-enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(OrderEventTelemetry.class)
  public OrderEventTelemetry micrometerEventTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerEventSink(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(OrderEventTelemetry.class)
  public OrderEventTelemetry noOpEventTelemetry() {
    return new NoOpEventSink();
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "execution.events",
      name = "logging-enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean
  public LoggingEventSink loggingEventSink() {
    return new LoggingEventSink();
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "execution.events",
      name = "summary-enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean
  public BatchSummarySink batchSummarySink() {
    return new BatchSummarySink();
  }

  @Bean
  @ConditionalOnMissingBean
  public OrderEventBus orderEventBus(ObjectProvider<EventSink> sinks) {
    OrderEventBus bus = new OrderEventBus();
    sinks.orderedStream().forEach(bus::registerSink);
    return bus;
  }
}
