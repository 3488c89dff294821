package com.executionengine.infra.events.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "execution.events")
public class OrderEventsProperties {
  private boolean loggingEnabled = true;
  private boolean summaryEnabled = true;
  private boolean metricsEnabled = true;

  public boolean isLoggingEnabled() {
    return loggingEnabled;
  }

  public void setLoggingEnabled(boolean loggingEnabled) {
    this.loggingEnabled = loggingEnabled;
  }

  public boolean isSummaryEnabled() {
    return summaryEnabled;
  }

  public void setSummaryEnabled(boolean summaryEnabled) {
    this.summaryEnabled = summaryEnabled;
  }

  public boolean isMetricsEnabled() {
    return metricsEnabled;
  }

  public void setMetricsEnabled(boolean metricsEnabled) {
    this.metricsEnabled = metricsEnabled;
  }
}
