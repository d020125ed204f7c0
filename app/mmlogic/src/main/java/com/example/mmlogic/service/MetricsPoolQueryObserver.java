package com.example.mmlogic.service;

import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class MetricsPoolQueryObserver implements PoolQueryObserver {

  private static final Logger logger = LoggerFactory.getLogger(MetricsPoolQueryObserver.class);

  private final MmlogicMetrics metrics;

  public MetricsPoolQueryObserver(MmlogicMetrics metrics) {
    this.metrics = metrics;
  }

  @Override
  public void recordEvent(String event, Map<String, ?> fields) {
    metrics.recordEvent(event);
    switch (event) {
      case PoolQueryEvents.FILTER_PROCESSED -> {
        if (fields.get("elapsed_seconds") instanceof Number seconds) {
          metrics.recordFilterDuration(Duration.ofNanos((long) (seconds.doubleValue() * 1e9)));
        }
      }
      case PoolQueryEvents.PAGE_SENT -> metrics.recordPageSent();
      default -> {
        // counter only
      }
    }
    logger.debug("mmlogic event={} {}", event, format(fields));
  }

  @Override
  public void recordError(String event, Throwable error, Map<String, ?> fields) {
    metrics.recordError(event);
    logger.error("mmlogic error event={} {}", event, format(fields), error);
  }

  private String format(Map<String, ?> fields) {
    final StringJoiner joiner = new StringJoiner(" ");
    fields.forEach((key, value) -> joiner.add(key + "=" + value));
    return joiner.toString();
  }
}
