package com.example.mmlogic.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class MmlogicMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer filterDurationTimer;
  private final Counter pagesSentCounter;
  private final ConcurrentMap<String, Counter> eventCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> apiRequestCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> apiErrorCounters = new ConcurrentHashMap<>();

  public MmlogicMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.filterDurationTimer =
        Timer.builder("mmlogic.filter.duration")
            .description("Time spent evaluating one range filter against the player index")
            .register(meterRegistry);
    this.pagesSentCounter =
        Counter.builder("mmlogic.roster.pages.total")
            .description("Roster pages streamed to callers")
            .register(meterRegistry);
  }

  public void recordEvent(String event) {
    eventCounters.computeIfAbsent(event, this::registerEventCounter).increment();
  }

  public void recordError(String event) {
    errorCounters.computeIfAbsent(event, this::registerErrorCounter).increment();
  }

  public void recordFilterDuration(Duration elapsed) {
    if (elapsed.isNegative()) {
      return;
    }
    filterDurationTimer.record(elapsed);
  }

  public void recordPageSent() {
    pagesSentCounter.increment();
  }

  public void recordApiRequest(String method) {
    apiRequestCounters.computeIfAbsent(method, this::registerApiRequestCounter).increment();
  }

  public void recordApiError(String method) {
    apiErrorCounters.computeIfAbsent(method, this::registerApiErrorCounter).increment();
  }

  private Counter registerEventCounter(String event) {
    return Counter.builder("mmlogic.event.total").tags(Tags.of("event", event)).register(meterRegistry);
  }

  private Counter registerErrorCounter(String event) {
    return Counter.builder("mmlogic.error.total").tags(Tags.of("event", event)).register(meterRegistry);
  }

  private Counter registerApiRequestCounter(String method) {
    return Counter.builder("mmlogic.api.requests")
        .tags(Tags.of("method", method))
        .register(meterRegistry);
  }

  private Counter registerApiErrorCounter(String method) {
    return Counter.builder("mmlogic.api.errors")
        .tags(Tags.of("method", method))
        .register(meterRegistry);
  }
}
