package com.debateleague.pairing.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class PairingMetrics {

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> runCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> runTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, DistributionSummary> penaltySummaries =
      new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> unusedAdjudicatorCounters =
      new ConcurrentHashMap<>();

  public PairingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordRun(String format, String result) {
    runCounters
        .computeIfAbsent(format + "|" + result, key -> registerRunCounter(format, result))
        .increment();
  }

  public void recordDuration(String format, Duration duration) {
    if (duration.isNegative()) {
      return;
    }
    runTimers.computeIfAbsent(format, this::registerRunTimer).record(duration);
  }

  public void recordPenalty(String format, int totalPenalty) {
    penaltySummaries
        .computeIfAbsent(format, this::registerPenaltySummary)
        .record(Math.max(0, totalPenalty));
  }

  public void recordUnusedAdjudicators(String format, int count) {
    if (count <= 0) {
      return;
    }
    unusedAdjudicatorCounters
        .computeIfAbsent(format, this::registerUnusedAdjudicatorCounter)
        .increment(count);
  }

  private Counter registerRunCounter(String format, String result) {
    return Counter.builder("pairing.run.total")
        .tags(Tags.of("format", format, "result", result))
        .register(meterRegistry);
  }

  private Timer registerRunTimer(String format) {
    return Timer.builder("pairing.run.duration")
        .description("Time spent generating one event's pairings")
        .tags(Tags.of("format", format))
        .register(meterRegistry);
  }

  private DistributionSummary registerPenaltySummary(String format) {
    return DistributionSummary.builder("pairing.run.penalty")
        .tags(Tags.of("format", format))
        .register(meterRegistry);
  }

  private Counter registerUnusedAdjudicatorCounter(String format) {
    return Counter.builder("pairing.adjudicator.unused.total")
        .tags(Tags.of("format", format))
        .register(meterRegistry);
  }
}
