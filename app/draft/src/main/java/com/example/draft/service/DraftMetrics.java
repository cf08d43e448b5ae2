package com.example.draft.service;

import com.example.draft.engine.DraftErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class DraftMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer pickLatencyTimer;
  private final Counter conflictCounter;
  private final AtomicLong openRooms = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> pickCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> rejectedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dependencyErrorCounters = new ConcurrentHashMap<>();

  public DraftMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.pickLatencyTimer =
        Timer.builder("draft.pick.latency")
            .description("Time from turn start to pick commit")
            .register(meterRegistry);
    this.conflictCounter =
        Counter.builder("draft.pick.conflict.total")
            .description("Picks rejected by the store because the pick number was taken")
            .register(meterRegistry);
    Gauge.builder("draft.rooms.open", openRooms, AtomicLong::get).register(meterRegistry);
  }

  /** kind は manual または自動指名のソース値 (queue/custom_ranking/adp)。 */
  public void recordPick(String kind) {
    pickCounters.computeIfAbsent(kind, this::registerPickCounter).increment();
  }

  public void recordRejected(DraftErrorCode code) {
    rejectedCounters.computeIfAbsent(code.name(), this::registerRejectedCounter).increment();
  }

  public void recordConflict() {
    conflictCounter.increment();
  }

  public void recordPickLatency(Duration latency) {
    if (latency == null || latency.isNegative()) {
      return;
    }
    pickLatencyTimer.record(latency);
  }

  public void updateOpenRooms(long count) {
    openRooms.set(Math.max(0, count));
  }

  public void recordDependencyError(String errorType) {
    dependencyErrorCounters
        .computeIfAbsent(errorType, this::registerDependencyErrorCounter)
        .increment();
  }

  private Counter registerPickCounter(String kind) {
    return Counter.builder("draft.pick.total").tags(Tags.of("kind", kind)).register(meterRegistry);
  }

  private Counter registerRejectedCounter(String code) {
    return Counter.builder("draft.pick.rejected.total")
        .tags(Tags.of("code", code))
        .register(meterRegistry);
  }

  private Counter registerDependencyErrorCounter(String errorType) {
    return Counter.builder("draft.dependency.error.total")
        .tags(Tags.of("type", errorType))
        .register(meterRegistry);
  }
}
