package com.chatgames.arena.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ArenaMetrics {

  private static final String METRIC_ACTIVE_SESSIONS = "arena.sessions.active";
  private static final String METRIC_CHALLENGE_TOTAL = "arena.challenge.total";
  private static final String METRIC_SESSION_END_TOTAL = "arena.session.end.total";
  private static final String METRIC_MOVE_REJECTED_TOTAL = "arena.move.rejected.total";
  private static final String METRIC_DEPENDENCY_ERROR_TOTAL = "arena.dependency.error.total";

  private final MeterRegistry meterRegistry;
  private final AtomicLong activeSessions = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> challengeCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> sessionEndCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> rejectionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dependencyErrorCounters = new ConcurrentHashMap<>();

  public ArenaMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_ACTIVE_SESSIONS, activeSessions, AtomicLong::get)
        .description("Sessions currently registered per channel")
        .register(meterRegistry);
  }

  public void updateActiveSessions(long count) {
    activeSessions.set(Math.max(0, count));
  }

  /** result: created/accepted/declined/expired */
  public void recordChallenge(String result) {
    challengeCounters.computeIfAbsent(result, this::registerChallengeCounter).increment();
  }

  public void recordSessionEnded(String kind, String reason) {
    sessionEndCounters
        .computeIfAbsent(kind + "|" + reason, key -> registerSessionEndCounter(kind, reason))
        .increment();
  }

  public void recordRejection(String code) {
    rejectionCounters.computeIfAbsent(code, this::registerRejectionCounter).increment();
  }

  public void recordDependencyError(String errorType) {
    dependencyErrorCounters
        .computeIfAbsent(errorType, this::registerDependencyErrorCounter)
        .increment();
  }

  private Counter registerChallengeCounter(String result) {
    return Counter.builder(METRIC_CHALLENGE_TOTAL)
        .tags(Tags.of("result", result))
        .register(meterRegistry);
  }

  private Counter registerSessionEndCounter(String kind, String reason) {
    return Counter.builder(METRIC_SESSION_END_TOTAL)
        .tags(Tags.of("kind", kind, "reason", reason))
        .register(meterRegistry);
  }

  private Counter registerRejectionCounter(String code) {
    return Counter.builder(METRIC_MOVE_REJECTED_TOTAL)
        .tags(Tags.of("code", code))
        .register(meterRegistry);
  }

  private Counter registerDependencyErrorCounter(String errorType) {
    return Counter.builder(METRIC_DEPENDENCY_ERROR_TOTAL)
        .tags(Tags.of("type", errorType))
        .register(meterRegistry);
  }
}
