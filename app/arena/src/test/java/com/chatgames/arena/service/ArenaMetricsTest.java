package com.chatgames.arena.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.junit.jupiter.api.Test;

class ArenaMetricsTest {

  @Test
  void updatesGaugeAndCounters() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final ArenaMetrics metrics = new ArenaMetrics(registry);

    metrics.updateActiveSessions(3);
    metrics.recordChallenge("created");
    metrics.recordChallenge("created");
    metrics.recordSessionEnded("memory", "afk");
    metrics.recordRejection("NOT_YOUR_TURN");
    metrics.recordDependencyError("persist");

    assertThat(registry.get("arena.sessions.active").gauge().value()).isEqualTo(3.0);
    assertThat(
            registry.get("arena.challenge.total").tag("result", "created").counter().count())
        .isEqualTo(2.0);
    assertThat(
            registry
                .get("arena.session.end.total")
                .tag("kind", "memory")
                .tag("reason", "afk")
                .counter()
                .count())
        .isEqualTo(1.0);
    assertThat(
            registry
                .get("arena.move.rejected.total")
                .tag("code", "NOT_YOUR_TURN")
                .counter()
                .count())
        .isEqualTo(1.0);
    assertThat(
            registry.get("arena.dependency.error.total").tag("type", "persist").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void clampsNegativeActiveSessions() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final ArenaMetrics metrics = new ArenaMetrics(registry);

    metrics.updateActiveSessions(-1);

    assertThat(registry.get("arena.sessions.active").gauge().value()).isZero();
  }

  @Test
  void activeSessionGaugeIsScrapedInPrometheusFormat() {
    final PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    final ArenaMetrics metrics = new ArenaMetrics(registry);

    metrics.updateActiveSessions(2);

    assertThat(registry.scrape()).contains("arena_sessions_active 2.0");
  }
}
