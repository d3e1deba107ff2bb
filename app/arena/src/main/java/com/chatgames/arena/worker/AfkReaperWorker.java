package com.chatgames.arena.worker;

import com.chatgames.arena.config.ArenaProperties;
import com.chatgames.arena.service.AfkReaper;
import com.chatgames.arena.service.ArenaMetrics;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "arena.afk-worker-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class AfkReaperWorker {

  private static final Logger logger = LoggerFactory.getLogger(AfkReaperWorker.class);

  private final AfkReaper reaper;
  private final ArenaProperties properties;
  private final ArenaMetrics metrics;
  private final Clock clock;

  // 失敗後はこの時刻まで sweep を見送る
  private volatile Instant pausedUntil = Instant.MIN;

  public AfkReaperWorker(
      AfkReaper reaper, ArenaProperties properties, ArenaMetrics metrics, Clock clock) {
    this.reaper = reaper;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${arena.afk-sweep-interval}")
  public void run() {
    final Instant now = clock.instant();
    if (now.isBefore(pausedUntil)) {
      return;
    }
    try {
      reaper.sweep(now);
    } catch (RuntimeException ex) {
      pausedUntil = now.plus(properties.afkErrorBackoff());
      logger.warn("afk reaper failed, pausing until={}", pausedUntil, ex);
      metrics.recordDependencyError("reaper");
    }
  }

  @VisibleForTesting
  Instant pausedUntil() {
    return pausedUntil;
  }
}
