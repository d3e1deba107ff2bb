/*
 * どこで: Arena スケジューリング
 * 何を: Spring の TaskScheduler で遅延コールバックを実行し、取り消しハンドルを返す
 * なぜ: 期限タイマーをレコード側で保持し、解決時に確実に取り消せるようにするため
 */
package com.chatgames.arena.schedule;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TaskSchedulerGameScheduler implements GameScheduler {

  private static final Logger logger = LoggerFactory.getLogger(TaskSchedulerGameScheduler.class);

  private final TaskScheduler taskScheduler;
  private final Clock clock;

  @Override
  public CancelHandle after(Duration delay, Runnable callback) {
    final ScheduledFuture<?> future =
        taskScheduler.schedule(() -> runSafely(callback), clock.instant().plus(delay));
    return () -> future.cancel(false);
  }

  private void runSafely(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException ex) {
      logger.warn("scheduled game callback failed", ex);
    }
  }
}
