/*
 * どこで: Arena 設定
 * 何を: 挑戦/終了確認の有効期限、AFK 回収、再戦受付の時間設定を保持する
 * なぜ: 時間閾値を環境ごとに調整し、不正値を起動時に検出するため
 */
package com.chatgames.arena.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "arena")
@Validated
public record ArenaProperties(
    @NotNull Duration challengeTimeout,
    @NotNull Duration confirmationTimeout,
    @NotNull Duration afkTimeout,
    @NotNull Duration afkSweepInterval,
    @NotNull Duration afkErrorBackoff,
    @NotNull Duration rematchWindow,
    boolean afkWorkerEnabled) {

  @AssertTrue(message = "arena.challenge-timeout must be positive")
  public boolean isChallengeTimeoutPositive() {
    return isPositiveDuration(challengeTimeout);
  }

  @AssertTrue(message = "arena.confirmation-timeout must be positive")
  public boolean isConfirmationTimeoutPositive() {
    return isPositiveDuration(confirmationTimeout);
  }

  @AssertTrue(message = "arena.afk-timeout must be positive")
  public boolean isAfkTimeoutPositive() {
    return isPositiveDuration(afkTimeout);
  }

  @AssertTrue(message = "arena.afk-sweep-interval must be positive")
  public boolean isAfkSweepIntervalPositive() {
    return isPositiveDuration(afkSweepInterval);
  }

  @AssertTrue(message = "arena.afk-error-backoff must not be negative")
  public boolean isAfkErrorBackoffNotNegative() {
    // 0 は「待たずに次の tick で再試行」として許容する。
    return afkErrorBackoff == null || !afkErrorBackoff.isNegative();
  }

  @AssertTrue(message = "arena.rematch-window must be positive")
  public boolean isRematchWindowPositive() {
    return isPositiveDuration(rematchWindow);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null は @NotNull で検出する前提。
    return duration == null || (!duration.isZero() && !duration.isNegative());
  }
}
