/*
 * どこで: Arena 設定のバリデーションテスト
 * 何を: ArenaProperties の Bean Validation を検証する
 * なぜ: 0 や負の時間設定を起動時に検出できるようにするため
 */
package com.chatgames.arena.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ArenaPropertiesValidationTest {

  private static final Duration MINUTE = Duration.ofSeconds(60);
  private static final Duration AFK = Duration.ofSeconds(180);
  private static final Duration SWEEP = Duration.ofSeconds(10);
  private static final Duration BACKOFF = Duration.ofSeconds(30);
  private static final Duration REMATCH = Duration.ofMinutes(5);

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void validationPassesWhenAllFieldsValid() {
    final ArenaProperties properties =
        new ArenaProperties(MINUTE, MINUTE, AFK, SWEEP, BACKOFF, REMATCH, true);

    assertThat(validator.validate(properties)).isEmpty();
  }

  @Test
  void validationFailsWhenAfkTimeoutIsZero() {
    final ArenaProperties properties =
        new ArenaProperties(MINUTE, MINUTE, Duration.ZERO, SWEEP, BACKOFF, REMATCH, true);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void validationFailsWhenChallengeTimeoutIsMissing() {
    final ArenaProperties properties =
        new ArenaProperties(null, MINUTE, AFK, SWEEP, BACKOFF, REMATCH, true);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void zeroBackoffIsAllowed() {
    final ArenaProperties properties =
        new ArenaProperties(MINUTE, MINUTE, AFK, SWEEP, Duration.ZERO, REMATCH, false);

    assertThat(validator.validate(properties)).isEmpty();
  }

  @Test
  void validationFailsWhenBackoffIsNegative() {
    final ArenaProperties properties =
        new ArenaProperties(
            MINUTE, MINUTE, AFK, SWEEP, Duration.ofSeconds(-1), REMATCH, true);

    assertThat(validator.validate(properties)).isNotEmpty();
  }
}
