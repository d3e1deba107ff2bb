/*
 * どこで: Arena セッション管理
 * 何を: チャンネルで進行中の 1 対戦(エンジン/最終操作時刻/終了状態)を保持する
 * なぜ: 同一セッションへの操作をロックで直列化し、終了確定を 1 回に限定するため
 */
package com.chatgames.arena.session;

import com.chatgames.arena.game.GameEngine;
import com.chatgames.arena.model.EndReason;
import com.chatgames.arena.model.GameResult;
import com.chatgames.arena.model.Player;
import com.chatgames.arena.model.SessionSnapshot;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

public final class GameSession {

  private final String sessionId;
  private final String channelId;
  private final GameEngine engine;
  private final Instant startedAt;
  private final ReentrantLock lock = new ReentrantLock();

  private volatile Instant lastActivity;
  private volatile EndReason endReason;

  public GameSession(String sessionId, String channelId, GameEngine engine, Instant startedAt) {
    this.sessionId = sessionId;
    this.channelId = channelId;
    this.engine = engine;
    this.startedAt = startedAt;
    this.lastActivity = startedAt;
  }

  /** エンジンへの読み書きはすべてこの中で行う。 */
  public <T> T withLock(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public void touch(Instant now) {
    lastActivity = now;
  }

  public Duration idleFor(Instant now) {
    return Duration.between(lastActivity, now);
  }

  public boolean isTerminal() {
    return endReason != null;
  }

  public Optional<EndReason> endReason() {
    return Optional.ofNullable(endReason);
  }

  /**
   * 役割: セッションを終了状態にし、記録用の結果を組み立てる。
   * 動作: 最初の呼び出しだけが結果を受け取り、以降は空を返す。勝者は決着終了(COMPLETED)のときだけ付く。
   */
  public Optional<GameResult> markTerminal(EndReason reason, Instant endedAt) {
    return withLock(
        () -> {
          if (endReason != null) {
            return Optional.empty();
          }
          endReason = reason;
          final Player winner =
              reason == EndReason.COMPLETED ? engine.winner().orElse(null) : null;
          return Optional.of(
              new GameResult(
                  sessionId,
                  engine.kind(),
                  channelId,
                  engine.player1(),
                  engine.player2(),
                  winner,
                  engine.scoreOf(engine.player1()),
                  engine.scoreOf(engine.player2()),
                  reason,
                  endedAt));
        });
  }

  public SessionSnapshot snapshot() {
    return withLock(
        () -> {
          final Map<String, Integer> scores = new LinkedHashMap<>();
          scores.put(engine.player1().id(), engine.scoreOf(engine.player1()));
          scores.put(engine.player2().id(), engine.scoreOf(engine.player2()));
          final boolean terminal = endReason != null;
          final Player winner =
              endReason == EndReason.COMPLETED || (!terminal && engine.isOver())
                  ? engine.winner().orElse(null)
                  : null;
          return new SessionSnapshot(
              sessionId,
              channelId,
              engine.kind(),
              engine.player1(),
              engine.player2(),
              terminal ? null : engine.currentPlayer().orElse(null),
              scores,
              engine.cells(),
              terminal ? endReason.name() : engine.phase(),
              terminal,
              winner,
              startedAt,
              lastActivity);
        });
  }

  public String sessionId() {
    return sessionId;
  }

  public String channelId() {
    return channelId;
  }

  public GameEngine engine() {
    return engine;
  }

  public Instant startedAt() {
    return startedAt;
  }

  public Instant lastActivity() {
    return lastActivity;
  }
}
