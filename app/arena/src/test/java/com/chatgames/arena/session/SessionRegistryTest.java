/*
 * どこで: Arena セッション管理のテスト
 * 何を: チャンネル単位の排他登録、同時登録時の単一成立、再戦候補の取り合いと掃除を検証する
 * なぜ: 同一チャンネルで 2 件のセッションが成立する回帰を防ぐため
 */
package com.chatgames.arena.session;

import static org.assertj.core.api.Assertions.assertThat;

import com.chatgames.arena.game.tictactoe.TicTacToeGame;
import com.chatgames.arena.model.Player;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SessionRegistryTest {

  private static final Player A = new Player("user-a", "A");
  private static final Player B = new Player("user-b", "B");
  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private final SessionRegistry registry = new SessionRegistry();

  @Test
  void secondSessionInSameChannelIsRefused() {
    final GameSession first = session("ses-1", "channel-1");
    final GameSession second = session("ses-2", "channel-1");

    assertThat(registry.tryCreate("channel-1", first)).isTrue();
    assertThat(registry.tryCreate("channel-1", second)).isFalse();
    assertThat(registry.get("channel-1")).containsSame(first);
    assertThat(registry.tryCreate("channel-2", session("ses-3", "channel-2"))).isTrue();
    assertThat(registry.activeCount()).isEqualTo(2);
  }

  @Test
  void concurrentCreatesLetExactlyOneWin() throws Exception {
    final int threads = 8;
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        final GameSession candidate = session("ses-" + i, "channel-1");
        results.add(
            executor.submit(
                () -> {
                  start.await();
                  return registry.tryCreate("channel-1", candidate);
                }));
      }
      start.countDown();
      int winners = 0;
      for (Future<Boolean> result : results) {
        if (result.get(5, TimeUnit.SECONDS)) {
          winners++;
        }
      }
      assertThat(winners).isEqualTo(1);
      assertThat(registry.activeCount()).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void removeIsIdempotentAndKeepsNewerSession() {
    final GameSession old = session("ses-1", "channel-1");
    final GameSession newer = session("ses-2", "channel-1");
    registry.tryCreate("channel-1", old);
    registry.remove("channel-1");
    registry.remove("channel-1");
    registry.tryCreate("channel-1", newer);

    assertThat(registry.remove("channel-1", old)).isFalse();
    assertThat(registry.get("channel-1")).containsSame(newer);
  }

  @Test
  void finishedEntryCanBeClaimedOnce() {
    final GameSession done = session("ses-1", "channel-1");
    registry.rememberFinished(done, NOW);
    final FinishedSession entry = registry.finished("channel-1").orElseThrow();

    assertThat(registry.claimFinished("channel-1", entry)).isTrue();
    assertThat(registry.claimFinished("channel-1", entry)).isFalse();
    assertThat(registry.finished("channel-1")).isEmpty();
  }

  @Test
  void newSessionAndEvictionClearFinishedEntries() {
    registry.rememberFinished(session("ses-1", "channel-1"), NOW);
    registry.rememberFinished(session("ses-2", "channel-2"), NOW.plusSeconds(120));
    registry.tryCreate("channel-1", session("ses-3", "channel-1"));

    assertThat(registry.finished("channel-1")).isEmpty();
    assertThat(registry.evictFinishedBefore(NOW.plusSeconds(60))).isZero();
    assertThat(registry.evictFinishedBefore(NOW.plusSeconds(121))).isEqualTo(1);
    assertThat(registry.finished("channel-2")).isEmpty();
  }

  @Test
  void rematchStartsOnceAndConsumesOffer() {
    registry.rememberFinished(session("ses-1", "channel-1"), NOW);
    final FinishedSession entry = registry.finished("channel-1").orElseThrow();
    final AtomicInteger built = new AtomicInteger();

    final Optional<GameSession> started =
        registry.tryRematch(
            "channel-1",
            entry,
            claimed -> {
              built.incrementAndGet();
              return session("ses-2", "channel-1");
            });

    assertThat(started).isPresent();
    assertThat(registry.get("channel-1")).isEqualTo(started);
    assertThat(registry.finished("channel-1")).isEmpty();
    registry.remove("channel-1");
    assertThat(registry.tryRematch("channel-1", entry, claimed -> session("ses-3", "channel-1")))
        .isEmpty();
    assertThat(registry.get("channel-1")).isEmpty();
    assertThat(built).hasValue(1);
  }

  @Test
  void rematchIntoBusyChannelKeepsOfferAndDoesNotBuildEngine() {
    final GameSession busy = session("ses-2", "channel-1");
    registry.tryCreate("channel-1", busy);
    registry.rememberFinished(session("ses-1", "channel-1"), NOW);
    final FinishedSession entry = registry.finished("channel-1").orElseThrow();
    final AtomicInteger built = new AtomicInteger();

    final Optional<GameSession> started =
        registry.tryRematch(
            "channel-1",
            entry,
            claimed -> {
              built.incrementAndGet();
              return session("ses-3", "channel-1");
            });

    assertThat(started).isEmpty();
    assertThat(built).hasValue(0);
    assertThat(registry.get("channel-1")).containsSame(busy);
    assertThat(registry.finished("channel-1")).contains(entry);
  }

  private GameSession session(String sessionId, String channelId) {
    return new GameSession(sessionId, channelId, new TicTacToeGame(A, B, A), NOW);
  }
}
