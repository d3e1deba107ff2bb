package com.chatgames.arena.session;

import static org.assertj.core.api.Assertions.assertThat;

import com.chatgames.arena.game.tictactoe.CellMove;
import com.chatgames.arena.game.tictactoe.TicTacToeGame;
import com.chatgames.arena.model.EndReason;
import com.chatgames.arena.model.GameResult;
import com.chatgames.arena.model.Player;
import com.chatgames.arena.model.SessionSnapshot;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class GameSessionTest {

  private static final Player A = new Player("user-a", "A");
  private static final Player B = new Player("user-b", "B");
  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Test
  void markTerminalReturnsResultOnlyOnce() {
    final GameSession session = new GameSession("ses-1", "channel-1", wonByA(), NOW);

    final GameResult result = session.markTerminal(EndReason.COMPLETED, NOW).orElseThrow();

    assertThat(result.winner()).isEqualTo(A);
    assertThat(result.loser()).isEqualTo(B);
    assertThat(result.player1Score()).isEqualTo(1);
    assertThat(session.markTerminal(EndReason.AFK, NOW)).isEmpty();
    assertThat(session.endReason()).contains(EndReason.COMPLETED);
  }

  @Test
  void agreementCarriesNoWinnerEvenWhenBoardIsWon() {
    final GameSession session = new GameSession("ses-1", "channel-1", wonByA(), NOW);

    final GameResult result = session.markTerminal(EndReason.AGREEMENT, NOW).orElseThrow();

    assertThat(result.hasNoWinner()).isTrue();
    assertThat(result.loser()).isNull();
    assertThat(session.snapshot().winner()).isNull();
    assertThat(session.snapshot().phase()).isEqualTo("AGREEMENT");
  }

  @Test
  void snapshotReflectsTurnAndIdleTime() {
    final TicTacToeGame game = new TicTacToeGame(A, B, B);
    final GameSession session = new GameSession("ses-1", "channel-1", game, NOW);
    session.withLock(() -> game.play(B, new CellMove(1, 1)));
    session.touch(NOW.plusSeconds(30));

    final SessionSnapshot snapshot = session.snapshot();

    assertThat(snapshot.currentPlayer()).isEqualTo(A);
    assertThat(snapshot.cells().get(1).get(1)).isEqualTo("O");
    assertThat(snapshot.terminal()).isFalse();
    assertThat(snapshot.scores()).containsEntry("user-a", 0).containsEntry("user-b", 0);
    assertThat(session.idleFor(NOW.plusSeconds(90))).isEqualTo(Duration.ofSeconds(60));
  }

  private TicTacToeGame wonByA() {
    final TicTacToeGame game = new TicTacToeGame(A, B, A);
    game.place(A, 0, 0);
    game.place(B, 1, 0);
    game.place(A, 0, 1);
    game.place(B, 1, 1);
    game.place(A, 0, 2);
    return game;
  }
}
