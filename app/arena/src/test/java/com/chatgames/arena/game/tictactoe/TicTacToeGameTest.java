package com.chatgames.arena.game.tictactoe;

import static org.assertj.core.api.Assertions.assertThat;

import com.chatgames.arena.game.MoveOutcome;
import com.chatgames.arena.model.Player;
import com.chatgames.arena.model.RejectionCode;
import java.util.List;
import org.junit.jupiter.api.Test;

class TicTacToeGameTest {

  private static final Player A = new Player("user-a", "A");
  private static final Player B = new Player("user-b", "B");

  @Test
  void topRowWinsForFirstPlayer() {
    final TicTacToeGame game = new TicTacToeGame(A, B, A);

    assertThat(game.place(A, 0, 0).type()).isEqualTo(PlacementType.PLACED);
    assertThat(game.place(B, 1, 0).type()).isEqualTo(PlacementType.PLACED);
    assertThat(game.place(A, 0, 1).type()).isEqualTo(PlacementType.PLACED);
    assertThat(game.place(B, 1, 1).type()).isEqualTo(PlacementType.PLACED);
    final PlacementOutcome last = game.place(A, 0, 2);

    assertThat(last.type()).isEqualTo(PlacementType.WIN);
    assertThat(last.winner()).isEqualTo(A);
    assertThat(last.mark()).isEqualTo(Mark.X);
    assertThat(game.isOver()).isTrue();
    assertThat(game.winner()).contains(A);
    assertThat(game.scoreOf(A)).isEqualTo(1);
    assertThat(game.scoreOf(B)).isZero();
  }

  @Test
  void secondPlayerCanStartAndKeepsMarkO() {
    final TicTacToeGame game = new TicTacToeGame(A, B, B);

    assertThat(game.currentPlayer()).contains(B);
    assertThat(game.place(B, 2, 2).mark()).isEqualTo(Mark.O);
    assertThat(game.cells().get(2).get(2)).isEqualTo("O");
    assertThat(game.currentPlayer()).contains(A);
  }

  @Test
  void rejectedPlacementsDoNotChangeBoard() {
    final TicTacToeGame game = new TicTacToeGame(A, B, A);
    game.place(A, 1, 1);
    final List<List<String>> before = game.cells();

    assertThat(game.place(A, 0, 0).rejection().code()).isEqualTo(RejectionCode.NOT_YOUR_TURN);
    assertThat(game.place(B, 1, 1).rejection().code()).isEqualTo(RejectionCode.INVALID_POSITION);
    assertThat(game.place(B, 3, 0).rejection().code()).isEqualTo(RejectionCode.INVALID_POSITION);
    assertThat(game.place(B, -1, 2).rejection().code())
        .isEqualTo(RejectionCode.INVALID_POSITION);
    assertThat(game.place(new Player("user-c", "C"), 0, 0).rejection().code())
        .isEqualTo(RejectionCode.NOT_A_PLAYER);

    assertThat(game.cells()).isEqualTo(before);
    assertThat(game.currentPlayer()).contains(B);
  }

  @Test
  void fullBoardWithoutLineIsDraw() {
    final TicTacToeGame game = new TicTacToeGame(A, B, A);
    // X O X / X O O / O X X
    game.place(A, 0, 0);
    game.place(B, 0, 1);
    game.place(A, 0, 2);
    game.place(B, 1, 1);
    game.place(A, 1, 0);
    game.place(B, 1, 2);
    game.place(A, 2, 1);
    game.place(B, 2, 0);
    final PlacementOutcome last = game.place(A, 2, 2);

    assertThat(last.type()).isEqualTo(PlacementType.DRAW);
    assertThat(game.isOver()).isTrue();
    assertThat(game.winner()).isEmpty();
    assertThat(game.place(B, 0, 0).rejection().code()).isEqualTo(RejectionCode.GAME_OVER);
  }

  @Test
  void playReportsEventsAndRejections() {
    final TicTacToeGame game = new TicTacToeGame(A, B, A);

    final MoveOutcome placed = game.play(A, new CellMove(0, 0));
    final MoveOutcome rejected = game.play(A, new CellMove(0, 1));

    assertThat(placed.event()).isEqualTo("PLACED");
    assertThat(rejected.isRejected()).isTrue();
    assertThat(rejected.rejection().code()).isEqualTo(RejectionCode.NOT_YOUR_TURN);
    assertThat(game.cells().get(0)).containsExactly("X", "", "");
  }
}
