/*
 * どこで: Tic-Tac-Toe エンジン
 * 何を: 3x3 の交互配置と 3 目並び/引き分け判定を行う
 * なぜ: 盤面遷移を純粋なロジックとして保ち、拒否時に状態が変わらないことを保証するため
 */
package com.chatgames.arena.game.tictactoe;

import com.chatgames.arena.game.GameEngine;
import com.chatgames.arena.game.GameMove;
import com.chatgames.arena.game.MoveOutcome;
import com.chatgames.arena.model.GameKind;
import com.chatgames.arena.model.Player;
import com.chatgames.arena.model.RejectionCode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public final class TicTacToeGame implements GameEngine {

  public static final int SIZE = 3;

  // 3 行 + 3 列 + 2 対角線
  private static final int[][][] LINES = {
    {{0, 0}, {0, 1}, {0, 2}},
    {{1, 0}, {1, 1}, {1, 2}},
    {{2, 0}, {2, 1}, {2, 2}},
    {{0, 0}, {1, 0}, {2, 0}},
    {{0, 1}, {1, 1}, {2, 1}},
    {{0, 2}, {1, 2}, {2, 2}},
    {{0, 0}, {1, 1}, {2, 2}},
    {{0, 2}, {1, 1}, {2, 0}}
  };

  private final Player playerX;
  private final Player playerO;
  private final Mark[][] board = new Mark[SIZE][SIZE];

  private Player currentPlayer;
  private int filled;
  private boolean gameOver;
  private Player winner;

  /** player1 が X、player2 が O。先手は firstPlayer。 */
  public TicTacToeGame(Player player1, Player player2, Player firstPlayer) {
    this.playerX = player1;
    this.playerO = player2;
    this.currentPlayer = firstPlayer.is(player2.id()) ? player2 : player1;
  }

  public PlacementOutcome place(Player player, int row, int col) {
    if (gameOver) {
      return PlacementOutcome.rejected(RejectionCode.GAME_OVER, "game is already over");
    }
    if (player == null || !hasPlayer(player.id())) {
      return PlacementOutcome.rejected(RejectionCode.NOT_A_PLAYER, "not a player of this game");
    }
    if (!currentPlayer.is(player.id())) {
      return PlacementOutcome.rejected(
          RejectionCode.NOT_YOUR_TURN, "it is " + currentPlayer.displayName() + "'s turn");
    }
    if (row < 0 || row >= SIZE || col < 0 || col >= SIZE) {
      return PlacementOutcome.rejected(
          RejectionCode.INVALID_POSITION, "cell (" + row + "," + col + ") is outside the board");
    }
    if (board[row][col] != null) {
      return PlacementOutcome.rejected(
          RejectionCode.INVALID_POSITION, "cell (" + row + "," + col + ") is already taken");
    }

    final Mark mark = markOf(player);
    board[row][col] = mark;
    filled++;
    if (hasLine(mark)) {
      gameOver = true;
      winner = player;
      return PlacementOutcome.win(mark, player);
    }
    if (filled == SIZE * SIZE) {
      gameOver = true;
      return PlacementOutcome.draw(mark);
    }
    currentPlayer = player.is(playerX.id()) ? playerO : playerX;
    return PlacementOutcome.placed(mark);
  }

  public Mark markOf(Player player) {
    return player.is(playerX.id()) ? Mark.X : Mark.O;
  }

  private boolean hasLine(Mark mark) {
    for (int[][] line : LINES) {
      boolean complete = true;
      for (int[] cell : line) {
        if (board[cell[0]][cell[1]] != mark) {
          complete = false;
          break;
        }
      }
      if (complete) {
        return true;
      }
    }
    return false;
  }

  @Override
  public MoveOutcome play(Player player, GameMove move) {
    if (!(move instanceof CellMove cell)) {
      return MoveOutcome.unsupported(move, "tic-tac-toe");
    }
    final PlacementOutcome outcome = place(player, cell.row(), cell.col());
    return switch (outcome.type()) {
      case REJECTED -> MoveOutcome.rejected(outcome.rejection());
      case WIN -> MoveOutcome.accepted("WIN", outcome.winner().displayName() + " wins");
      case DRAW -> MoveOutcome.accepted("DRAW", "board is full, it is a draw");
      case PLACED -> MoveOutcome.accepted(
          "PLACED", outcome.mark() + " placed, " + currentPlayer.displayName() + "'s turn");
    };
  }

  @Override
  public GameKind kind() {
    return GameKind.TIC_TAC_TOE;
  }

  @Override
  public Player player1() {
    return playerX;
  }

  @Override
  public Player player2() {
    return playerO;
  }

  @Override
  public Optional<Player> currentPlayer() {
    return gameOver ? Optional.empty() : Optional.of(currentPlayer);
  }

  @Override
  public boolean isOver() {
    return gameOver;
  }

  @Override
  public Optional<Player> winner() {
    return Optional.ofNullable(winner);
  }

  @Override
  public int scoreOf(Player player) {
    return winner != null && winner.is(player.id()) ? 1 : 0;
  }

  @Override
  public List<List<String>> cells() {
    final List<List<String>> rows = new ArrayList<>(SIZE);
    for (Mark[] row : board) {
      final List<String> line = new ArrayList<>(SIZE);
      for (Mark mark : row) {
        line.add(mark == null ? "" : mark.name());
      }
      rows.add(Collections.unmodifiableList(line));
    }
    return Collections.unmodifiableList(rows);
  }

  @Override
  public String phase() {
    return gameOver ? "GAME_OVER" : "IN_PROGRESS";
  }
}
