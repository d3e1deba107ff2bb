/*
 * どこで: Memory-Match エンジン
 * 何を: 2 枚めくりの判定/手番/スコア/勝敗を管理する
 * なぜ: 盤面遷移を I/O から切り離し、セッション側のロックの内側で同期的に評価するため
 */
package com.chatgames.arena.game.memory;

import com.chatgames.arena.game.GameEngine;
import com.chatgames.arena.game.GameMove;
import com.chatgames.arena.game.MoveOutcome;
import com.chatgames.arena.model.GameKind;
import com.chatgames.arena.model.Player;
import com.chatgames.arena.model.RejectionCode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

public final class MemoryMatchGame implements GameEngine {

  private final Player player1;
  private final Player player2;
  private final String category;
  private final MemoryBoard board;
  private final OptionalInt winThreshold;
  private final Map<String, Integer> scores = new LinkedHashMap<>();

  private Player currentPlayer;
  // ペアは 2、ジョーカーは 1 として数える
  private int matchedHalfPairs;
  private boolean gameOver;
  private Player winner;

  public MemoryMatchGame(
      Player player1,
      Player player2,
      Player firstPlayer,
      String category,
      MemoryBoard board,
      OptionalInt winThreshold) {
    this.player1 = player1;
    this.player2 = player2;
    this.category = category;
    this.board = board;
    this.winThreshold = winThreshold;
    this.currentPlayer = firstPlayer.is(player2.id()) ? player2 : player1;
    scores.put(player1.id(), 0);
    scores.put(player2.id(), 0);
  }

  /**
   * 役割: 手番プレイヤーが選んだ 2 枚を判定する。
   * 動作:
   * - ジョーカーを含む: ジョーカーのみ確定、得点 +1、手番継続。
   * - 同じ絵柄: 2 枚確定、得点 +1、手番継続。
   * - 不一致: 2 枚とも伏せ直し、手番交代(手番が移るのはこの分岐だけ)。
   * - 判定後に勝敗を評価する。拒否時は状態を変えない。
   */
  public MemoryOutcome selectPair(Player player, Position first, Position second) {
    if (gameOver) {
      return MemoryOutcome.rejected(RejectionCode.GAME_OVER, "game is already over");
    }
    if (player == null || !hasPlayer(player.id())) {
      return MemoryOutcome.rejected(RejectionCode.NOT_A_PLAYER, "not a player of this game");
    }
    if (!currentPlayer.is(player.id())) {
      return MemoryOutcome.rejected(
          RejectionCode.NOT_YOUR_TURN, "it is " + currentPlayer.displayName() + "'s turn");
    }
    if (!board.contains(first) || !board.contains(second)) {
      return MemoryOutcome.rejected(RejectionCode.INVALID_POSITION, "position outside the grid");
    }
    if (first.equals(second)) {
      return MemoryOutcome.rejected(
          RejectionCode.INVALID_POSITION, "select two different cards");
    }
    final Card firstCard = board.cardAt(first);
    final Card secondCard = board.cardAt(second);
    if (firstCard.isMatched() || secondCard.isMatched()) {
      return MemoryOutcome.rejected(RejectionCode.INVALID_POSITION, "card is already matched");
    }

    firstCard.reveal();
    secondCard.reveal();
    final MemoryOutcomeType resolvedAs;
    if (firstCard.isJoker() || secondCard.isJoker()) {
      final Card joker = firstCard.isJoker() ? firstCard : secondCard;
      final Card other = joker == firstCard ? secondCard : firstCard;
      joker.markMatched();
      other.hide();
      addPoint(player);
      matchedHalfPairs += 1;
      resolvedAs = MemoryOutcomeType.JOKER;
    } else if (firstCard.symbol().equals(secondCard.symbol())) {
      firstCard.markMatched();
      secondCard.markMatched();
      addPoint(player);
      matchedHalfPairs += 2;
      resolvedAs = MemoryOutcomeType.MATCH;
    } else {
      firstCard.hide();
      secondCard.hide();
      currentPlayer = player.is(player1.id()) ? player2 : player1;
      resolvedAs = MemoryOutcomeType.NO_MATCH;
    }

    if (evaluate(player)) {
      return MemoryOutcome.gameOver(resolvedAs, firstCard, secondCard, winner);
    }
    return MemoryOutcome.resolved(resolvedAs, firstCard, secondCard);
  }

  // 優先順: (a) 盤サイズ別の閾値に到達した手番側の即勝利 (b) 全ペア消化時の得点比較
  private boolean evaluate(Player mover) {
    if (winThreshold.isPresent() && scoreOf(mover) >= winThreshold.getAsInt()) {
      finish(mover);
      return true;
    }
    if (matchedHalfPairs >= board.pairCount() * 2) {
      final int score1 = scoreOf(player1);
      final int score2 = scoreOf(player2);
      if (score1 > score2) {
        finish(player1);
      } else if (score2 > score1) {
        finish(player2);
      } else {
        finish(null);
      }
      return true;
    }
    return false;
  }

  private void finish(Player winningPlayer) {
    gameOver = true;
    winner = winningPlayer;
  }

  private void addPoint(Player player) {
    scores.merge(player.id(), 1, Integer::sum);
  }

  @Override
  public MoveOutcome play(Player player, GameMove move) {
    if (!(move instanceof CardPairMove pair)) {
      return MoveOutcome.unsupported(move, "memory match");
    }
    final MemoryOutcome outcome = selectPair(player, pair.first(), pair.second());
    if (outcome.type() == MemoryOutcomeType.REJECTED) {
      return MoveOutcome.rejected(outcome.rejection());
    }
    final String symbols = outcome.firstSymbol() + " " + outcome.secondSymbol();
    final MoveOutcome result =
        switch (outcome.type()) {
          case MATCH -> MoveOutcome.accepted("MATCH", "match " + symbols + ", go again");
          case JOKER -> MoveOutcome.accepted("JOKER", "joker found " + symbols + ", go again");
          case NO_MATCH -> MoveOutcome.accepted(
              "NO_MATCH", "no match " + symbols + ", " + currentPlayer.displayName() + "'s turn");
          default -> MoveOutcome.accepted("GAME_OVER", gameOverMessage(outcome));
        };
    return outcome.resolvedAs() == MemoryOutcomeType.NO_MATCH && !gameOver
        ? result.withHideAfterDelay(board.viewRevealing(List.of(pair.first(), pair.second())))
        : result;
  }

  private String gameOverMessage(MemoryOutcome outcome) {
    if (outcome.isTie()) {
      return "game over, it is a tie";
    }
    return "game over, " + outcome.winner().displayName() + " wins";
  }

  @Override
  public GameKind kind() {
    return GameKind.MEMORY_MATCH;
  }

  @Override
  public Player player1() {
    return player1;
  }

  @Override
  public Player player2() {
    return player2;
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
    return scores.getOrDefault(player.id(), 0);
  }

  @Override
  public List<List<String>> cells() {
    return board.view();
  }

  @Override
  public String phase() {
    return gameOver ? "GAME_OVER" : "IN_PROGRESS";
  }

  public String category() {
    return category;
  }

  public GridSize grid() {
    return board.grid();
  }

  public MemoryBoard board() {
    return board;
  }

  public int matchedPairs() {
    return matchedHalfPairs / 2;
  }

  public int pairsToFind() {
    return board.pairCount();
  }
}
