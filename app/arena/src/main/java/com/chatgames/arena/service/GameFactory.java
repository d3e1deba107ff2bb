/*
 * どこで: Arena サービス層
 * 何を: 挑戦パラメータからゲームエンジンを生成し、再戦時のエンジンを用意する
 * なぜ: 先手決定/カテゴリ選択/配札の乱数を 1 箇所に集め、テストで固定できるようにするため
 */
package com.chatgames.arena.service;

import com.chatgames.arena.config.MemoryMatchProperties;
import com.chatgames.arena.game.GameEngine;
import com.chatgames.arena.game.memory.EmojiCategories;
import com.chatgames.arena.game.memory.GridSize;
import com.chatgames.arena.game.memory.MemoryBoard;
import com.chatgames.arena.game.memory.MemoryGridRules;
import com.chatgames.arena.game.memory.MemoryMatchGame;
import com.chatgames.arena.game.rps.RpsGame;
import com.chatgames.arena.game.tictactoe.TicTacToeGame;
import com.chatgames.arena.model.ChallengeParams;
import com.chatgames.arena.model.Player;
import com.google.common.annotations.VisibleForTesting;
import java.security.SecureRandom;
import java.util.List;
import java.util.Random;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class GameFactory {

  private final MemoryMatchProperties memoryProperties;
  private final MemoryGridRules gridRules;
  private final Random random;

  @Autowired
  public GameFactory(MemoryMatchProperties memoryProperties) {
    this(memoryProperties, new SecureRandom());
  }

  @VisibleForTesting
  GameFactory(MemoryMatchProperties memoryProperties, Random random) {
    this.memoryProperties = memoryProperties;
    this.gridRules = memoryProperties.gridRules();
    this.random = random;
  }

  /** player1 は挑戦者、player2 は挑戦された側。Memory-Match と Tic-Tac-Toe の先手はランダム。 */
  public GameEngine create(ChallengeParams params, Player proposer, Player target) {
    return switch (params.kind()) {
      case MEMORY_MATCH -> newMemoryGame(proposer, target, params.category(), params.grid());
      case TIC_TAC_TOE -> new TicTacToeGame(proposer, target, pickFirst(proposer, target));
      case RPS -> new RpsGame(proposer, target, false);
      case RPS_ACTION -> new RpsGame(proposer, target, true);
    };
  }

  /**
   * 役割: 決着済みエンジンから同じ 2 人の次の対戦を用意する。
   * 動作: Memory-Match はカテゴリを選び直して同じ盤サイズで配り直す。RPS は同じエンジンを reset する。
   */
  public GameEngine rematch(GameEngine finished) {
    if (finished instanceof RpsGame rps) {
      rps.reset();
      return rps;
    }
    if (finished instanceof MemoryMatchGame memory) {
      return newMemoryGame(memory.player1(), memory.player2(), null, memory.grid());
    }
    if (finished instanceof TicTacToeGame) {
      return new TicTacToeGame(
          finished.player1(),
          finished.player2(),
          pickFirst(finished.player1(), finished.player2()));
    }
    throw new IllegalArgumentException("unsupported engine: " + finished.getClass().getName());
  }

  private MemoryMatchGame newMemoryGame(
      Player proposer, Player target, String requestedCategory, GridSize requestedGrid) {
    final String category =
        requestedCategory == null ? EmojiCategories.random(random) : requestedCategory;
    final List<String> symbols =
        EmojiCategories.symbolsOf(category)
            .orElseThrow(() -> new IllegalArgumentException("unknown category: " + category));
    final GridSize grid =
        requestedGrid != null
            ? requestedGrid
            : memoryProperties
                .resolveGrid(null)
                .orElseThrow(() -> new IllegalStateException("default grid is not allowed"));
    final MemoryBoard board = MemoryBoard.deal(grid, symbols, random);
    return new MemoryMatchGame(
        proposer,
        target,
        pickFirst(proposer, target),
        category,
        board,
        gridRules.winThreshold(grid));
  }

  private Player pickFirst(Player first, Player second) {
    return random.nextBoolean() ? first : second;
  }
}
