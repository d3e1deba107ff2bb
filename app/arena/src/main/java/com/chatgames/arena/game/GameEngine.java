/*
 * どこで: Arena ゲームエンジン共通
 * 何を: 盤面状態と遷移ロジックの共通契約を定義する
 * なぜ: セッション管理/AFK 回収/結果記録をゲーム種別から切り離すため
 */
package com.chatgames.arena.game;

import com.chatgames.arena.model.GameKind;
import com.chatgames.arena.model.Player;
import java.util.List;
import java.util.Optional;

/**
 * 1 セッションが専有する対戦状態。I/O は行わない。
 *
 * <p>スレッド安全ではない。呼び出し側がセッション単位で直列化する前提。
 */
public interface GameEngine {

  GameKind kind();

  Player player1();

  Player player2();

  /** 手番制でないゲーム(同時選択)では空。 */
  Optional<Player> currentPlayer();

  boolean isOver();

  /** 終了前、または引き分けでは空。 */
  Optional<Player> winner();

  int scoreOf(Player player);

  /**
   * 役割: 1 手を適用する。
   * 動作: 種別に合わない入力や規則違反は状態を変えずに拒否結果を返す。
   */
  MoveOutcome play(Player player, GameMove move);

  /** 描画用の盤面表現。伏せ札や未公開の選択は隠した状態で返す。 */
  List<List<String>> cells();

  String phase();

  default boolean hasPlayer(String playerId) {
    return player1().is(playerId) || player2().is(playerId);
  }

  default Optional<Player> opponentOf(String playerId) {
    if (player1().is(playerId)) {
      return Optional.of(player2());
    }
    if (player2().is(playerId)) {
      return Optional.of(player1());
    }
    return Optional.empty();
  }
}
