/*
 * どこで: Arena モデル
 * 何を: 終了したセッション 1 件分の結果を表す
 * なぜ: 終了経路(決着/合意/AFK)に関わらず、結果記録を単一の型で 1 回だけ行うため
 */
package com.chatgames.arena.model;

import java.time.Instant;

public record GameResult(
    String sessionId,
    GameKind kind,
    String channelId,
    Player player1,
    Player player2,
    Player winner,
    int player1Score,
    int player2Score,
    EndReason reason,
    Instant endedAt) {

  public String winnerId() {
    return winner == null ? null : winner.id();
  }

  /** 勝者なし(引き分け/合意終了/AFK 回収/描画先消失)。 */
  public boolean hasNoWinner() {
    return winner == null;
  }

  public Player loser() {
    if (winner == null) {
      return null;
    }
    return winner.is(player1.id()) ? player2 : player1;
  }
}
