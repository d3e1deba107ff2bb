package com.chatgames.arena.model;

public enum EndReason {
  /** 盤面上の勝敗/引き分けで終了した。 */
  COMPLETED,
  /** 双方合意で途中終了した。 */
  AGREEMENT,
  /** 無操作のまま AFK 閾値を超えて回収された。 */
  AFK,
  /** 描画先チャンネルが消え、対戦を続けられなくなった。 */
  UNREACHABLE
}
