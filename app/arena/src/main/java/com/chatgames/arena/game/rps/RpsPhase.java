package com.chatgames.arena.game.rps;

public enum RpsPhase {
  /** Action バリアントのみ。両者が勝利時アクションを先に確定する。 */
  WAITING_FOR_ACTIONS,
  WAITING_FOR_CHOICES,
  RESOLVED
}
