package com.chatgames.arena.game.memory;

import com.chatgames.arena.model.Player;
import com.chatgames.arena.model.Rejection;
import com.chatgames.arena.model.RejectionCode;

/**
 * selectPair の結果。
 *
 * <p>GAME_OVER の winner が null のときは引き分け。resolvedAs は終了直前に成立した判定(MATCH/JOKER/NO_MATCH)。
 */
public record MemoryOutcome(
    MemoryOutcomeType type,
    MemoryOutcomeType resolvedAs,
    String firstSymbol,
    String secondSymbol,
    Player winner,
    Rejection rejection) {

  static MemoryOutcome resolved(MemoryOutcomeType type, Card first, Card second) {
    return new MemoryOutcome(type, type, first.symbol(), second.symbol(), null, null);
  }

  static MemoryOutcome gameOver(
      MemoryOutcomeType resolvedAs, Card first, Card second, Player winner) {
    return new MemoryOutcome(
        MemoryOutcomeType.GAME_OVER, resolvedAs, first.symbol(), second.symbol(), winner, null);
  }

  static MemoryOutcome rejected(RejectionCode code, String message) {
    return new MemoryOutcome(
        MemoryOutcomeType.REJECTED, null, null, null, null, Rejection.of(code, message));
  }

  public boolean isTie() {
    return type == MemoryOutcomeType.GAME_OVER && winner == null;
  }
}
