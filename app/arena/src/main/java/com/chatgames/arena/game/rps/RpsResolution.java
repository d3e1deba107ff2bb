package com.chatgames.arena.game.rps;

import com.chatgames.arena.model.Player;

/** winner/loser が null なら引き分け。引き分けでは action も null。 */
public record RpsResolution(
    RpsChoice player1Choice,
    RpsChoice player2Choice,
    Player winner,
    Player loser,
    RpsActionPayload action) {

  public boolean isTie() {
    return winner == null;
  }
}
