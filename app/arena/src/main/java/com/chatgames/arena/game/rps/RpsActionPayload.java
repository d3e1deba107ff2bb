package com.chatgames.arena.game.rps;

import com.chatgames.arena.model.Player;

/** 勝者(actor)が敗者(target)へ行うアクション。 */
public record RpsActionPayload(Player actor, Player target, String action) {

  public String describe() {
    return actor.displayName() + " " + action + " " + target.displayName();
  }
}
