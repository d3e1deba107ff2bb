package com.chatgames.arena.game.rps;

public enum RpsOutcomeType {
  ACTION_RECORDED,
  CHOICE_RECORDED,
  RESOLVED,
  REJECTED
}
