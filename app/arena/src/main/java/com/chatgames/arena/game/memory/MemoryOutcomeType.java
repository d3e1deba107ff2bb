package com.chatgames.arena.game.memory;

public enum MemoryOutcomeType {
  MATCH,
  JOKER,
  NO_MATCH,
  GAME_OVER,
  REJECTED
}
