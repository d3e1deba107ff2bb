package com.chatgames.arena.model;

import com.chatgames.arena.game.rps.RpsActionPayload;

public record MoveResult(
    SessionSnapshot session,
    String event,
    String message,
    RpsActionPayload action,
    GameResult result) {

  public boolean gameEnded() {
    return result != null;
  }
}
