package com.chatgames.arena.game.tictactoe;

public enum PlacementType {
  PLACED,
  WIN,
  DRAW,
  REJECTED
}
