package com.chatgames.arena.game.tictactoe;

public enum Mark {
  X,
  O
}
