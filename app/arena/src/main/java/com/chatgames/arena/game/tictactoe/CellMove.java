package com.chatgames.arena.game.tictactoe;

import com.chatgames.arena.game.GameMove;

public record CellMove(int row, int col) implements GameMove {}
