package com.chatgames.arena.game.rps;

import com.chatgames.arena.game.GameMove;

public record RpsActionMove(String action) implements GameMove {}
