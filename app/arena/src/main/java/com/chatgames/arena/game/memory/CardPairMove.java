package com.chatgames.arena.game.memory;

import com.chatgames.arena.game.GameMove;

public record CardPairMove(Position first, Position second) implements GameMove {}
