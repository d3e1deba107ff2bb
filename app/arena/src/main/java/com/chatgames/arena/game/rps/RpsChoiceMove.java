package com.chatgames.arena.game.rps;

import com.chatgames.arena.game.GameMove;

public record RpsChoiceMove(RpsChoice choice) implements GameMove {}
