package com.chatgames.arena.repository;

public record PlayerStats(String userId, String gameId, String displayName, int wins, int losses) {}
