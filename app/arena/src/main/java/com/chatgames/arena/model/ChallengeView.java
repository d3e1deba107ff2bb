package com.chatgames.arena.model;

import java.time.Instant;

public record ChallengeView(
    String challengeId,
    String channelId,
    Player proposer,
    Player target,
    ChallengeParams params,
    Instant createdAt,
    Instant expiresAt) {}
