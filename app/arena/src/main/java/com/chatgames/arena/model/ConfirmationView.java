package com.chatgames.arena.model;

import java.time.Instant;

public record ConfirmationView(
    String confirmationId,
    String sessionId,
    String channelId,
    Player requester,
    Player opponent,
    Instant createdAt,
    Instant expiresAt) {}
