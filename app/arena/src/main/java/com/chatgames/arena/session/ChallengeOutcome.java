package com.chatgames.arena.session;

import com.chatgames.arena.model.Decision;

public record ChallengeOutcome(PendingChallenge challenge, Decision decision) {}
