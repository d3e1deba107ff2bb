package com.chatgames.arena.model;

/** 承認時は開始したセッション、辞退時は session が null。 */
public record ChallengeResolution(
    ChallengeView challenge, Decision decision, SessionSnapshot session) {}
