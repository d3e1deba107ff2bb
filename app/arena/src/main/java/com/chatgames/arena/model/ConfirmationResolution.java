package com.chatgames.arena.model;

public record ConfirmationResolution(
    ConfirmationView confirmation, Decision decision, boolean sessionEnded) {}
