package com.chatgames.arena.model;

/** 挑戦コマンドの生パラメータ。検証後に {@link ChallengeParams} へ変換する。 */
public record ChallengeOptions(String kind, String category, String grid) {}
