package com.chatgames.arena.session;

/** 挑戦は (挑戦された側, チャンネル) につき 1 件まで。 */
public record ChallengeKey(String targetId, String channelId) {}
