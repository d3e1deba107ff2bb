package com.chatgames.arena.session;

import java.time.Instant;

/** 決着して登録解除されたセッション。再戦の受付元になる。 */
public record FinishedSession(GameSession session, Instant finishedAt) {}
