package com.chatgames.arena.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** 描画側へ渡すセッションの不変スナップショット。currentPlayer/winner は該当なしで null。 */
public record SessionSnapshot(
    String sessionId,
    String channelId,
    GameKind kind,
    Player player1,
    Player player2,
    Player currentPlayer,
    Map<String, Integer> scores,
    List<List<String>> cells,
    String phase,
    boolean terminal,
    Player winner,
    Instant startedAt,
    Instant lastActivity) {

  public SessionSnapshot {
    scores = Map.copyOf(scores);
    cells = List.copyOf(cells);
  }

  /** 盤面だけを差し替えたコピー。 */
  public SessionSnapshot withCells(List<List<String>> replacement) {
    return new SessionSnapshot(
        sessionId,
        channelId,
        kind,
        player1,
        player2,
        currentPlayer,
        scores,
        replacement,
        phase,
        terminal,
        winner,
        startedAt,
        lastActivity);
  }
}
