/*
 * どこで: Arena API レスポンス DTO
 * 何を: セッションのスナップショットを応答形式で表す
 * なぜ: チャット側アダプタが盤面描画に必要な情報を 1 回の応答で受け取れるようにするため
 */
package com.chatgames.arena.api.response;

import com.chatgames.arena.model.Player;
import com.chatgames.arena.model.SessionSnapshot;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "スナップショット由来の不変コレクションをそのまま保持するため")
public record SessionResponse(
    String sessionId,
    String channelId,
    String kind,
    PlayerPayload player1,
    PlayerPayload player2,
    String currentPlayerId,
    Map<String, Integer> scores,
    List<List<String>> cells,
    String phase,
    boolean terminal,
    String winnerId,
    String startedAt,
    String lastActivity) {

  public static SessionResponse from(SessionSnapshot snapshot) {
    return new SessionResponse(
        snapshot.sessionId(),
        snapshot.channelId(),
        snapshot.kind().value(),
        PlayerPayload.from(snapshot.player1()),
        PlayerPayload.from(snapshot.player2()),
        idOf(snapshot.currentPlayer()),
        snapshot.scores(),
        snapshot.cells(),
        snapshot.phase(),
        snapshot.terminal(),
        idOf(snapshot.winner()),
        snapshot.startedAt().toString(),
        snapshot.lastActivity().toString());
  }

  private static String idOf(Player player) {
    return player == null ? null : player.id();
  }
}
