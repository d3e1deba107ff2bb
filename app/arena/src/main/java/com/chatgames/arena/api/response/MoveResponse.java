/*
 * どこで: Arena API レスポンス DTO
 * 何を: 着手 1 回分の結果(イベント/文言/アクション/終了情報)を表す
 * なぜ: 盤面の再描画と終了告知をアダプタ側で判断できるようにするため
 */
package com.chatgames.arena.api.response;

import com.chatgames.arena.game.rps.RpsActionPayload;
import com.chatgames.arena.model.GameResult;
import com.chatgames.arena.model.MoveResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Locale;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MoveResponse(
    String event,
    String message,
    String action,
    boolean gameEnded,
    String winnerId,
    String endReason,
    SessionResponse session) {

  public static MoveResponse from(MoveResult result) {
    final RpsActionPayload action = result.action();
    final GameResult gameResult = result.result();
    return new MoveResponse(
        result.event(),
        result.message(),
        action == null ? null : action.describe(),
        result.gameEnded(),
        gameResult == null ? null : gameResult.winnerId(),
        gameResult == null ? null : gameResult.reason().name().toLowerCase(Locale.ROOT),
        SessionResponse.from(result.session()));
  }
}
