/*
 * どこで: Arena ゲームエンジン共通
 * 何を: 1 手の適用結果をゲーム種別に依らない形へまとめる
 * なぜ: Dispatcher が種別ごとの Outcome を個別に解釈せずに描画/終了判定できるようにするため
 */
package com.chatgames.arena.game;

import com.chatgames.arena.game.rps.RpsActionPayload;
import com.chatgames.arena.model.Rejection;
import com.chatgames.arena.model.RejectionCode;
import java.util.List;

public record MoveOutcome(
    String event,
    String message,
    List<List<String>> revealedCells,
    RpsActionPayload action,
    Rejection rejection) {

  public static MoveOutcome accepted(String event, String message) {
    return new MoveOutcome(event, message, null, null, null);
  }

  public static MoveOutcome rejected(Rejection rejection) {
    return new MoveOutcome("REJECTED", rejection.message(), null, null, rejection);
  }

  public static MoveOutcome unsupported(GameMove move, String gameName) {
    final String moveName = move == null ? "null" : move.getClass().getSimpleName();
    return rejected(
        Rejection.of(
            RejectionCode.UNKNOWN_ENGINE_STATE, moveName + " does not apply to " + gameName));
  }

  /** 一時的に表向きで見せる盤面を付ける。描画後、一定時間で伏せた盤面を描き直す。 */
  public MoveOutcome withHideAfterDelay(List<List<String>> faceUpCells) {
    return new MoveOutcome(event, message, List.copyOf(faceUpCells), action, rejection);
  }

  public MoveOutcome withAction(RpsActionPayload payload) {
    return new MoveOutcome(event, message, revealedCells, payload, rejection);
  }

  public boolean hideAfterDelay() {
    return revealedCells != null;
  }

  public boolean isRejected() {
    return rejection != null;
  }
}
