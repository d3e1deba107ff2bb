/*
 * どこで: Arena モデル
 * 何を: Dispatcher 入口の戻り値(成功 payload か型付き拒否のどちらか)を表す
 * なぜ: 想定内の失敗を例外で流さず、呼び出し側に描画判断を委ねるため
 */
package com.chatgames.arena.model;

import java.util.function.Function;

public record ActionResult<T>(T payload, Rejection rejection) {

  public static <T> ActionResult<T> ok(T payload) {
    return new ActionResult<>(payload, null);
  }

  public static <T> ActionResult<T> rejected(Rejection rejection) {
    return new ActionResult<>(null, rejection);
  }

  public static <T> ActionResult<T> rejected(RejectionCode code, String message) {
    return rejected(Rejection.of(code, message));
  }

  public boolean isOk() {
    return rejection == null;
  }

  public boolean isRejectedWith(RejectionCode code) {
    return rejection != null && rejection.code() == code;
  }

  /** 拒否はそのまま引き継ぎ、成功時だけ payload を変換する。 */
  public <R> ActionResult<R> map(Function<T, R> mapper) {
    if (!isOk()) {
      return rejected(rejection);
    }
    return ok(mapper.apply(payload));
  }
}
