/*
 * どこで: Arena API
 * 何を: ディスパッチャが返した拒否を HTTP 層へ運ぶ
 * なぜ: 拒否コードごとのステータス変換を ApiExceptionHandler に集約するため
 */
package com.chatgames.arena.api;

import com.chatgames.arena.model.Rejection;

public class ArenaActionRejectedException extends RuntimeException {

  private final transient Rejection rejection;

  public ArenaActionRejectedException(Rejection rejection) {
    super(rejection.message());
    this.rejection = rejection;
  }

  public Rejection rejection() {
    return rejection;
  }
}
