/*
 * どこで: Arena モデル
 * 何を: 対戦ゲームの種別と統計上のゲームIDを定義する
 * なぜ: RPS の 2 バリアントが同じ戦績枠を共有するため、種別と集計キーを分けて持つ
 */
package com.chatgames.arena.model;

import java.util.Optional;

public enum GameKind {
  MEMORY_MATCH("memory", "1001"),
  TIC_TAC_TOE("tictactoe", "1002"),
  RPS("rps", "1003"),
  RPS_ACTION("rps_action", "1003");

  private final String value;
  private final String statsGameId;

  GameKind(String value, String statsGameId) {
    this.value = value;
    this.statsGameId = statsGameId;
  }

  public String value() {
    return value;
  }

  public String statsGameId() {
    return statsGameId;
  }

  public static Optional<GameKind> fromValue(String kind) {
    if (kind == null) {
      return Optional.empty();
    }
    for (GameKind gameKind : values()) {
      if (gameKind.value.equalsIgnoreCase(kind.trim())) {
        return Optional.of(gameKind);
      }
    }
    return Optional.empty();
  }
}
