package com.chatgames.arena.model;

import com.chatgames.arena.game.memory.GridSize;

/** ゲーム種別ごとの挑戦パラメータ。category/grid は Memory-Match 以外では null。 */
public record ChallengeParams(GameKind kind, String category, GridSize grid) {

  public static ChallengeParams of(GameKind kind) {
    return new ChallengeParams(kind, null, null);
  }

  public static ChallengeParams memory(String category, GridSize grid) {
    return new ChallengeParams(GameKind.MEMORY_MATCH, category, grid);
  }
}
