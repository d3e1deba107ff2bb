package com.chatgames.arena.model;

import java.util.Objects;

/** チャット利用者の参照。id で同一性を判定し、表示名は描画用に保持するだけ。 */
public record Player(String id, String displayName) {

  public Player {
    Objects.requireNonNull(id, "id");
    displayName = displayName == null || displayName.isBlank() ? id : displayName;
  }

  public boolean is(String playerId) {
    return id.equals(playerId);
  }
}
