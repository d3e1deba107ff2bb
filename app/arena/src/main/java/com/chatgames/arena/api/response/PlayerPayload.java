package com.chatgames.arena.api.response;

import com.chatgames.arena.model.Player;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlayerPayload(String userId, String displayName) {

  public static PlayerPayload from(Player player) {
    return player == null ? null : new PlayerPayload(player.id(), player.displayName());
  }
}
