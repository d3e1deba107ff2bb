package com.chatgames.arena.api.response;

import com.chatgames.arena.model.ConfirmationView;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConfirmationResponse(
    String confirmationId,
    String sessionId,
    String channelId,
    PlayerPayload requester,
    PlayerPayload opponent,
    String expiresAt) {

  public static ConfirmationResponse from(ConfirmationView view) {
    return new ConfirmationResponse(
        view.confirmationId(),
        view.sessionId(),
        view.channelId(),
        PlayerPayload.from(view.requester()),
        PlayerPayload.from(view.opponent()),
        view.expiresAt().toString());
  }
}
