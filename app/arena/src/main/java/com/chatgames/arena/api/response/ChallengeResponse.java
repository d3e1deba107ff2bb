package com.chatgames.arena.api.response;

import com.chatgames.arena.model.ChallengeParams;
import com.chatgames.arena.model.ChallengeView;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChallengeResponse(
    String challengeId,
    String channelId,
    PlayerPayload proposer,
    PlayerPayload target,
    String kind,
    String category,
    String grid,
    String expiresAt) {

  public static ChallengeResponse from(ChallengeView view) {
    final ChallengeParams params = view.params();
    return new ChallengeResponse(
        view.challengeId(),
        view.channelId(),
        PlayerPayload.from(view.proposer()),
        PlayerPayload.from(view.target()),
        params.kind().value(),
        params.category(),
        params.grid() == null ? null : params.grid().label(),
        view.expiresAt().toString());
  }
}
