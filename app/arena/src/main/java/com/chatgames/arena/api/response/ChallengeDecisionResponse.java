package com.chatgames.arena.api.response;

import com.chatgames.arena.model.ChallengeResolution;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Locale;

/** 辞退時は session が null。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChallengeDecisionResponse(
    String challengeId, String decision, SessionResponse session) {

  public static ChallengeDecisionResponse from(ChallengeResolution resolution) {
    return new ChallengeDecisionResponse(
        resolution.challenge().challengeId(),
        resolution.decision().name().toLowerCase(Locale.ROOT),
        resolution.session() == null ? null : SessionResponse.from(resolution.session()));
  }
}
