package com.chatgames.arena.api.response;

import com.chatgames.arena.model.ConfirmationResolution;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Locale;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConfirmationDecisionResponse(
    String confirmationId, String decision, boolean sessionEnded) {

  public static ConfirmationDecisionResponse from(ConfirmationResolution resolution) {
    return new ConfirmationDecisionResponse(
        resolution.confirmation().confirmationId(),
        resolution.decision().name().toLowerCase(Locale.ROOT),
        resolution.sessionEnded());
  }
}
