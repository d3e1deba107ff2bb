package com.chatgames.arena.game.rps;

import com.chatgames.arena.model.Rejection;
import com.chatgames.arena.model.RejectionCode;

public record RpsOutcome(RpsOutcomeType type, RpsResolution resolution, Rejection rejection) {

  static RpsOutcome recorded(RpsOutcomeType type) {
    return new RpsOutcome(type, null, null);
  }

  static RpsOutcome resolved(RpsResolution resolution) {
    return new RpsOutcome(RpsOutcomeType.RESOLVED, resolution, null);
  }

  static RpsOutcome rejected(RejectionCode code, String message) {
    return new RpsOutcome(RpsOutcomeType.REJECTED, null, Rejection.of(code, message));
  }
}
