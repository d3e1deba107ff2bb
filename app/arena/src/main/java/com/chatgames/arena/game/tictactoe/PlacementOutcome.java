package com.chatgames.arena.game.tictactoe;

import com.chatgames.arena.model.Player;
import com.chatgames.arena.model.Rejection;
import com.chatgames.arena.model.RejectionCode;

public record PlacementOutcome(PlacementType type, Mark mark, Player winner, Rejection rejection) {

  static PlacementOutcome placed(Mark mark) {
    return new PlacementOutcome(PlacementType.PLACED, mark, null, null);
  }

  static PlacementOutcome win(Mark mark, Player winner) {
    return new PlacementOutcome(PlacementType.WIN, mark, winner, null);
  }

  static PlacementOutcome draw(Mark mark) {
    return new PlacementOutcome(PlacementType.DRAW, mark, null, null);
  }

  static PlacementOutcome rejected(RejectionCode code, String message) {
    return new PlacementOutcome(PlacementType.REJECTED, null, null, Rejection.of(code, message));
  }
}
