package com.chatgames.arena.game.rps;

import java.util.Locale;
import java.util.Optional;

public enum RpsChoice {
  ROCK,
  PAPER,
  SCISSORS;

  /** グー > チョキ、チョキ > パー、パー > グー。同じ手同士はどちらも勝たない。 */
  public boolean beats(RpsChoice other) {
    return switch (this) {
      case ROCK -> other == SCISSORS;
      case PAPER -> other == ROCK;
      case SCISSORS -> other == PAPER;
    };
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<RpsChoice> fromValue(String choice) {
    if (choice == null) {
      return Optional.empty();
    }
    for (RpsChoice rpsChoice : values()) {
      if (rpsChoice.value().equalsIgnoreCase(choice.trim())) {
        return Optional.of(rpsChoice);
      }
    }
    return Optional.empty();
  }
}
