package com.chatgames.arena.game.memory;

import java.util.Locale;
import java.util.Optional;

/** Memory-Match の盤サイズ。ラベルは「列x行」(例: 4x5 は 4 列 5 行)。 */
public record GridSize(int columns, int rows) {

  public GridSize {
    if (columns <= 0 || rows <= 0) {
      throw new IllegalArgumentException("grid must be positive: " + columns + "x" + rows);
    }
  }

  public static Optional<GridSize> parse(String label) {
    if (label == null) {
      return Optional.empty();
    }
    final String[] parts = label.trim().toLowerCase(Locale.ROOT).split("x");
    if (parts.length != 2) {
      return Optional.empty();
    }
    try {
      final int columns = Integer.parseInt(parts[0].trim());
      final int rows = Integer.parseInt(parts[1].trim());
      if (columns <= 0 || rows <= 0) {
        return Optional.empty();
      }
      return Optional.of(new GridSize(columns, rows));
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
  }

  public String label() {
    return columns + "x" + rows;
  }

  public int cellCount() {
    return columns * rows;
  }

  public int pairCount() {
    return cellCount() / 2;
  }

  public boolean needsJoker() {
    return cellCount() % 2 == 1;
  }
}
