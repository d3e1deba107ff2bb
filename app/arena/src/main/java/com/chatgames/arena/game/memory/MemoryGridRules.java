/*
 * どこで: Memory-Match エンジン
 * 何を: 盤サイズごとの即勝利スコア閾値を表として保持する
 * なぜ: 盤サイズ別の勝利条件を分岐で散らさず、設定から一箇所で引けるようにするため
 */
package com.chatgames.arena.game.memory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

public final class MemoryGridRules {

  private final Map<String, Integer> thresholds;

  public MemoryGridRules(Map<String, Integer> thresholds) {
    final Map<String, Integer> copy = new LinkedHashMap<>();
    if (thresholds != null) {
      thresholds.forEach(
          (label, score) ->
              GridSize.parse(label)
                  .filter(grid -> score != null && score > 0)
                  .ifPresent(grid -> copy.put(grid.label(), score)));
    }
    this.thresholds = Map.copyOf(copy);
  }

  /** 閾値が無い盤では全ペア消化まで勝敗を決めない。 */
  public OptionalInt winThreshold(GridSize grid) {
    final Integer threshold = thresholds.get(grid.label());
    return threshold == null ? OptionalInt.empty() : OptionalInt.of(threshold);
  }
}
